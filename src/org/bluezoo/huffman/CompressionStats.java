/*
 * CompressionStats.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of huffman, a Huffman entropy coding library.
 *
 * huffman is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * huffman is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with huffman.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.huffman;

import org.bluezoo.huffman.tree.TreeStatistics;

/**
 * Informational figures about one compression.
 *
 * <p>The original size is taken as 8 bits per input symbol. Nothing in
 * these statistics is used to decode; they are for reporting only.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CompressionStats {

    private final long symbolCount;
    private final int distinctSymbols;
    private final long compressedBits;
    private final double entropy;
    private final TreeStatistics treeStatistics;
    private final long elapsedNanos;

    CompressionStats(long symbolCount, int distinctSymbols, long compressedBits,
                     double entropy, TreeStatistics treeStatistics, long elapsedNanos) {
        this.symbolCount = symbolCount;
        this.distinctSymbols = distinctSymbols;
        this.compressedBits = compressedBits;
        this.entropy = entropy;
        this.treeStatistics = treeStatistics;
        this.elapsedNanos = elapsedNanos;
    }

    static CompressionStats empty(long elapsedNanos) {
        return new CompressionStats(0L, 0, 0L, 0.0, TreeStatistics.EMPTY, elapsedNanos);
    }

    /**
     * Indicates whether the input was empty, in which case every figure
     * is zero.
     *
     * @return true if there was no data
     */
    public boolean isEmpty() {
        return symbolCount == 0L;
    }

    /**
     * Returns the number of input symbols.
     *
     * @return the input length
     */
    public long getSymbolCount() {
        return symbolCount;
    }

    /**
     * Returns the number of distinct input symbols.
     *
     * @return the alphabet size of the input
     */
    public int getDistinctSymbols() {
        return distinctSymbols;
    }

    /**
     * Returns the size of the input in bits.
     *
     * @return 8 times the symbol count
     */
    public long getOriginalBits() {
        return symbolCount * HuffmanConstants.BITS_PER_SYMBOL;
    }

    /**
     * Returns the number of code bits produced, excluding padding.
     *
     * @return the compressed bit length
     */
    public long getCompressedBits() {
        return compressedBits;
    }

    /**
     * Returns the number of bits saved by compression.
     * This is negative when the code is longer than the input.
     *
     * @return original bits minus compressed bits
     */
    public long getBitsSaved() {
        return getOriginalBits() - compressedBits;
    }

    /**
     * Returns the compressed size relative to the original size.
     *
     * @return compressed bits divided by original bits, 0 for empty input
     */
    public double getCompressionRatio() {
        long originalBits = getOriginalBits();
        return (originalBits == 0L) ? 0.0 : (double) compressedBits / originalBits;
    }

    /**
     * Returns the proportion of the original size saved, in percent.
     *
     * @return the space saving percentage, 0 for empty input
     */
    public double getCompressionRate() {
        long originalBits = getOriginalBits();
        return (originalBits == 0L) ? 0.0 : (double) getBitsSaved() * 100.0 / originalBits;
    }

    /**
     * Returns how many times smaller the compressed form is.
     *
     * @return original bits divided by compressed bits, 0 for empty input
     */
    public double getCompressionFactor() {
        return (compressedBits == 0L) ? 0.0 : (double) getOriginalBits() / compressedBits;
    }

    /**
     * Returns the Shannon entropy of the input in bits per symbol.
     *
     * @return the entropy
     */
    public double getEntropy() {
        return entropy;
    }

    /**
     * Returns how close the code comes to the entropy bound.
     *
     * @return entropy divided by the mean code length per symbol,
     * 0 for empty input
     */
    public double getCodingEfficiency() {
        double weighted = treeStatistics.getWeightedCodeLength();
        return (weighted == 0.0) ? 0.0 : entropy / weighted;
    }

    /**
     * Returns the shape of the code tree.
     *
     * @return the tree statistics, {@link TreeStatistics#EMPTY} for empty input
     */
    public TreeStatistics getTreeStatistics() {
        return treeStatistics;
    }

    /**
     * Returns the time spent compressing.
     *
     * @return the elapsed time in nanoseconds
     */
    public long getElapsedNanos() {
        return elapsedNanos;
    }

    @Override
    public String toString() {
        return "CompressionStats{symbols=" + symbolCount
                + ", distinct=" + distinctSymbols
                + ", originalBits=" + getOriginalBits()
                + ", compressedBits=" + compressedBits
                + ", ratio=" + getCompressionRatio()
                + ", entropy=" + entropy + "}";
    }

}
