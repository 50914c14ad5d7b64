/*
 * TreeStatistics.java
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

package org.bluezoo.huffman.tree;

/**
 * Shape of a code tree: height, node counts and code lengths.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TreeStatistics {

    /** Statistics of the absent tree of an empty input. */
    public static final TreeStatistics EMPTY = new TreeStatistics(0, 0, 0, 0.0, 0.0);

    private final int height;
    private final int leafCount;
    private final int internalCount;
    private final double averageCodeLength;
    private final double weightedCodeLength;

    private TreeStatistics(int height, int leafCount, int internalCount,
                           double averageCodeLength, double weightedCodeLength) {
        this.height = height;
        this.leafCount = leafCount;
        this.internalCount = internalCount;
        this.averageCodeLength = averageCodeLength;
        this.weightedCodeLength = weightedCodeLength;
    }

    /**
     * Computes the statistics of a tree and its codebook.
     *
     * @param root the root of the tree
     * @param codebook the codebook derived from the tree
     * @return the statistics
     */
    public static TreeStatistics of(HuffmanNode root, Codebook codebook) {
        int[] counts = new int[2];
        int height = measure(root, counts);
        int[] symbols = codebook.symbols();
        long totalLength = 0L;
        for (int i = 0; i < symbols.length; i++) {
            totalLength += codebook.getCodeLength(symbols[i]);
        }
        long weightedLength = weighted(root, codebook);
        long weight = root.getFrequency();
        double average = (symbols.length == 0) ? 0.0 : (double) totalLength / symbols.length;
        double weighted = (weight == 0L) ? 0.0 : (double) weightedLength / weight;
        return new TreeStatistics(height, counts[0], counts[1], average, weighted);
    }

    // Returns the height below node; counts[0] accumulates leaves and
    // counts[1] internal nodes.
    private static int measure(HuffmanNode node, int[] counts) {
        if (node.isLeaf()) {
            counts[0]++;
            return 0;
        }
        counts[1]++;
        HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
        int left = measure(internal.getLeft(), counts);
        int right = measure(internal.getRight(), counts);
        return 1 + Math.max(left, right);
    }

    // Sum of frequency x code length over the leaves below node.
    private static long weighted(HuffmanNode node, Codebook codebook) {
        if (node.isLeaf()) {
            int symbol = ((HuffmanNode.Leaf) node).getSymbol();
            return node.getFrequency() * codebook.getCodeLength(symbol);
        }
        HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
        return weighted(internal.getLeft(), codebook) + weighted(internal.getRight(), codebook);
    }

    /**
     * Returns the number of edges on the longest path from the root to a
     * leaf. A single-leaf tree has height 0.
     *
     * @return the tree height
     */
    public int getHeight() {
        return height;
    }

    /**
     * Returns the number of leaves, which is the number of distinct symbols.
     *
     * @return the leaf count
     */
    public int getLeafCount() {
        return leafCount;
    }

    /**
     * Returns the number of internal nodes, one less than the leaf count
     * for any tree of more than one leaf.
     *
     * @return the internal node count
     */
    public int getInternalNodeCount() {
        return internalCount;
    }

    /**
     * Returns the mean code length over the distinct symbols, ignoring
     * how often each occurs.
     *
     * @return the average code length in bits
     */
    public double getAverageCodeLength() {
        return averageCodeLength;
    }

    /**
     * Returns the mean number of code bits per encoded symbol.
     *
     * @return the frequency-weighted average code length in bits
     */
    public double getWeightedCodeLength() {
        return weightedCodeLength;
    }

    @Override
    public String toString() {
        return "TreeStatistics{height=" + height
                + ", leaves=" + leafCount
                + ", internal=" + internalCount
                + ", averageCodeLength=" + averageCodeLength
                + ", weightedCodeLength=" + weightedCodeLength + "}";
    }

}
