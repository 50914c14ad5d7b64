/*
 * CompressionResult.java
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

import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.Codebook;
import org.bluezoo.huffman.tree.FrequencyTable;
import org.bluezoo.huffman.tree.HuffmanNode;
import org.bluezoo.huffman.tree.SerializedTree;

/**
 * Everything produced by compressing one input.
 *
 * <p>Decoding needs the payload and the tree, either as the
 * {@link #getTree() tree} itself or its {@link #getSerializedTree()
 * serialized form}. For an empty input there is no tree: the tree is
 * null, the serialized tree and codebook are empty, and the payload is
 * {@link CompressedPayload#EMPTY}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CompressionResult {

    private final CompressedPayload payload;
    private final HuffmanNode tree;
    private final SerializedTree serializedTree;
    private final Codebook codebook;
    private final FrequencyTable frequencies;
    private final CompressionStats stats;

    CompressionResult(CompressedPayload payload, HuffmanNode tree, SerializedTree serializedTree,
                      Codebook codebook, FrequencyTable frequencies, CompressionStats stats) {
        this.payload = payload;
        this.tree = tree;
        this.serializedTree = serializedTree;
        this.codebook = codebook;
        this.frequencies = frequencies;
        this.stats = stats;
    }

    /**
     * Returns the packed code bits.
     *
     * @return the payload
     */
    public CompressedPayload getPayload() {
        return payload;
    }

    /**
     * Returns the code tree.
     *
     * @return the root of the tree, or null for an empty input
     */
    public HuffmanNode getTree() {
        return tree;
    }

    /**
     * Returns the code tree in its external form.
     *
     * @return the serialized tree, {@link SerializedTree#EMPTY} for an
     * empty input
     */
    public SerializedTree getSerializedTree() {
        return serializedTree;
    }

    /**
     * Returns the codes the input was encoded with.
     *
     * @return the codebook, {@link Codebook#EMPTY} for an empty input
     */
    public Codebook getCodebook() {
        return codebook;
    }

    /**
     * Returns the symbol counts of the input.
     *
     * @return the frequency table
     */
    public FrequencyTable getFrequencies() {
        return frequencies;
    }

    /**
     * Returns the compression statistics.
     *
     * @return the statistics
     */
    public CompressionStats getStats() {
        return stats;
    }

    /**
     * Indicates whether the input was empty.
     *
     * @return true if there is no tree
     */
    public boolean isEmpty() {
        return tree == null;
    }

}
