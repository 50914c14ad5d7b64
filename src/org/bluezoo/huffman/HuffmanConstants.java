/*
 * HuffmanConstants.java
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

/**
 * Constants shared by the code generator, the encoder and the decoder.
 *
 * <p>The edge-to-bit convention lives here and only here: the codebook
 * appends {@link #LEFT_BIT} for every step to a left child and
 * {@link #RIGHT_BIT} for every step to a right child, and the decoder
 * follows the same mapping back down the tree.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffmanConstants {

    /** Bit emitted for an edge to a left child. */
    public static final int LEFT_BIT = 0;

    /** Bit emitted for an edge to a right child. */
    public static final int RIGHT_BIT = 1;

    /**
     * Code given to the only symbol of a single-leaf tree.
     * An empty code could not be packed, so one bit is used per occurrence.
     */
    public static final int SINGLE_SYMBOL_BIT = LEFT_BIT;

    /** Number of distinct symbol values (symbols are bytes). */
    public static final int ALPHABET_SIZE = 256;

    /** Bits per input symbol, used as the uncompressed baseline. */
    public static final int BITS_PER_SYMBOL = 8;

    /** Property enabling the runtime prefix check of generated codebooks. */
    public static final String VERIFY_CODEBOOK_PROPERTY = "org.bluezoo.huffman.verifyCodebook";

    /** Property enabling a decode-and-compare check after each compression. */
    public static final String VERIFY_ROUND_TRIP_PROPERTY = "org.bluezoo.huffman.verifyRoundTrip";

    /** Property limiting the depth of serialized trees accepted on input. */
    public static final String MAX_TREE_DEPTH_PROPERTY = "org.bluezoo.huffman.maxTreeDepth";

    /**
     * Default maximum tree depth.
     * A strict binary tree over 256 leaves is at most 255 edges deep.
     */
    public static final int DEFAULT_MAX_TREE_DEPTH = 256;

    private HuffmanConstants() {
    }

}
