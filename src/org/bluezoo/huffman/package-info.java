/*
 * package-info.java
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

/**
 * Huffman entropy coding.
 *
 * <p>This package compresses a sequence of byte symbols with an optimal
 * prefix code built for that sequence, and decompresses it back to the
 * exact original.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.huffman.HuffmanCompressor} - Compresses and
 *       decompresses complete inputs</li>
 *   <li>{@link org.bluezoo.huffman.Encoder} - Maps symbols through a
 *       codebook into packed bits</li>
 *   <li>{@link org.bluezoo.huffman.Decoder} - Walks the code tree to
 *       recover the symbols</li>
 *   <li>{@link org.bluezoo.huffman.HuffmanArchive} - Frames a tree and
 *       payload for storage</li>
 *   <li>{@link org.bluezoo.huffman.CompressionStats} - Sizes, ratios and
 *       tree shape of one compression</li>
 * </ul>
 *
 * <h2>Data Flow</h2>
 *
 * <p>Compression: data, {@link org.bluezoo.huffman.tree.FrequencyTable},
 * {@link org.bluezoo.huffman.tree.HuffmanNode} tree,
 * {@link org.bluezoo.huffman.tree.Codebook},
 * {@link org.bluezoo.huffman.bits.CompressedPayload}. Decompression walks
 * the tree over the payload bits; it never needs the codebook.
 *
 * <h2>Errors</h2>
 *
 * <p>All failures are subclasses of
 * {@link org.bluezoo.huffman.HuffmanException}. Empty input and input
 * consisting of a single distinct symbol are not errors.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.huffman;
