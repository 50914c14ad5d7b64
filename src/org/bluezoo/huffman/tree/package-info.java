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
 * Code trees and the codes derived from them.
 *
 * <p>{@link org.bluezoo.huffman.tree.HuffmanTreeBuilder} turns a
 * {@link org.bluezoo.huffman.tree.FrequencyTable} into a tree of
 * {@link org.bluezoo.huffman.tree.HuffmanNode}s, from which a
 * {@link org.bluezoo.huffman.tree.Codebook} is derived.
 * {@link org.bluezoo.huffman.tree.TreeCodec} converts trees to and from
 * their stable external form.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.huffman.tree;
