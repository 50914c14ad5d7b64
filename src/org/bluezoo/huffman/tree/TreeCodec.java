/*
 * TreeCodec.java
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

import java.io.ByteArrayOutputStream;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffman.HuffmanConstants;
import org.bluezoo.huffman.MalformedPayloadException;

/**
 * Converts code trees to and from their {@link SerializedTree} form.
 *
 * <p>Deserialization rejects anything {@link #serialize} could not have
 * produced: unknown tags, truncated data, trailing bytes, a symbol
 * appearing at more than one leaf, and trees deeper than the configured
 * maximum depth. The maximum depth defaults to the value of the
 * {@code org.bluezoo.huffman.maxTreeDepth} system property, or 256.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * TreeCodec codec = new TreeCodec();
 * SerializedTree serialized = codec.serialize(root);
 * byte[] stored = serialized.toByteArray();
 *
 * // Later, possibly in another process:
 * HuffmanNode tree = codec.deserialize(SerializedTree.wrap(stored));
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TreeCodec {

    private static final Logger LOGGER = Logger.getLogger(TreeCodec.class.getName());

    private volatile int maxDepth;

    /**
     * Creates a new tree codec using the configured maximum depth.
     */
    public TreeCodec() {
        this(Integer.getInteger(HuffmanConstants.MAX_TREE_DEPTH_PROPERTY,
                HuffmanConstants.DEFAULT_MAX_TREE_DEPTH));
    }

    /**
     * Creates a new tree codec with the given maximum depth.
     *
     * @param maxDepth the deepest leaf accepted on deserialization
     */
    public TreeCodec(int maxDepth) {
        setMaxDepth(maxDepth);
    }

    /**
     * Returns the deepest leaf accepted on deserialization.
     *
     * @return the maximum depth in edges from the root
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Sets the deepest leaf accepted on deserialization.
     *
     * @param maxDepth the maximum depth in edges from the root
     */
    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Serializes a tree.
     *
     * @param root the root of the tree, or null for the empty input
     * @return the serialized form
     */
    public SerializedTree serialize(HuffmanNode root) {
        if (root == null) {
            return SerializedTree.EMPTY;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(root, out);
        return new SerializedTree(out.toByteArray());
    }

    private void write(HuffmanNode node, ByteArrayOutputStream out) {
        if (node.isLeaf()) {
            out.write(SerializedTree.LEAF_TAG);
            out.write(((HuffmanNode.Leaf) node).getSymbol());
        } else {
            HuffmanNode.Internal internal = (HuffmanNode.Internal) node;
            out.write(SerializedTree.INTERNAL_TAG);
            write(internal.getLeft(), out);
            write(internal.getRight(), out);
        }
    }

    /**
     * Reconstructs a tree from its serialized form.
     * All nodes of the result have frequency 0.
     *
     * @param serialized the serialized tree
     * @return the root of the tree, or null if the serialization is empty
     * @throws MalformedPayloadException if the data is not a valid tree
     */
    public HuffmanNode deserialize(SerializedTree serialized) throws MalformedPayloadException {
        if (serialized.isEmpty()) {
            return null;
        }
        Reader reader = new Reader(serialized);
        HuffmanNode root = reader.readNode(0);
        if (reader.position != serialized.length()) {
            String msg = MessageFormat.format(FrequencyTable.L10N.getString("err.trailing_tree_data"),
                    serialized.length() - reader.position);
            throw new MalformedPayloadException(msg);
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Deserialized tree of " + reader.leaves + " leaves from "
                    + serialized.length() + " bytes");
        }
        return root;
    }

    // Cursor over the serialized bytes.
    private class Reader {

        final SerializedTree data;
        final boolean[] seen = new boolean[HuffmanConstants.ALPHABET_SIZE];
        int position;
        int leaves;

        Reader(SerializedTree data) {
            this.data = data;
        }

        HuffmanNode readNode(int depth) throws MalformedPayloadException {
            if (depth > maxDepth) {
                String msg = MessageFormat.format(FrequencyTable.L10N.getString("err.tree_too_deep"), maxDepth);
                throw new MalformedPayloadException(msg);
            }
            byte tag = readByte();
            switch (tag) {
                case SerializedTree.LEAF_TAG:
                    int symbol = readByte() & 0xff;
                    if (seen[symbol]) {
                        String msg = MessageFormat.format(FrequencyTable.L10N.getString("err.duplicate_leaf"),
                                HuffmanNode.symbolToString(symbol));
                        throw new MalformedPayloadException(msg);
                    }
                    seen[symbol] = true;
                    leaves++;
                    return HuffmanNode.leaf(symbol, 0L);
                case SerializedTree.INTERNAL_TAG:
                    HuffmanNode left = readNode(depth + 1);
                    HuffmanNode right = readNode(depth + 1);
                    return HuffmanNode.internal(left, right);
                default:
                    String msg = MessageFormat.format(FrequencyTable.L10N.getString("err.unknown_tag"),
                            String.format("0x%02x", tag & 0xff), position - 1);
                    throw new MalformedPayloadException(msg);
            }
        }

        byte readByte() throws MalformedPayloadException {
            if (position >= data.length()) {
                throw new MalformedPayloadException(FrequencyTable.L10N.getString("err.truncated_tree"));
            }
            return data.get(position++);
        }
    }

}
