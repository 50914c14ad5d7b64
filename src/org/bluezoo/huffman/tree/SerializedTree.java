/*
 * SerializedTree.java
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

import java.util.Arrays;

/**
 * The structure of a code tree in its external byte form.
 *
 * <p>The tree is written in pre-order with one tag byte per node:
 * <ul>
 *   <li>{@link #INTERNAL_TAG} followed by the left subtree and then the
 *       right subtree</li>
 *   <li>{@link #LEAF_TAG} followed by one byte holding the symbol</li>
 * </ul>
 * The empty input has no tree and is represented by {@link #EMPTY}, a
 * zero-length serialization. Frequencies are not part of the format.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see TreeCodec
 */
public final class SerializedTree {

    /** Tag of an internal node. */
    public static final byte INTERNAL_TAG = 0x00;

    /** Tag of a leaf node. */
    public static final byte LEAF_TAG = 0x01;

    /** Serialization of the absent tree of an empty input. */
    public static final SerializedTree EMPTY = new SerializedTree(new byte[0]);

    private final byte[] data;

    SerializedTree(byte[] data) {
        this.data = data;
    }

    /**
     * Wraps serialized tree bytes, for example as read from storage.
     * The bytes are copied and are not validated until they are
     * deserialized.
     *
     * @param data the serialized tree
     * @return the serialized tree
     */
    public static SerializedTree wrap(byte[] data) {
        if (data.length == 0) {
            return EMPTY;
        }
        return new SerializedTree(data.clone());
    }

    /**
     * Returns a copy of the serialized bytes.
     *
     * @return the serialized tree
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Returns the number of serialized bytes.
     *
     * @return the length
     */
    public int length() {
        return data.length;
    }

    /**
     * Indicates whether this is the serialization of no tree.
     *
     * @return true for an empty input
     */
    public boolean isEmpty() {
        return data.length == 0;
    }

    byte get(int index) {
        return data[index];
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SerializedTree)) {
            return false;
        }
        return Arrays.equals(data, ((SerializedTree) other).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "SerializedTree{length=" + data.length + "}";
    }

}
