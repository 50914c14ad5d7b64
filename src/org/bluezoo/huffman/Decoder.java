/*
 * Decoder.java
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

import java.io.ByteArrayOutputStream;
import java.text.MessageFormat;
import java.util.ResourceBundle;

import org.bluezoo.huffman.bits.BitUnpacker;
import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.HuffmanNode;

/**
 * Reconstructs the symbols of a payload by walking the code tree.
 *
 * <p>Starting at the root, each bit moves to the left child
 * ({@link HuffmanConstants#LEFT_BIT}) or the right child
 * ({@link HuffmanConstants#RIGHT_BIT}). On reaching a leaf its symbol is
 * emitted and the walk restarts at the root. After the last valid bit the
 * walk must be back at the root, and the number of symbols emitted must
 * match the count declared by the payload.
 *
 * <p>A tree consisting of a single leaf has no edges to follow: each
 * {@link HuffmanConstants#SINGLE_SYMBOL_BIT} in the payload stands for
 * one occurrence of its symbol, and any other bit is an error.
 *
 * <p>The decoder holds no state, so one instance may be used concurrently.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Decoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.L10N");

    /**
     * Creates a new decoder.
     */
    public Decoder() {
    }

    /**
     * Decodes a payload.
     *
     * @param payload the packed code bits
     * @param root the root of the tree the payload was encoded with, or
     * null if the payload is empty
     * @return the decoded symbols
     * @throws MalformedPayloadException if the payload does not decode
     * cleanly against the tree
     */
    public byte[] decode(CompressedPayload payload, HuffmanNode root) throws MalformedPayloadException {
        BitUnpacker unpacker = new BitUnpacker(payload);
        long bitLength = unpacker.getBitLength();
        long symbolCount = payload.getSymbolCount();
        if (symbolCount < 0L) {
            String msg = MessageFormat.format(L10N.getString("err.negative_symbol_count"), symbolCount);
            throw new MalformedPayloadException(msg);
        }
        if (bitLength == 0L) {
            if (symbolCount != 0L) {
                String msg = MessageFormat.format(L10N.getString("err.no_bits"), symbolCount);
                throw new MalformedPayloadException(msg);
            }
            return new byte[0];
        }
        if (root == null) {
            throw new MalformedPayloadException(L10N.getString("err.no_tree"));
        }
        // Every symbol takes at least one bit
        if (symbolCount > bitLength || symbolCount > Integer.MAX_VALUE) {
            String msg = MessageFormat.format(L10N.getString("err.symbol_count_mismatch"),
                    symbolCount, bitLength);
            throw new MalformedPayloadException(msg);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream((int) symbolCount);
        if (root.isLeaf()) {
            decodeSingleSymbol(unpacker, (HuffmanNode.Leaf) root, out);
        } else {
            decodeTree(unpacker, (HuffmanNode.Internal) root, out);
        }

        if (out.size() != symbolCount) {
            String msg = MessageFormat.format(L10N.getString("err.decoded_count_mismatch"),
                    out.size(), symbolCount);
            throw new MalformedPayloadException(msg);
        }
        return out.toByteArray();
    }

    private void decodeSingleSymbol(BitUnpacker unpacker, HuffmanNode.Leaf leaf, ByteArrayOutputStream out)
            throws MalformedPayloadException {
        int symbol = leaf.getSymbol();
        while (unpacker.hasMoreBits()) {
            long position = unpacker.getPosition();
            if (unpacker.nextBit() != HuffmanConstants.SINGLE_SYMBOL_BIT) {
                String msg = MessageFormat.format(L10N.getString("err.invalid_single_symbol_bit"), position);
                throw new MalformedPayloadException(msg);
            }
            out.write(symbol);
        }
    }

    private void decodeTree(BitUnpacker unpacker, HuffmanNode.Internal root, ByteArrayOutputStream out)
            throws MalformedPayloadException {
        HuffmanNode current = root;
        while (unpacker.hasMoreBits()) {
            HuffmanNode.Internal internal = (HuffmanNode.Internal) current;
            if (unpacker.nextBit() == HuffmanConstants.LEFT_BIT) {
                current = internal.getLeft();
            } else {
                current = internal.getRight();
            }
            if (current.isLeaf()) {
                out.write(((HuffmanNode.Leaf) current).getSymbol());
                current = root;
            }
        }
        if (current != root) {
            String msg = MessageFormat.format(L10N.getString("err.incomplete_code"), unpacker.getBitLength());
            throw new MalformedPayloadException(msg);
        }
    }

}
