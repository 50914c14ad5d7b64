/*
 * BitPacker.java
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

package org.bluezoo.huffman.bits;

import java.io.ByteArrayOutputStream;

import org.bluezoo.huffman.tree.Codebook;

/**
 * Accumulates a sequence of bits and packs them into bytes.
 *
 * <p>Bits fill each byte from the most significant bit down. The last
 * byte is padded with zero bits when the sequence length is not a
 * multiple of 8, and {@link #toPayload} records how many of its bits are
 * valid.
 *
 * <p>A packer is not thread-safe; use one per encoding.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BitPacker {

    private final ByteArrayOutputStream byteStream;
    private int currentByte = 0;
    private int bitsInCurrentByte = 0;
    private long bitLength = 0L;

    /**
     * Creates a new bit packer.
     */
    public BitPacker() {
        this(32);
    }

    /**
     * Creates a new bit packer expecting about the given number of bytes.
     *
     * @param initialCapacity the initial byte capacity
     */
    public BitPacker(int initialCapacity) {
        byteStream = new ByteArrayOutputStream(Math.max(initialCapacity, 1));
    }

    /**
     * Appends every bit of a code, first bit first.
     *
     * @param code the code to append
     */
    public void appendCode(Codebook.Code code) {
        int length = code.length();
        for (int i = 0; i < length; i++) {
            appendBit(code.bit(i));
        }
    }

    /**
     * Appends a single bit.
     *
     * @param bit the bit to append (0 or 1)
     */
    public void appendBit(int bit) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("bit: " + bit);
        }
        currentByte = (currentByte << 1) | bit;
        bitsInCurrentByte++;
        bitLength++;

        if (bitsInCurrentByte == 8) {
            byteStream.write(currentByte);
            currentByte = 0;
            bitsInCurrentByte = 0;
        }
    }

    /**
     * Returns the number of bits appended so far.
     *
     * @return the bit length
     */
    public long getBitLength() {
        return bitLength;
    }

    /**
     * Packs the accumulated bits. Pads the last byte with 0s if it is not a
     * full byte. The packer can continue to be appended to afterwards.
     *
     * @param symbolCount the number of symbols the bits encode
     * @return the payload
     */
    public CompressedPayload toPayload(long symbolCount) {
        if (bitLength == 0L) {
            return (symbolCount == 0L) ? CompressedPayload.EMPTY
                    : new CompressedPayload(new byte[0], 0, symbolCount);
        }
        int lastByteBits;
        byte[] data;
        if (bitsInCurrentByte > 0) {
            int padded = currentByte << (8 - bitsInCurrentByte);
            byte[] full = byteStream.toByteArray();
            data = new byte[full.length + 1];
            System.arraycopy(full, 0, data, 0, full.length);
            data[full.length] = (byte) padded;
            lastByteBits = bitsInCurrentByte;
        } else {
            data = byteStream.toByteArray();
            lastByteBits = 8;
        }
        return new CompressedPayload(data, lastByteBits, symbolCount);
    }

}
