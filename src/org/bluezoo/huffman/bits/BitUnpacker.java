/*
 * BitUnpacker.java
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

import java.text.MessageFormat;
import java.util.NoSuchElementException;
import java.util.ResourceBundle;

import org.bluezoo.huffman.MalformedPayloadException;

/**
 * Reads back the bits of a {@link CompressedPayload}.
 *
 * <p>Bits are read from each byte most significant bit first, and
 * reading stops at the last valid bit: padding in the final byte is never
 * returned.
 *
 * <h4>Usage Pattern</h4>
 * <pre>{@code
 * BitUnpacker unpacker = new BitUnpacker(payload);
 * while (unpacker.hasMoreBits()) {
 *     int bit = unpacker.nextBit();
 *     // ...
 * }
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BitUnpacker {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.bits.L10N");

    private final CompressedPayload payload;
    private final long bitLength;
    private long position;

    /**
     * Creates an unpacker over the given payload.
     *
     * @param payload the payload to read
     * @throws MalformedPayloadException if the number of valid bits in the
     * last byte does not fit the payload
     */
    public BitUnpacker(CompressedPayload payload) throws MalformedPayloadException {
        int lastByteBits = payload.getLastByteBits();
        if (payload.isEmpty()) {
            if (lastByteBits != 0) {
                String msg = MessageFormat.format(L10N.getString("err.bits_without_data"), lastByteBits);
                throw new MalformedPayloadException(msg);
            }
        } else if (lastByteBits < 1 || lastByteBits > 8) {
            String msg = MessageFormat.format(L10N.getString("err.last_byte_bits"), lastByteBits);
            throw new MalformedPayloadException(msg);
        }
        this.payload = payload;
        this.bitLength = payload.getBitLength();
    }

    /**
     * Unpacks every valid bit of a payload.
     *
     * @param payload the payload to read
     * @return the bits, each 0 or 1, in order
     * @throws MalformedPayloadException if the payload shape is invalid
     */
    public static int[] unpack(CompressedPayload payload) throws MalformedPayloadException {
        BitUnpacker unpacker = new BitUnpacker(payload);
        if (unpacker.bitLength > Integer.MAX_VALUE) {
            throw new MalformedPayloadException(L10N.getString("err.too_many_bits"));
        }
        int[] bits = new int[(int) unpacker.bitLength];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = unpacker.nextBit();
        }
        return bits;
    }

    /**
     * Indicates whether any valid bits remain.
     *
     * @return true if {@link #nextBit} can be called
     */
    public boolean hasMoreBits() {
        return position < bitLength;
    }

    /**
     * Returns the next bit.
     *
     * @return 0 or 1
     * @throws NoSuchElementException if all valid bits have been read
     */
    public int nextBit() {
        if (position >= bitLength) {
            throw new NoSuchElementException();
        }
        int index = (int) (position >>> 3);
        int bitIndex = 7 - (int) (position & 7);
        position++;
        return (payload.get(index) >> bitIndex) & 1;
    }

    /**
     * Returns the number of bits read so far.
     *
     * @return the bit position
     */
    public long getPosition() {
        return position;
    }

    /**
     * Returns the number of valid bits in the payload.
     *
     * @return the bit length
     */
    public long getBitLength() {
        return bitLength;
    }

}
