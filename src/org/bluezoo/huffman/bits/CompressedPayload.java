/*
 * CompressedPayload.java
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

import java.util.Arrays;

/**
 * Packed code bits together with what is needed to read them back.
 *
 * <p>The bytes hold the bits most significant bit first. The final byte
 * may be partly padding, so the number of valid bits it holds is carried
 * alongside: it is between 1 and 8 for a non-empty payload and 0 for an
 * empty one. The bytes and this count have no meaning apart from each
 * other and must be stored together.
 *
 * <p>The number of symbols that were encoded is carried as well, which
 * lets the decoder detect truncated data.
 *
 * <p>A payload is not validated on construction, so that data read from
 * storage can be represented as is; {@link BitUnpacker} checks it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CompressedPayload {

    /** Payload of the empty input. */
    public static final CompressedPayload EMPTY = new CompressedPayload(new byte[0], 0, 0L);

    private final byte[] data;
    private final int lastByteBits;
    private final long symbolCount;

    CompressedPayload(byte[] data, int lastByteBits, long symbolCount) {
        this.data = data;
        this.lastByteBits = lastByteBits;
        this.symbolCount = symbolCount;
    }

    /**
     * Creates a payload from stored values. The bytes are copied.
     *
     * @param data the packed bits
     * @param lastByteBits the number of valid bits in the last byte
     * @param symbolCount the number of symbols encoded in the bits
     * @return the payload
     */
    public static CompressedPayload of(byte[] data, int lastByteBits, long symbolCount) {
        return new CompressedPayload(data.clone(), lastByteBits, symbolCount);
    }

    /**
     * Returns a copy of the packed bytes.
     *
     * @return the payload bytes
     */
    public byte[] getData() {
        return data.clone();
    }

    /**
     * Returns the number of packed bytes.
     *
     * @return the payload length in bytes
     */
    public int length() {
        return data.length;
    }

    byte get(int index) {
        return data[index];
    }

    /**
     * Returns the number of valid bits in the last byte.
     *
     * @return 1 to 8, or 0 for an empty payload
     */
    public int getLastByteBits() {
        return lastByteBits;
    }

    /**
     * Returns the number of symbols encoded in this payload.
     *
     * @return the symbol count
     */
    public long getSymbolCount() {
        return symbolCount;
    }

    /**
     * Returns the number of valid bits in this payload.
     *
     * @return the bit length, excluding padding
     */
    public long getBitLength() {
        if (data.length == 0) {
            return 0L;
        }
        return (data.length - 1) * 8L + lastByteBits;
    }

    /**
     * Indicates whether this payload holds no bits.
     *
     * @return true if there are no bytes
     */
    public boolean isEmpty() {
        return data.length == 0;
    }

    /**
     * Returns a payload with the same bytes and symbol count but a
     * different number of valid bits in the last byte.
     *
     * @param lastByteBits the number of valid bits in the last byte
     * @return the new payload
     */
    public CompressedPayload withLastByteBits(int lastByteBits) {
        return new CompressedPayload(data, lastByteBits, symbolCount);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CompressedPayload)) {
            return false;
        }
        CompressedPayload o = (CompressedPayload) other;
        return lastByteBits == o.lastByteBits
                && symbolCount == o.symbolCount
                && Arrays.equals(data, o.data);
    }

    @Override
    public int hashCode() {
        return (Arrays.hashCode(data) * 31 + lastByteBits) * 31 + Long.hashCode(symbolCount);
    }

    @Override
    public String toString() {
        return "CompressedPayload{bytes=" + data.length
                + ", lastByteBits=" + lastByteBits
                + ", bits=" + getBitLength()
                + ", symbols=" + symbolCount + "}";
    }

}
