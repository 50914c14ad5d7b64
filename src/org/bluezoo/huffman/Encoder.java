/*
 * Encoder.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;

import org.bluezoo.huffman.bits.BitPacker;
import org.bluezoo.huffman.bits.CompressedPayload;
import org.bluezoo.huffman.tree.Codebook;

/**
 * Maps input symbols through a codebook into packed code bits.
 *
 * <p>The codes of the symbols are concatenated in input order and packed
 * with a {@link BitPacker}. The encoder holds no state, so one instance
 * may be used concurrently; the codebook must be the one derived from the
 * input being encoded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Encoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffman.L10N");

    /**
     * Creates a new encoder.
     */
    public Encoder() {
    }

    /**
     * Encodes data with the given codebook.
     *
     * @param data the input symbols
     * @param codebook the codes of the input's symbols
     * @return the packed code bits, or the empty payload for empty input
     * @throws UnsupportedSymbolException if an input symbol has no code
     */
    public CompressedPayload encode(byte[] data, Codebook codebook) throws UnsupportedSymbolException {
        if (data.length == 0) {
            return CompressedPayload.EMPTY;
        }
        BitPacker packer = new BitPacker(data.length / 2);
        for (int i = 0; i < data.length; i++) {
            int symbol = data[i] & 0xff;
            Codebook.Code code = codebook.getCode(symbol);
            if (code == null) {
                String msg = MessageFormat.format(L10N.getString("err.no_code"), symbol, i);
                throw new UnsupportedSymbolException(msg, symbol);
            }
            packer.appendCode(code);
        }
        return packer.toPayload(data.length);
    }

}
