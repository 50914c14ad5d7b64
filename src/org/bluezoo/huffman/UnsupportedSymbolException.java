/*
 * UnsupportedSymbolException.java
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
 * Exception thrown when a symbol has no code in the codebook or tree it
 * is being coded against.
 *
 * <p>This only happens when a codebook built for one input is applied to
 * another.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnsupportedSymbolException extends HuffmanException {

    private static final long serialVersionUID = 1L;

    private final int symbol;

    /**
     * Creates a new unsupported symbol exception.
     *
     * @param message the error message
     * @param symbol the symbol that could not be coded (0-255)
     */
    public UnsupportedSymbolException(String message, int symbol) {
        super(message);
        this.symbol = symbol;
    }

    /**
     * Returns the symbol that could not be coded.
     *
     * @return the symbol value (0-255)
     */
    public int getSymbol() {
        return symbol;
    }

}
