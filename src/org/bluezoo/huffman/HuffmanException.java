/*
 * HuffmanException.java
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
 * Base class of the exceptions raised while building, encoding or
 * decoding Huffman data.
 *
 * <p>All failures in this library are local and deterministic: the same
 * input always produces the same exception, so none of them are worth
 * retrying.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new Huffman exception with the specified message.
     *
     * @param message the error message
     */
    public HuffmanException(String message) {
        super(message);
    }

    /**
     * Creates a new Huffman exception with the specified message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public HuffmanException(String message, Throwable cause) {
        super(message, cause);
    }

}
