/*
 * InvalidInputException.java
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
 * Exception thrown when a tree is requested for input that cannot have
 * one, such as an empty frequency table.
 *
 * <p>Empty input is handled by {@link HuffmanCompressor} before any tree
 * is built, so this exception reaching a caller indicates that a lower
 * level component was used directly with no data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class InvalidInputException extends HuffmanException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new invalid input exception.
     *
     * @param message the error message
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * Creates a new invalid input exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

}
