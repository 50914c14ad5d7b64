/*
 * LaconicFormatter.java
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

package org.bluezoo.huffman.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * A logging formatter that prints the level, the simple name of the
 * logging class and the message on one line, followed by the stack trace
 * of any attached exception.
 *
 * <p>To use it, name it in a logging configuration file:
 * <pre>
 * java.util.logging.ConsoleHandler.formatter = org.bluezoo.huffman.util.LaconicFormatter
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    static final String EOL = System.getProperty("line.separator");

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append(record.getLevel().getLocalizedName());
        buf.append(' ');
        String loggerName = record.getLoggerName();
        if (loggerName != null) {
            buf.append('[');
            buf.append(loggerName.substring(loggerName.lastIndexOf('.') + 1));
            buf.append("] ");
        }
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(EOL);
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
