/*
 * TemplateParseException.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of chryssie, an incremental template parser.
 *
 * chryssie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * chryssie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with chryssie.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.chryssie.parser;

import java.util.Collections;
import java.util.List;

import org.bluezoo.chryssie.syntax.Diagnostic;

/**
 * Exception reporting syntax errors in a template.
 * The parser itself never throws this: malformed templates always yield
 * a tree carrying diagnostics. It is raised on request, when a caller
 * wants a template to be well formed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TemplateParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final int lineNumber;
    private final int columnNumber;
    private final List<Diagnostic> diagnostics;

    /**
     * Creates a new template parse exception with the specified message.
     *
     * @param message the error message
     */
    public TemplateParseException(String message) {
        this(message, null, -1, -1);
    }

    /**
     * Creates a new template parse exception with location information.
     *
     * @param message the error message
     * @param sourceName the name of the template, or null
     * @param lineNumber the line number (1-based, -1 if unknown)
     * @param columnNumber the column number (1-based, -1 if unknown)
     */
    public TemplateParseException(String message, String sourceName, int lineNumber, int columnNumber) {
        super(formatMessage(message, sourceName, lineNumber, columnNumber));
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.diagnostics = Collections.emptyList();
    }

    /**
     * Creates a new template parse exception from the diagnostics of a
     * tree. The message and location are those of the first diagnostic.
     *
     * @param diagnostics the diagnostics, at least one
     */
    public TemplateParseException(List<Diagnostic> diagnostics) {
        super(formatMessage(diagnostics.get(0).getMessage(), diagnostics.get(0).getSourceName(),
                diagnostics.get(0).getLineNumber(), diagnostics.get(0).getColumnNumber()));
        Diagnostic first = diagnostics.get(0);
        this.sourceName = first.getSourceName();
        this.lineNumber = first.getLineNumber();
        this.columnNumber = first.getColumnNumber();
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * Gets the name of the template where the error occurred.
     *
     * @return the source name, or {@code null} if not available
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Gets the line number where the error occurred.
     *
     * @return the line number (1-based), or -1 if not available
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Gets the column number where the error occurred.
     *
     * @return the column number (1-based), or -1 if not available
     */
    public int getColumnNumber() {
        return columnNumber;
    }

    /**
     * Returns all the diagnostics this exception reports.
     *
     * @return the diagnostics, empty if constructed from a message
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Formats an error message with location information.
     */
    private static String formatMessage(String message, String sourceName, int lineNumber, int columnNumber) {
        StringBuilder sb = new StringBuilder();
        if (sourceName != null) {
            sb.append(sourceName);
        }
        if (lineNumber >= 0) {
            if (sourceName != null) {
                sb.append(':');
            }
            sb.append(lineNumber);
            if (columnNumber >= 0) {
                sb.append(':').append(columnNumber);
            }
        }
        if (sb.length() > 0) {
            sb.append(": ");
        }
        sb.append(message);
        return sb.toString();
    }

}
