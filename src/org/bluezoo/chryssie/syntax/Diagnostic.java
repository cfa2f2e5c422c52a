/*
 * Diagnostic.java
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

package org.bluezoo.chryssie.syntax;

/**
 * A syntax error resolved to a location in a template source.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Diagnostic {

    private final DiagnosticCode code;
    private final String message;
    private final String sourceName;
    private final int position;
    private final int width;
    private final int lineNumber;
    private final int columnNumber;

    /**
     * Creates a new diagnostic.
     *
     * @param code the diagnostic code
     * @param message the localized message
     * @param sourceName the template name, or null
     * @param position the absolute position
     * @param width the number of characters covered
     * @param lineNumber the line number (1-based)
     * @param columnNumber the column number (1-based)
     */
    public Diagnostic(DiagnosticCode code, String message, String sourceName,
            int position, int width, int lineNumber, int columnNumber) {
        this.code = code;
        this.message = message;
        this.sourceName = sourceName;
        this.position = position;
        this.width = width;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Returns the name of the template source.
     *
     * @return the source name, or null if not specified
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Returns the absolute position of the first character covered.
     */
    public int getPosition() {
        return position;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Returns the line number (1-based).
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the column number (1-based).
     */
    public int getColumnNumber() {
        return columnNumber;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (sourceName != null) {
            sb.append(sourceName);
            sb.append(':');
        }
        sb.append(lineNumber);
        sb.append(':');
        sb.append(columnNumber);
        sb.append(": ");
        sb.append(message);
        return sb.toString();
    }

}
