/*
 * DiagnosticCode.java
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
 * Syntax errors the parser recovers from.
 * Each code names the key of its message in the L10N bundle.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DiagnosticCode {

    /** A block reached end of input without its end delimiter. */
    UNTERMINATED_BLOCK("err.unterminated_block"),
    /** An end delimiter of another kind appeared inside a block. */
    MISMATCHED_END_DELIMITER("err.mismatched_end_delimiter"),
    /** An end delimiter appeared outside any block. */
    UNEXPECTED_END_DELIMITER("err.unexpected_end_delimiter"),
    /** A start delimiter appeared inside a block. */
    NESTED_BLOCK_START("err.nested_block_start");

    private final String key;

    DiagnosticCode(String key) {
        this.key = key;
    }

    /**
     * Returns the resource bundle key of this code's message.
     *
     * @return the message key
     */
    public String getKey() {
        return key;
    }

}
