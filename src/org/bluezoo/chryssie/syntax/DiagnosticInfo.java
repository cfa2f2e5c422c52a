/*
 * DiagnosticInfo.java
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

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.ResourceBundle;

/**
 * A diagnostic attached to a green node.
 *
 * <p>The offset is relative to the start of the node carrying the
 * diagnostic, so the diagnostic remains valid wherever the node is reused.
 * {@link Diagnostic} is the resolved form with an absolute position.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DiagnosticInfo {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.chryssie.L10N");

    private final DiagnosticCode code;
    private final int offset;
    private final int width;
    private final String[] arguments;

    /**
     * Creates a new diagnostic.
     *
     * @param code the diagnostic code
     * @param offset the offset from the start of the owning node
     * @param width the number of characters the diagnostic covers
     * @param arguments message arguments
     */
    public DiagnosticInfo(DiagnosticCode code, int offset, int width, String... arguments) {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        if (offset < 0 || width < 0) {
            throw new IllegalArgumentException("Negative offset or width: " + offset + "," + width);
        }
        this.code = code;
        this.offset = offset;
        this.width = width;
        this.arguments = (arguments == null) ? new String[0] : arguments.clone();
    }

    public DiagnosticCode getCode() {
        return code;
    }

    /**
     * Returns the offset of this diagnostic from the start of its node.
     *
     * @return the relative offset
     */
    public int getOffset() {
        return offset;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Returns the localized message.
     *
     * @return the formatted message
     */
    public String getMessage() {
        return MessageFormat.format(L10N.getString(code.getKey()), (Object[]) arguments);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DiagnosticInfo other = (DiagnosticInfo) obj;
        return code == other.code &&
               offset == other.offset &&
               width == other.width &&
               Arrays.equals(arguments, other.arguments);
    }

    @Override
    public int hashCode() {
        int result = code.hashCode();
        result = 31 * result + offset;
        result = 31 * result + width;
        result = 31 * result + Arrays.hashCode(arguments);
        return result;
    }

    @Override
    public String toString() {
        return "DiagnosticInfo{" +
                "code=" + code +
                ", offset=" + offset +
                ", width=" + width +
                '}';
    }

}
