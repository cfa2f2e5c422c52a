/*
 * TextChange.java
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

import java.util.List;

/**
 * A single replacement in a text.
 *
 * <p>Ranges are in the coordinates of the text before the change: the
 * characters {@code [start, start + oldLength)} are replaced by
 * {@code newText}. An insertion has an old length of zero, a deletion an
 * empty new text.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextChange {

    private final int start;
    private final int oldLength;
    private final String newText;

    /**
     * Creates a new text change.
     *
     * @param start the position of the first replaced character
     * @param oldLength the number of characters replaced
     * @param newText the replacement text
     */
    public TextChange(int start, int oldLength, String newText) {
        if (start < 0 || oldLength < 0) {
            throw new IllegalArgumentException("Negative start or length: " + start + "," + oldLength);
        }
        if (newText == null) {
            throw new IllegalArgumentException("newText must not be null");
        }
        this.start = start;
        this.oldLength = oldLength;
        this.newText = newText;
    }

    /**
     * Creates an insertion.
     *
     * @param position the insertion point
     * @param text the inserted text
     * @return the change
     */
    public static TextChange insert(int position, String text) {
        return new TextChange(position, 0, text);
    }

    /**
     * Creates a deletion.
     *
     * @param start the first deleted character
     * @param length the number of characters deleted
     * @return the change
     */
    public static TextChange delete(int start, int length) {
        return new TextChange(start, length, "");
    }

    public int getStart() {
        return start;
    }

    /**
     * Returns the end of the replaced range in the old text (exclusive).
     */
    public int getOldEnd() {
        return start + oldLength;
    }

    public int getOldLength() {
        return oldLength;
    }

    public String getNewText() {
        return newText;
    }

    public int getNewLength() {
        return newText.length();
    }

    /**
     * Returns the change in length caused by this replacement.
     *
     * @return new length minus old length
     */
    public int getDelta() {
        return newText.length() - oldLength;
    }

    /**
     * Applies a list of changes to a text.
     *
     * @param text the old text
     * @param changes changes in old text coordinates, sorted and not
     *        overlapping
     * @return the new text
     * @throws IllegalArgumentException if the changes are not sorted,
     *         overlap, or extend past the end of the text
     */
    public static String apply(CharSequence text, List<TextChange> changes) {
        validate(changes, text.length());
        StringBuilder buf = new StringBuilder(text.length() + 16);
        int pos = 0;
        for (TextChange change : changes) {
            buf.append(text, pos, change.start);
            buf.append(change.newText);
            pos = change.getOldEnd();
        }
        buf.append(text, pos, text.length());
        return buf.toString();
    }

    /**
     * Checks that changes are sorted, do not overlap and lie within a text
     * of the given length.
     *
     * @param changes the changes
     * @param oldLength the length of the text they apply to
     * @throws IllegalArgumentException if the changes are invalid
     */
    public static void validate(List<TextChange> changes, int oldLength) {
        int previousEnd = 0;
        boolean first = true;
        for (TextChange change : changes) {
            if (change == null) {
                throw new IllegalArgumentException("Null change");
            }
            if (!first && change.start < previousEnd) {
                throw new IllegalArgumentException("Changes overlap or are not sorted at " + change);
            }
            if (change.getOldEnd() > oldLength) {
                throw new IllegalArgumentException("Change " + change + " extends past end " + oldLength);
            }
            previousEnd = change.getOldEnd();
            first = false;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        TextChange other = (TextChange) obj;
        return start == other.start &&
               oldLength == other.oldLength &&
               newText.equals(other.newText);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + oldLength;
        result = 31 * result + newText.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "TextChange{" +
                "start=" + start +
                ", oldLength=" + oldLength +
                ", newText='" + newText + '\'' +
                '}';
    }

}
