/*
 * TemplateDelimiters.java
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

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.bluezoo.chryssie.syntax.TemplateSyntaxKind;

/**
 * The texts of the eight block delimiters.
 *
 * <p>The defaults are:
 * <table>
 * <tr><th>Block</th><th>Start</th><th>End</th></tr>
 * <tr><td>directive</td><td>{@code <#@}</td><td>{@code @#>}</td></tr>
 * <tr><td>standard</td><td>{@code <#}</td><td>{@code #>}</td></tr>
 * <tr><td>expression</td><td>{@code <#=}</td><td>{@code =#>}</td></tr>
 * <tr><td>class feature</td><td>{@code <#+}</td><td>{@code +#>}</td></tr>
 * </table>
 *
 * <p>Delimiters may be prefixes of one another; the lexer always takes the
 * longest match. They must be non-empty and pairwise distinct, since the
 * kind of a delimiter token is decided by its text alone.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TemplateDelimiters {

    /**
     * The default delimiter set.
     */
    public static final TemplateDelimiters DEFAULT = new TemplateDelimiters(
            "<#@", "@#>",
            "<#", "#>",
            "<#=", "=#>",
            "<#+", "+#>");

    private final Map<TemplateSyntaxKind,String> texts;
    private final TemplateSyntaxKind[] kinds;
    private final String[] delimiters;
    private final String leadChars;
    private final int maxLength;

    /**
     * Creates a delimiter set.
     *
     * @param directiveStart start of a directive
     * @param directiveEnd end of a directive
     * @param standardStart start of a standard control block
     * @param standardEnd end of a standard control block
     * @param expressionStart start of an expression control block
     * @param expressionEnd end of an expression control block
     * @param classFeatureStart start of a class feature control block
     * @param classFeatureEnd end of a class feature control block
     * @throws IllegalArgumentException if any delimiter is null or empty,
     *         or two delimiters are equal
     */
    public TemplateDelimiters(String directiveStart, String directiveEnd,
            String standardStart, String standardEnd,
            String expressionStart, String expressionEnd,
            String classFeatureStart, String classFeatureEnd) {
        texts = new EnumMap<TemplateSyntaxKind,String>(TemplateSyntaxKind.class);
        put(TemplateSyntaxKind.DIRECTIVE_START, directiveStart);
        put(TemplateSyntaxKind.DIRECTIVE_END, directiveEnd);
        put(TemplateSyntaxKind.STANDARD_BLOCK_START, standardStart);
        put(TemplateSyntaxKind.STANDARD_BLOCK_END, standardEnd);
        put(TemplateSyntaxKind.EXPRESSION_BLOCK_START, expressionStart);
        put(TemplateSyntaxKind.EXPRESSION_BLOCK_END, expressionEnd);
        put(TemplateSyntaxKind.CLASS_FEATURE_BLOCK_START, classFeatureStart);
        put(TemplateSyntaxKind.CLASS_FEATURE_BLOCK_END, classFeatureEnd);

        Set<String> seen = new HashSet<String>();
        StringBuilder lead = new StringBuilder();
        int max = 0;
        kinds = new TemplateSyntaxKind[texts.size()];
        delimiters = new String[texts.size()];
        int i = 0;
        for (Map.Entry<TemplateSyntaxKind,String> entry : texts.entrySet()) {
            String text = entry.getValue();
            if (!seen.add(text)) {
                throw new IllegalArgumentException("Duplicate delimiter: " + text);
            }
            char c = text.charAt(0);
            if (lead.indexOf(String.valueOf(c)) < 0) {
                lead.append(c);
            }
            max = Math.max(max, text.length());
            kinds[i] = entry.getKey();
            delimiters[i] = text;
            i++;
        }
        leadChars = lead.toString();
        maxLength = max;
    }

    private void put(TemplateSyntaxKind kind, String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Empty delimiter for " + kind);
        }
        texts.put(kind, text);
    }

    /**
     * Returns the text of a delimiter.
     *
     * @param kind a delimiter kind
     * @return the delimiter text
     * @throws IllegalArgumentException if kind is not a delimiter kind
     */
    public String getText(TemplateSyntaxKind kind) {
        String text = texts.get(kind);
        if (text == null) {
            throw new IllegalArgumentException(kind + " is not a delimiter");
        }
        return text;
    }

    /**
     * Returns the length of the longest delimiter. This is the most the
     * lexer ever looks ahead past a token boundary.
     *
     * @return the maximum delimiter length
     */
    public int getMaxLength() {
        return maxLength;
    }

    /**
     * Indicates whether some delimiter begins with the given character.
     *
     * @param c a character
     * @return true if c may start a delimiter
     */
    boolean isLeadChar(char c) {
        return leadChars.indexOf(c) >= 0;
    }

    /**
     * Finds the longest delimiter starting at the given position.
     *
     * @param text the text
     * @param pos the position
     * @return the delimiter kind, or null if none starts at pos
     */
    TemplateSyntaxKind match(CharSequence text, int pos) {
        int length = text.length();
        if (pos >= length || !isLeadChar(text.charAt(pos))) {
            return null;
        }
        TemplateSyntaxKind best = null;
        int bestLength = 0;
        for (int i = 0; i < delimiters.length; i++) {
            String d = delimiters[i];
            int len = d.length();
            if (len > bestLength && pos + len <= length && regionMatches(text, pos, d)) {
                best = kinds[i];
                bestLength = len;
            }
        }
        return best;
    }

    private static boolean regionMatches(CharSequence text, int pos, String s) {
        for (int i = 0; i < s.length(); i++) {
            if (text.charAt(pos + i) != s.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return texts.equals(((TemplateDelimiters) obj).texts);
    }

    @Override
    public int hashCode() {
        return texts.hashCode();
    }

    @Override
    public String toString() {
        return "TemplateDelimiters" + texts;
    }

}
