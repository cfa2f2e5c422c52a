/*
 * TemplateSyntaxKind.java
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
 * Kinds of tokens and nodes in a template syntax tree.
 *
 * <p>Kinds are numbered consecutively from {@link #HOST_KIND_BASE}, the
 * first value past the range reserved by the host language's own syntax
 * kinds. The order of declaration is significant: every end delimiter is
 * declared immediately after its start delimiter, so that
 * {@code end.getValue() == start.getValue() + 1}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum TemplateSyntaxKind {

    // Tokens

    /** Run of literal template text */
    LITERAL_TEXT,
    /** Directive start: {@code <#@} */
    DIRECTIVE_START,
    /** Directive end: {@code @#>} */
    DIRECTIVE_END,
    /** Standard control block start: {@code <#} */
    STANDARD_BLOCK_START,
    /** Standard control block end: {@code #>} */
    STANDARD_BLOCK_END,
    /** Expression control block start: {@code <#=} */
    EXPRESSION_BLOCK_START,
    /** Expression control block end: {@code =#>} */
    EXPRESSION_BLOCK_END,
    /** Class feature control block start: {@code <#+} */
    CLASS_FEATURE_BLOCK_START,
    /** Class feature control block end: {@code +#>} */
    CLASS_FEATURE_BLOCK_END,
    /** Zero-width end of input sentinel */
    END_OF_FILE,

    // Nodes

    /** Sequence of tokens forming literal output text */
    TEXT_RUN,
    /** Raw content of a block between its delimiters */
    BLOCK_CONTENT,
    DIRECTIVE_BLOCK,
    STANDARD_BLOCK,
    EXPRESSION_BLOCK,
    CLASS_FEATURE_BLOCK,
    /** Root of a template */
    DOCUMENT;

    /**
     * Numeric value of {@link #LITERAL_TEXT}.
     * This must lie past the last kind value reserved by the host
     * language's syntax kinds.
     */
    public static final int HOST_KIND_BASE = 24058;

    private static final TemplateSyntaxKind[] VALUES = values();

    /**
     * Returns the stable numeric value of this kind.
     *
     * @return the kind value
     */
    public int getValue() {
        return HOST_KIND_BASE + ordinal();
    }

    /**
     * Returns the kind with the given numeric value.
     *
     * @param value the kind value
     * @return the kind
     * @throws IllegalArgumentException if no kind has this value
     */
    public static TemplateSyntaxKind fromValue(int value) {
        int ordinal = value - HOST_KIND_BASE;
        if (ordinal < 0 || ordinal >= VALUES.length) {
            throw new IllegalArgumentException("Not a template syntax kind: " + value);
        }
        return VALUES[ordinal];
    }

    /**
     * Indicates whether this kind is a leaf token.
     *
     * @return true for token kinds
     */
    public boolean isToken() {
        return ordinal() <= END_OF_FILE.ordinal();
    }

    /**
     * Indicates whether this kind is a delimiter, start or end.
     *
     * @return true for delimiter kinds
     */
    public boolean isDelimiter() {
        return ordinal() >= DIRECTIVE_START.ordinal()
                && ordinal() <= CLASS_FEATURE_BLOCK_END.ordinal();
    }

    /**
     * Indicates whether this kind opens a block.
     *
     * @return true for start delimiters
     */
    public boolean isStartDelimiter() {
        return isDelimiter() && ((ordinal() - DIRECTIVE_START.ordinal()) % 2) == 0;
    }

    /**
     * Indicates whether this kind closes a block.
     *
     * @return true for end delimiters
     */
    public boolean isEndDelimiter() {
        return isDelimiter() && ((ordinal() - DIRECTIVE_START.ordinal()) % 2) == 1;
    }

    /**
     * Indicates whether this kind is a block node.
     *
     * @return true for the four block node kinds
     */
    public boolean isBlock() {
        return ordinal() >= DIRECTIVE_BLOCK.ordinal()
                && ordinal() <= CLASS_FEATURE_BLOCK.ordinal();
    }

    /**
     * Returns the end delimiter closing blocks opened by this start
     * delimiter.
     *
     * @return the matching end delimiter kind
     * @throws IllegalStateException if this is not a start delimiter
     */
    public TemplateSyntaxKind getMatchingEnd() {
        if (!isStartDelimiter()) {
            throw new IllegalStateException(this + " is not a start delimiter");
        }
        return VALUES[ordinal() + 1];
    }

    /**
     * Returns the start delimiter opening blocks closed by this end
     * delimiter.
     *
     * @return the matching start delimiter kind
     * @throws IllegalStateException if this is not an end delimiter
     */
    public TemplateSyntaxKind getMatchingStart() {
        if (!isEndDelimiter()) {
            throw new IllegalStateException(this + " is not an end delimiter");
        }
        return VALUES[ordinal() - 1];
    }

    /**
     * Returns the block node kind opened by this start delimiter.
     *
     * @return the block kind
     * @throws IllegalStateException if this is not a start delimiter
     */
    public TemplateSyntaxKind getBlockKind() {
        switch (this) {
            case DIRECTIVE_START:
                return DIRECTIVE_BLOCK;
            case STANDARD_BLOCK_START:
                return STANDARD_BLOCK;
            case EXPRESSION_BLOCK_START:
                return EXPRESSION_BLOCK;
            case CLASS_FEATURE_BLOCK_START:
                return CLASS_FEATURE_BLOCK;
            default:
                throw new IllegalStateException(this + " is not a start delimiter");
        }
    }

    /**
     * Returns the start delimiter that opens blocks of this kind.
     *
     * @return the start delimiter kind
     * @throws IllegalStateException if this is not a block kind
     */
    public TemplateSyntaxKind getStartDelimiter() {
        switch (this) {
            case DIRECTIVE_BLOCK:
                return DIRECTIVE_START;
            case STANDARD_BLOCK:
                return STANDARD_BLOCK_START;
            case EXPRESSION_BLOCK:
                return EXPRESSION_BLOCK_START;
            case CLASS_FEATURE_BLOCK:
                return CLASS_FEATURE_BLOCK_START;
            default:
                throw new IllegalStateException(this + " is not a block kind");
        }
    }

}
