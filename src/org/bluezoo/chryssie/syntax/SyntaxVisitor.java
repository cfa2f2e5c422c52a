/*
 * SyntaxVisitor.java
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
 * Visitor over positioned syntax nodes.
 *
 * <p>{@link SyntaxNode#accept} calls exactly one of these methods.
 * Visitors that need to descend do so themselves, by accepting the
 * children they are interested in.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface SyntaxVisitor {

    /**
     * Visits the document root.
     *
     * @param node a {@link TemplateSyntaxKind#DOCUMENT} node
     */
    void visitDocument(SyntaxNode node);

    /**
     * Visits a run of literal output text.
     *
     * @param node a {@link TemplateSyntaxKind#TEXT_RUN} node
     */
    void visitTextRun(SyntaxNode node);

    /**
     * Visits a directive or control block.
     *
     * @param node a node whose kind is a block kind
     */
    void visitBlock(SyntaxNode node);

    /**
     * Visits the content of a block.
     *
     * @param node a {@link TemplateSyntaxKind#BLOCK_CONTENT} node
     */
    void visitBlockContent(SyntaxNode node);

    /**
     * Visits a token.
     *
     * @param node a token node
     */
    void visitToken(SyntaxNode node);

}
