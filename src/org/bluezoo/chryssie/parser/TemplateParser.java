/*
 * TemplateParser.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.chryssie.syntax.DiagnosticCode;
import org.bluezoo.chryssie.syntax.DiagnosticInfo;
import org.bluezoo.chryssie.syntax.GreenBlock;
import org.bluezoo.chryssie.syntax.GreenDocument;
import org.bluezoo.chryssie.syntax.GreenListNode;
import org.bluezoo.chryssie.syntax.GreenNode;
import org.bluezoo.chryssie.syntax.GreenToken;
import org.bluezoo.chryssie.syntax.TemplateSyntaxKind;
import org.bluezoo.chryssie.syntax.TextChange;

/**
 * Builds the green tree of a template.
 *
 * <p>The parser reads the blended token stream in one of two modes. In
 * text mode literal tokens accumulate into text runs, and a start
 * delimiter opens a block. In block mode every token up to the matching
 * end delimiter becomes block content. Malformed input never causes an
 * exception: stray, mismatched or nested delimiters are kept in the tree
 * as ordinary tokens and reported as diagnostics on the node containing
 * them, and a block still open at end of input is left without its end
 * delimiter.
 *
 * <p>A parser is used once. Given the tree of a previous version of the
 * text and the changes made since, it reuses the unaffected tokens and
 * blocks of that tree.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TemplateParser {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.chryssie.L10N");

    private static final Logger LOGGER = Logger.getLogger(TemplateParser.class.getName());

    private final CharSequence text;
    private final TemplateParserOptions options;
    private final GreenNode oldRoot;
    private final List<TextChange> changes;
    private final boolean discardOldRoot;

    private Blender blender;
    private GreenToken endOfFile;

    private int tokensLexed;
    private int tokensReused;
    private int nodesReused;

    /**
     * Creates a parser for a full parse.
     *
     * @param text the template text
     * @param options the parser options
     */
    public TemplateParser(CharSequence text, TemplateParserOptions options) {
        this(text, options, null, Collections.<TextChange>emptyList());
    }

    /**
     * Creates a parser for an incremental parse.
     *
     * @param text the new template text
     * @param options the parser options
     * @param oldRoot the tree of the previous text, or null
     * @param changes the changes from the previous text to the new one,
     *        in previous text coordinates
     * @throws IllegalArgumentException if the changes are invalid or do
     *         not account for the length of the new text
     */
    public TemplateParser(CharSequence text, TemplateParserOptions options, GreenNode oldRoot,
            List<TextChange> changes) {
        if (text == null || options == null) {
            throw new IllegalArgumentException("text and options must not be null");
        }
        if (oldRoot != null) {
            Blender.checkChanges(changes == null ? Collections.<TextChange>emptyList() : changes,
                    oldRoot.getFullWidth(), text.length());
        }
        this.text = text;
        this.options = options;
        this.discardOldRoot = oldRoot != null && !options.isIncremental();
        this.oldRoot = discardOldRoot ? null : oldRoot;
        this.changes = changes;
    }

    /**
     * Parses the text.
     *
     * @return the document
     * @throws IllegalArgumentException if the changes are invalid
     * @throws IllegalStateException if this parser has already been used
     */
    public GreenDocument parse() {
        if (endOfFile != null) {
            throw new IllegalStateException("Parser already used");
        }
        TemplateLexer lexer = new TemplateLexer(text, options.getDelimiters());
        if (discardOldRoot && LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("info.incremental_disabled");
            LOGGER.fine(MessageFormat.format(message, text.length()));
        }
        try (Blender b = new Blender(lexer, oldRoot, changes, options.isReuseNodes())) {
            blender = b;
            GreenDocument document = parseDocument();
            tokensLexed = b.getTokensLexed();
            tokensReused = b.getTokensReused();
            nodesReused = b.getNodesReused();
            if (LOGGER.isLoggable(Level.FINE)) {
                String message;
                if (oldRoot == null) {
                    message = MessageFormat.format(L10N.getString("info.parsed_full"), text.length());
                } else {
                    message = MessageFormat.format(L10N.getString("info.parsed"),
                            text.length(), tokensLexed, tokensReused, nodesReused);
                }
                LOGGER.fine(message);
            }
            return document;
        } finally {
            blender = null;
        }
    }

    private GreenDocument parseDocument() {
        List<GreenNode> items = new ArrayList<GreenNode>();
        TextRunBuilder run = new TextRunBuilder();
        while (endOfFile == null) {
            BlendedToken next = blender.next(true);
            GreenNode node = next.getNode();
            if (node != null) {
                run.flush(items);
                items.add(node);
                continue;
            }
            GreenToken token = next.getToken();
            TemplateSyntaxKind kind = token.getKind();
            if (kind == TemplateSyntaxKind.END_OF_FILE) {
                run.flush(items);
                endOfFile = token;
            } else if (kind.isStartDelimiter()) {
                run.flush(items);
                items.add(parseBlock(token));
            } else if (kind.isEndDelimiter()) {
                run.add(token, new DiagnosticInfo(DiagnosticCode.UNEXPECTED_END_DELIMITER,
                        run.width, token.getFullWidth(), token.getText()));
            } else {
                run.add(token, null);
            }
        }
        return new GreenDocument(items, endOfFile);
    }

    /**
     * Parses a block after its start delimiter. If end of input is
     * reached first the block is returned unterminated and the end of
     * file token is kept for the document.
     */
    private GreenBlock parseBlock(GreenToken start) {
        TemplateSyntaxKind startKind = start.getKind();
        TemplateSyntaxKind endKind = startKind.getMatchingEnd();
        List<GreenToken> content = new ArrayList<GreenToken>();
        List<DiagnosticInfo> diagnostics = new ArrayList<DiagnosticInfo>();
        int offset = start.getFullWidth();
        GreenToken end = null;
        while (end == null) {
            GreenToken token = blender.next(false).getToken();
            TemplateSyntaxKind kind = token.getKind();
            if (kind == endKind) {
                end = token;
            } else if (kind == TemplateSyntaxKind.END_OF_FILE) {
                String endText = options.getDelimiters().getText(endKind);
                diagnostics.add(new DiagnosticInfo(DiagnosticCode.UNTERMINATED_BLOCK,
                        0, start.getFullWidth(), start.getText(), endText));
                endOfFile = token;
                break;
            } else {
                if (kind.isEndDelimiter()) {
                    diagnostics.add(new DiagnosticInfo(DiagnosticCode.MISMATCHED_END_DELIMITER,
                            offset, token.getFullWidth(), token.getText(), start.getText()));
                } else if (kind.isStartDelimiter()) {
                    diagnostics.add(new DiagnosticInfo(DiagnosticCode.NESTED_BLOCK_START,
                            offset, token.getFullWidth(), token.getText(), start.getText()));
                }
                content.add(token);
                offset += token.getFullWidth();
            }
        }
        GreenListNode contentNode = content.isEmpty() ? null
                : new GreenListNode(TemplateSyntaxKind.BLOCK_CONTENT, content, null);
        return new GreenBlock(startKind.getBlockKind(), start, contentNode, end,
                diagnostics.toArray(new DiagnosticInfo[diagnostics.size()]));
    }

    /**
     * Returns the number of tokens the last parse produced by lexing.
     */
    public int getTokensLexed() {
        return tokensLexed;
    }

    /**
     * Returns the number of tokens the last parse reused individually.
     */
    public int getTokensReused() {
        return tokensReused;
    }

    /**
     * Returns the number of blocks the last parse reused whole.
     */
    public int getNodesReused() {
        return nodesReused;
    }

    /**
     * Accumulates the tokens of a text run.
     */
    private static class TextRunBuilder {

        final List<GreenToken> tokens = new ArrayList<GreenToken>();
        final List<DiagnosticInfo> diagnostics = new ArrayList<DiagnosticInfo>();
        int width;

        void add(GreenToken token, DiagnosticInfo diagnostic) {
            if (diagnostic != null) {
                diagnostics.add(diagnostic);
            }
            tokens.add(token);
            width += token.getFullWidth();
        }

        void flush(List<GreenNode> items) {
            if (tokens.isEmpty()) {
                return;
            }
            DiagnosticInfo[] diags = diagnostics.toArray(new DiagnosticInfo[diagnostics.size()]);
            items.add(new GreenListNode(TemplateSyntaxKind.TEXT_RUN, tokens, diags));
            tokens.clear();
            diagnostics.clear();
            width = 0;
        }

    }

}
