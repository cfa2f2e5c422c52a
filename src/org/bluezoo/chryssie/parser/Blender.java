/*
 * Blender.java
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
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.chryssie.syntax.GreenBlock;
import org.bluezoo.chryssie.syntax.GreenNode;
import org.bluezoo.chryssie.syntax.GreenToken;
import org.bluezoo.chryssie.syntax.SyntaxNode;
import org.bluezoo.chryssie.syntax.TemplateSyntaxKind;
import org.bluezoo.chryssie.syntax.TextChange;
import org.bluezoo.util.ObjectPool;
import org.bluezoo.util.RingDeque;
import org.bluezoo.util.RingDequePool;

/**
 * Produces the token stream of a new text, reusing tokens and blocks of
 * the tree built for a previous version of the text.
 *
 * <p>The blender walks the old tree with an explicit stack of positioned
 * nodes, in step with a position in the new text. Old positions are
 * mapped into the new text through the list of changes; positions inside
 * a replaced range have no image. An old token is reused when it maps
 * exactly to the current position, when no change touches the characters
 * the lexer would examine to produce it, and when the lexer confirms it
 * ({@link TemplateLexer#isReusable}). Everything else is lexed afresh,
 * and old nodes falling behind the current position are discarded, so
 * reuse resumes at the first boundary shared by the fresh and the old
 * tokens. The output is therefore always the token sequence a full lexing
 * of the new text would produce.
 *
 * <p>When the caller allows it, a terminated block that maps to the
 * current position and lies entirely outside every change is reused as a
 * whole.
 *
 * <p>Without a previous tree the blender simply delegates to the lexer.
 * A blender is used for one parse and must be closed afterwards, which
 * returns its work stack to the pool.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Blender implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Blender.class.getName());

    private static final RingDequePool<SyntaxNode> CURSOR_POOL = new RingDequePool<SyntaxNode>();

    private final TemplateLexer lexer;
    private final List<TextChange> changes;
    private final boolean reuseNodes;
    private final int lookahead;
    private final ObjectPool.Lease<RingDeque<SyntaxNode>> lease;
    private final RingDeque<SyntaxNode> cursor;

    private int position;
    private int changeIndex;
    private int delta;

    private int tokensReused;
    private int nodesReused;

    /**
     * Creates a blender without a previous tree.
     *
     * @param lexer the lexer over the new text
     */
    public Blender(TemplateLexer lexer) {
        this(lexer, null, Collections.<TextChange>emptyList(), false);
    }

    /**
     * Creates a blender.
     *
     * @param lexer the lexer over the new text
     * @param oldRoot the root of the previous tree, or null
     * @param changes the changes that turn the previous text into the new
     *        one, in previous text coordinates, sorted and not overlapping
     * @param reuseNodes whether whole blocks may be reused
     * @throws IllegalArgumentException if the changes are invalid or do
     *         not account for the length of the new text
     */
    public Blender(TemplateLexer lexer, GreenNode oldRoot, List<TextChange> changes, boolean reuseNodes) {
        this.lexer = lexer;
        this.changes = (changes == null) ? Collections.<TextChange>emptyList() : changes;
        this.reuseNodes = reuseNodes;
        this.lookahead = lexer.getMaxDelimiterLength();
        if (oldRoot == null) {
            lease = null;
            cursor = null;
        } else {
            checkChanges(this.changes, oldRoot.getFullWidth(), lexer.getText().length());
            lease = CURSOR_POOL.acquire();
            cursor = lease.get();
            cursor.push(SyntaxNode.attachRoot(oldRoot));
        }
    }

    /**
     * Checks that a list of changes is well formed against the previous
     * text and accounts for the length of the new one.
     *
     * @param changes the changes, in previous text coordinates
     * @param oldLength the length of the previous text
     * @param newLength the length of the new text
     * @throws IllegalArgumentException if the changes are invalid
     */
    static void checkChanges(List<TextChange> changes, int oldLength, int newLength) {
        TextChange.validate(changes, oldLength);
        int expected = oldLength;
        for (TextChange change : changes) {
            expected += change.getDelta();
        }
        if (expected != newLength) {
            String message = TemplateParser.L10N.getString("err.change_length");
            message = MessageFormat.format(message, newLength, expected);
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Returns the current position in the new text.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Produces the next unit of the new token stream.
     *
     * @param allowNodes whether a whole block may be returned
     * @return the next token or reused block
     */
    public BlendedToken next(boolean allowNodes) {
        if (cursor != null) {
            while (!cursor.isEmpty()) {
                SyntaxNode top = cursor.peekLast();
                if (top.getKind() == TemplateSyntaxKind.DOCUMENT) {
                    expand();
                    continue;
                }
                int q = top.getPosition();
                int mapped = map(q);
                if (mapped < 0 || mapped < position) {
                    // Changed, or already covered by fresh tokens
                    if (top.isToken()) {
                        cursor.pop();
                    } else {
                        expand();
                    }
                    continue;
                }
                if (mapped > position) {
                    break;
                }
                if (top.isToken()) {
                    GreenToken token = (GreenToken) top.getGreen();
                    cursor.pop();
                    if (isClean(q + token.getFullWidth() + lookahead)
                            && lexer.isReusable(token, position)) {
                        return reuse(token, q);
                    }
                    if (token.getKind() != TemplateSyntaxKind.END_OF_FILE
                            && LOGGER.isLoggable(Level.FINE)) {
                        String message = TemplateParser.L10N.getString("fine.resync");
                        message = MessageFormat.format(message, position, token.getKind(), q);
                        LOGGER.fine(message);
                    }
                    break;
                }
                if (allowNodes && reuseNodes && top.getGreen() instanceof GreenBlock) {
                    GreenBlock block = (GreenBlock) top.getGreen();
                    if (isReusable(block, q)) {
                        cursor.pop();
                        return reuse(block, q);
                    }
                }
                expand();
            }
        }
        return lex();
    }

    private BlendedToken reuse(GreenToken token, int oldPosition) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = TemplateParser.L10N.getString("finest.reuse_token");
            LOGGER.finest(MessageFormat.format(message, token, oldPosition));
        }
        position += token.getFullWidth();
        tokensReused++;
        return new BlendedToken(null, token, position);
    }

    private BlendedToken reuse(GreenBlock block, int oldPosition) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = TemplateParser.L10N.getString("finest.reuse_block");
            LOGGER.finest(MessageFormat.format(message, block.getKind(), oldPosition, block.getFullWidth()));
        }
        position += block.getFullWidth();
        nodesReused++;
        return new BlendedToken(block, block.getStart(), position);
    }

    private BlendedToken lex() {
        lexer.reset(position);
        GreenToken token = lexer.nextToken();
        position = lexer.getPosition();
        return new BlendedToken(null, token, position);
    }

    /**
     * Replaces the node on top of the cursor by its children, the first
     * child ending up on top.
     */
    private void expand() {
        SyntaxNode node = cursor.pop();
        List<SyntaxNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            cursor.push(children.get(i));
        }
    }

    /**
     * Maps a position in the previous text to the new text. Positions
     * must be presented in non-decreasing order.
     *
     * @param q a position in the previous text
     * @return the position in the new text, or -1 if q lies inside a
     *         replaced range
     */
    private int map(int q) {
        int size = changes.size();
        while (changeIndex < size && q >= changes.get(changeIndex).getOldEnd()) {
            delta += changes.get(changeIndex).getDelta();
            changeIndex++;
        }
        if (changeIndex < size && q >= changes.get(changeIndex).getStart()) {
            return -1;
        }
        return q + delta;
    }

    /**
     * Indicates whether the previous text is unchanged from the last
     * mapped position up to the given end. Changes before the last mapped
     * position have already been passed.
     */
    private boolean isClean(int end) {
        return changeIndex >= changes.size() || end <= changes.get(changeIndex).getStart();
    }

    private boolean isReusable(GreenBlock block, int q) {
        if (!block.isTerminated()) {
            return false;
        }
        int endWidth = block.getEnd().getFullWidth();
        if (!isClean(q + block.getFullWidth() - endWidth + lookahead)) {
            return false;
        }
        int p = position;
        if (!lexer.isReusable(block.getStart(), p)) {
            return false;
        }
        p += block.getStart().getFullWidth();
        GreenNode content = block.getContent();
        if (content != null) {
            for (int i = 0; i < content.getSlotCount(); i++) {
                GreenToken token = (GreenToken) content.getSlot(i);
                if (!lexer.isReusable(token, p)) {
                    return false;
                }
                p += token.getFullWidth();
            }
        }
        return lexer.isReusable(block.getEnd(), p);
    }

    /**
     * Returns the number of tokens produced by the lexer.
     */
    public int getTokensLexed() {
        return lexer.getTokenCount();
    }

    /**
     * Returns the number of previous tokens reused individually.
     */
    public int getTokensReused() {
        return tokensReused;
    }

    /**
     * Returns the number of previous blocks reused whole.
     */
    public int getNodesReused() {
        return nodesReused;
    }

    /**
     * Returns the work stack to its pool.
     */
    @Override
    public void close() {
        if (lease != null) {
            lease.close();
        }
    }

}
