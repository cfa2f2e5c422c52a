/*
 * SyntaxNodeTest.java
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

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link SyntaxNode}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SyntaxNodeTest {

    private GreenBlock block;
    private GreenDocument document;
    private SyntaxNode root;

    @Before
    public void setUp() {
        GreenToken a = new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "a");
        block = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK,
                new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_START, "<#"),
                new GreenListNode(TemplateSyntaxKind.BLOCK_CONTENT,
                        Arrays.asList(new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "b")), null),
                new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_END, "#>"), null);
        GreenListNode last = new GreenListNode(TemplateSyntaxKind.TEXT_RUN,
                Arrays.asList(new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "c")), null);
        GreenListNode first = new GreenListNode(TemplateSyntaxKind.TEXT_RUN, Arrays.asList(a), null);
        document = new GreenDocument(Arrays.<GreenNode>asList(first, block, last), GreenToken.endOfFile());
        root = SyntaxNode.attachRoot(document);
    }

    @Test
    public void testRoot() {
        assertNull(root.getParent());
        assertEquals(-1, root.getSlotIndex());
        assertEquals(0, root.getPosition());
        assertEquals(7, root.getEndPosition());
        assertSame(document, root.getGreen());
        assertEquals(TemplateSyntaxKind.DOCUMENT, root.getKind());
    }

    @Test
    public void testChildPositions() {
        List<SyntaxNode> children = root.getChildren();
        assertEquals(4, children.size());
        assertEquals(0, children.get(0).getPosition());
        assertEquals(1, children.get(1).getPosition());
        assertEquals(6, children.get(2).getPosition());
        assertEquals(7, children.get(3).getPosition());
        assertEquals(TemplateSyntaxKind.END_OF_FILE, children.get(3).getKind());
        for (SyntaxNode child : children) {
            assertEquals(root, child.getParent());
        }

        SyntaxNode blockNode = root.getChild(1);
        assertSame(block, blockNode.getGreen());
        SyntaxNode end = blockNode.getChild(GreenBlock.END_SLOT);
        assertEquals(4, end.getPosition());
        assertEquals(6, end.getEndPosition());
        assertEquals("#>", end.toFullString());
    }

    @Test
    public void testAbsentChild() {
        GreenBlock unterminated = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK,
                new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_START, "<#"), null, null, null);
        SyntaxNode node = SyntaxNode.attachRoot(unterminated);
        assertNull(node.getChild(GreenBlock.CONTENT_SLOT));
        assertNull(node.getChild(GreenBlock.END_SLOT));
        assertEquals(1, node.getChildren().size());
    }

    @Test
    public void testChildrenNotCached() {
        SyntaxNode first = root.getChild(1);
        SyntaxNode second = root.getChild(1);
        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void testFindToken() {
        assertEquals("a", root.findToken(0).toFullString());
        assertEquals("<#", root.findToken(1).toFullString());
        assertEquals("<#", root.findToken(2).toFullString());
        assertEquals("b", root.findToken(3).toFullString());
        assertEquals("#>", root.findToken(5).toFullString());
        assertEquals("c", root.findToken(6).toFullString());
        assertEquals(TemplateSyntaxKind.END_OF_FILE, root.findToken(7).getKind());
        assertEquals(3, root.findToken(3).getPosition());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testFindTokenOutOfRange() {
        root.findToken(8);
    }

    @Test
    public void testFirstToken() {
        assertEquals("a", root.getFirstToken().toFullString());
        assertEquals("<#", root.getChild(1).getFirstToken().toFullString());
    }

    @Test
    public void testVisitor() {
        final List<String> visited = new ArrayList<String>();
        SyntaxVisitor visitor = new SyntaxVisitor() {
            @Override
            public void visitDocument(SyntaxNode node) {
                visited.add("document");
                for (SyntaxNode child : node.getChildren()) {
                    child.accept(this);
                }
            }

            @Override
            public void visitTextRun(SyntaxNode node) {
                visited.add("run@" + node.getPosition());
            }

            @Override
            public void visitBlock(SyntaxNode node) {
                visited.add(node.getKind() + "@" + node.getPosition());
                node.getChild(GreenBlock.CONTENT_SLOT).accept(this);
            }

            @Override
            public void visitBlockContent(SyntaxNode node) {
                visited.add("content@" + node.getPosition());
            }

            @Override
            public void visitToken(SyntaxNode node) {
                visited.add(node.getKind().toString());
            }
        };
        root.accept(visitor);
        assertEquals(Arrays.asList("document", "run@0", "STANDARD_BLOCK@1", "content@3", "run@6",
                "END_OF_FILE"), visited);
    }

}
