/*
 * GreenNode.java
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.bluezoo.util.ObjectPool;
import org.bluezoo.util.RingDeque;
import org.bluezoo.util.RingDequePool;
import org.bluezoo.util.StringBuilderPool;

/**
 * An immutable, position-independent node of a template syntax tree.
 *
 * <p>A green node knows its kind, its full width in characters and its
 * children, but not where it is: positions are derived by summing the
 * widths of preceding siblings ({@link #getSlotOffset}). This is what
 * allows a node to be shared by reference between successive versions of
 * a tree after an edit that leaves its text untouched. {@link SyntaxNode}
 * supplies positions and parent links on demand.
 *
 * <p>Green nodes never change after construction and may be read
 * concurrently by any number of threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see SyntaxNode
 */
public abstract class GreenNode {

    static final DiagnosticInfo[] NO_DIAGNOSTICS = new DiagnosticInfo[0];

    private static final RingDequePool<GreenNode> STACK_POOL = new RingDequePool<GreenNode>();

    private final TemplateSyntaxKind kind;
    private final int fullWidth;
    private final DiagnosticInfo[] diagnostics;
    private final boolean containsDiagnostics;

    /**
     * Constructor for subclasses.
     *
     * @param kind the node kind
     * @param fullWidth the full width, computed by the subclass from its
     *        text or children
     * @param diagnostics diagnostics owned by this node, may be null
     * @param childrenContainDiagnostics whether any descendant carries
     *        diagnostics
     */
    GreenNode(TemplateSyntaxKind kind, int fullWidth, DiagnosticInfo[] diagnostics,
            boolean childrenContainDiagnostics) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
        this.fullWidth = fullWidth;
        this.diagnostics = (diagnostics == null || diagnostics.length == 0)
                ? NO_DIAGNOSTICS : diagnostics.clone();
        this.containsDiagnostics = this.diagnostics.length > 0 || childrenContainDiagnostics;
    }

    public final TemplateSyntaxKind getKind() {
        return kind;
    }

    /**
     * Indicates whether this node is a leaf token.
     *
     * @return true if this is a {@link GreenToken}
     */
    public boolean isToken() {
        return false;
    }

    /**
     * Returns the number of child slots, including absent ones.
     *
     * @return the slot count, 0 for tokens
     */
    public abstract int getSlotCount();

    /**
     * Returns the child in the given slot.
     *
     * @param index the slot index
     * @return the child, or null if the slot is absent
     * @throws IndexOutOfBoundsException if index is not a valid slot index
     */
    public abstract GreenNode getSlot(int index);

    /**
     * Returns the child in a slot that must be present.
     *
     * @param index the slot index
     * @return the child
     * @throws IllegalStateException if the slot is absent
     */
    public final GreenNode getRequiredSlot(int index) {
        GreenNode node = getSlot(index);
        if (node == null) {
            throw new IllegalStateException("Required slot " + index + " of " + kind + " is absent");
        }
        return node;
    }

    /**
     * Returns the offset of a slot from the start of this node: the sum
     * of the full widths of all present slots before it.
     *
     * @param index the slot index
     * @return the slot offset
     */
    public int getSlotOffset(int index) {
        int offset = 0;
        for (int i = 0; i < index; i++) {
            GreenNode child = getSlot(i);
            if (child != null) {
                offset += child.getFullWidth();
            }
        }
        return offset;
    }

    /**
     * Returns the number of characters spanned by this node.
     *
     * @return the full width
     */
    public final int getFullWidth() {
        return fullWidth;
    }

    /**
     * Returns the diagnostics owned by this node itself.
     *
     * @return an unmodifiable list, empty if there are none
     */
    public List<DiagnosticInfo> getDiagnostics() {
        if (diagnostics.length == 0) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(diagnostics));
    }

    /**
     * Indicates whether this node or any of its descendants carries
     * diagnostics.
     *
     * @return true if the subtree has diagnostics
     */
    public final boolean containsDiagnostics() {
        return containsDiagnostics;
    }

    /**
     * Writes the full text of this subtree, depth first and left to right.
     *
     * <p>Traversal uses an explicit work stack borrowed from a pool, so
     * deeply nested trees cannot exhaust the call stack. The stack is
     * returned to the pool whether or not writing succeeds.
     *
     * @param out the destination
     * @throws IOException if the destination fails
     */
    public final void writeTo(Appendable out) throws IOException {
        try (ObjectPool.Lease<RingDeque<GreenNode>> lease = STACK_POOL.acquire()) {
            RingDeque<GreenNode> stack = lease.get();
            stack.push(this);
            while (!stack.isEmpty()) {
                stack.pop().writeTo(out, stack);
            }
        }
    }

    /**
     * Writes this node's own text, or pushes its children onto the work
     * stack so that the leftmost child is popped first.
     *
     * @param out the destination
     * @param stack the work stack
     * @throws IOException if the destination fails
     */
    void writeTo(Appendable out, RingDeque<GreenNode> stack) throws IOException {
        for (int i = getSlotCount() - 1; i >= 0; i--) {
            GreenNode child = getSlot(i);
            if (child != null) {
                stack.push(child);
            }
        }
    }

    /**
     * Returns the full text of this subtree.
     *
     * @return the text
     */
    public String toFullString() {
        try (ObjectPool.Lease<StringBuilder> lease = StringBuilderPool.getDefault().acquire()) {
            StringBuilder buf = lease.get();
            writeTo(buf);
            return buf.toString();
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Compares the structure of this subtree with another: kinds, slot
     * shapes, token text and diagnostics must all match. Reference
     * identity is not required.
     *
     * @param other the node to compare with
     * @return true if the subtrees are structurally equal
     */
    public boolean isEquivalentTo(GreenNode other) {
        if (this == other) {
            return true;
        }
        if (other == null || kind != other.kind || fullWidth != other.fullWidth) {
            return false;
        }
        if (!Arrays.equals(diagnostics, other.diagnostics)) {
            return false;
        }
        int slotCount = getSlotCount();
        if (slotCount != other.getSlotCount()) {
            return false;
        }
        for (int i = 0; i < slotCount; i++) {
            GreenNode child = getSlot(i);
            GreenNode otherChild = other.getSlot(i);
            if (child == null) {
                if (otherChild != null) {
                    return false;
                }
            } else if (!child.isEquivalentTo(otherChild)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + "[" + fullWidth + "]";
    }

    /**
     * Sums the full widths of the present nodes.
     */
    static int sumWidths(GreenNode... nodes) {
        int width = 0;
        for (GreenNode node : nodes) {
            if (node != null) {
                width += node.getFullWidth();
            }
        }
        return width;
    }

    /**
     * Indicates whether any of the present nodes contain diagnostics.
     */
    static boolean anyContainDiagnostics(GreenNode... nodes) {
        for (GreenNode node : nodes) {
            if (node != null && node.containsDiagnostics()) {
                return true;
            }
        }
        return false;
    }

}
