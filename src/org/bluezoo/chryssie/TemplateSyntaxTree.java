/*
 * TemplateSyntaxTree.java
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

package org.bluezoo.chryssie;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.bluezoo.chryssie.parser.TemplateParseException;
import org.bluezoo.chryssie.parser.TemplateParser;
import org.bluezoo.chryssie.parser.TemplateParserOptions;
import org.bluezoo.chryssie.syntax.Diagnostic;
import org.bluezoo.chryssie.syntax.DiagnosticInfo;
import org.bluezoo.chryssie.syntax.GreenDocument;
import org.bluezoo.chryssie.syntax.SyntaxNode;
import org.bluezoo.chryssie.syntax.SyntaxVisitor;
import org.bluezoo.chryssie.syntax.TextChange;

/**
 * A parsed template: its text, its syntax tree and the options it was
 * parsed with.
 *
 * <p>Trees are immutable. Editing the text yields a new tree built by
 * {@link #withChanges}, which shares every unaffected node with this one.
 * <pre>
 * TemplateSyntaxTree tree = TemplateSyntaxTree.parse("Hello &lt;#= name =#&gt;!");
 * TemplateSyntaxTree edited = tree.withChanges(TextChange.insert(5, ","));
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TemplateSyntaxTree {

    private static final Comparator<Diagnostic> POSITION_ORDER = new Comparator<Diagnostic>() {
        @Override
        public int compare(Diagnostic d1, Diagnostic d2) {
            return Integer.compare(d1.getPosition(), d2.getPosition());
        }
    };

    private final String text;
    private final GreenDocument root;
    private final TemplateParserOptions options;
    private int[] lineStarts;
    private List<Diagnostic> diagnostics;

    private TemplateSyntaxTree(String text, GreenDocument root, TemplateParserOptions options) {
        this.text = text;
        this.root = root;
        this.options = options;
    }

    /**
     * Parses a template with the default options.
     *
     * @param text the template text
     * @return the tree
     */
    public static TemplateSyntaxTree parse(CharSequence text) {
        return parse(text, new TemplateParserOptions());
    }

    /**
     * Parses a template.
     *
     * @param text the template text
     * @param options the parser options, copied into the tree
     * @return the tree
     */
    public static TemplateSyntaxTree parse(CharSequence text, TemplateParserOptions options) {
        TemplateParserOptions copy = new TemplateParserOptions(options);
        String s = text.toString();
        GreenDocument root = new TemplateParser(s, copy).parse();
        return new TemplateSyntaxTree(s, root, copy);
    }

    /**
     * Reads and parses a template.
     *
     * @param input the template source
     * @param encoding the character encoding of the source, or null for
     *        UTF-8
     * @param sourceName the name of the template, used in diagnostics
     * @param options the parser options, copied into the tree
     * @return the tree
     * @throws IOException if the source cannot be read
     */
    public static TemplateSyntaxTree parse(InputStream input, String encoding, String sourceName,
            TemplateParserOptions options) throws IOException {
        StringBuilder content = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(input, encoding != null ? encoding : "UTF-8"))) {
            char[] buf = new char[4096];
            int len;
            while ((len = reader.read(buf)) != -1) {
                content.append(buf, 0, len);
            }
        }
        TemplateParserOptions copy = new TemplateParserOptions(options);
        copy.setSourceName(sourceName);
        return parse(content, copy);
    }

    /**
     * Applies changes to the text of this tree and reparses it, reusing
     * the parts of this tree the changes leave intact.
     *
     * @param changes changes in this tree's text coordinates, sorted and
     *        not overlapping
     * @return the new tree
     * @throws IllegalArgumentException if the changes are invalid
     */
    public TemplateSyntaxTree withChanges(TextChange... changes) {
        List<TextChange> list = Arrays.asList(changes);
        return withChangedText(TextChange.apply(text, list), list);
    }

    /**
     * Reparses a new version of the text of this tree, reusing the parts
     * of this tree the changes leave intact.
     *
     * @param newText the new text
     * @param changes the changes turning this tree's text into newText,
     *        in this tree's text coordinates
     * @return the new tree
     * @throws IllegalArgumentException if the changes are invalid or do
     *         not account for newText
     */
    public TemplateSyntaxTree withChangedText(String newText, List<TextChange> changes) {
        GreenDocument newRoot = new TemplateParser(newText, options, root, changes).parse();
        return new TemplateSyntaxTree(newText, newRoot, options);
    }

    /**
     * Returns a positioned view of the document.
     *
     * @return the root syntax node
     */
    public SyntaxNode getRoot() {
        return SyntaxNode.attachRoot(root);
    }

    public GreenDocument getGreenRoot() {
        return root;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns a copy of the options this tree was parsed with.
     */
    public TemplateParserOptions getOptions() {
        return new TemplateParserOptions(options);
    }

    /**
     * Indicates whether the template contains syntax errors.
     */
    public boolean hasErrors() {
        return root.containsDiagnostics();
    }

    /**
     * Returns the syntax errors of the template in document order.
     *
     * @return the diagnostics, empty if the template is well formed
     */
    public synchronized List<Diagnostic> getDiagnostics() {
        if (diagnostics == null) {
            if (!root.containsDiagnostics()) {
                diagnostics = Collections.emptyList();
            } else {
                DiagnosticCollector collector = new DiagnosticCollector();
                getRoot().accept(collector);
                Collections.sort(collector.diagnostics, POSITION_ORDER);
                diagnostics = Collections.unmodifiableList(collector.diagnostics);
            }
        }
        return diagnostics;
    }

    /**
     * Fails if the template contains syntax errors.
     *
     * @throws TemplateParseException describing the first error
     */
    public void checkErrors() throws TemplateParseException {
        List<Diagnostic> list = getDiagnostics();
        if (!list.isEmpty()) {
            throw new TemplateParseException(list);
        }
    }

    /**
     * Returns the line number of a position.
     *
     * @param offset a position in the text
     * @return the line number (1-based)
     */
    public int getLineNumber(int offset) {
        return lineIndex(offset) + 1;
    }

    /**
     * Returns the column number of a position.
     *
     * @param offset a position in the text
     * @return the column number (1-based)
     */
    public int getColumnNumber(int offset) {
        int[] starts = getLineStarts();
        return offset - starts[lineIndex(offset)] + 1;
    }

    private int lineIndex(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0," + text.length() + "]");
        }
        int[] starts = getLineStarts();
        int i = Arrays.binarySearch(starts, offset);
        return (i >= 0) ? i : -i - 2;
    }

    private synchronized int[] getLineStarts() {
        if (lineStarts == null) {
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    count++;
                }
            }
            int[] starts = new int[count];
            int line = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts[line++] = i + 1;
                }
            }
            lineStarts = starts;
        }
        return lineStarts;
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Resolves the relative diagnostics of each node to absolute
     * positions, skipping subtrees without any.
     */
    private class DiagnosticCollector implements SyntaxVisitor {

        final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

        @Override
        public void visitDocument(SyntaxNode node) {
            visitChildren(node);
        }

        @Override
        public void visitTextRun(SyntaxNode node) {
            resolve(node);
        }

        @Override
        public void visitBlock(SyntaxNode node) {
            resolve(node);
            visitChildren(node);
        }

        @Override
        public void visitBlockContent(SyntaxNode node) {
            resolve(node);
        }

        @Override
        public void visitToken(SyntaxNode node) {
            // tokens carry no diagnostics
        }

        private void visitChildren(SyntaxNode node) {
            for (SyntaxNode child : node.getChildren()) {
                if (child.getGreen().containsDiagnostics()) {
                    child.accept(this);
                }
            }
        }

        private void resolve(SyntaxNode node) {
            for (DiagnosticInfo info : node.getGreen().getDiagnostics()) {
                int position = node.getPosition() + info.getOffset();
                diagnostics.add(new Diagnostic(info.getCode(), info.getMessage(),
                        options.getSourceName(), position, info.getWidth(),
                        getLineNumber(position), getColumnNumber(position)));
            }
        }

    }

}
