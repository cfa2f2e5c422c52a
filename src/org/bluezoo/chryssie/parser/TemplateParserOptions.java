/*
 * TemplateParserOptions.java
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

/**
 * Options controlling how templates are parsed.
 *
 * <p>The defaults of the incremental flags may be set with the system
 * properties {@code chryssie.incremental} and {@code chryssie.reuseNodes}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TemplateParserOptions {

    static final boolean DEFAULT_INCREMENTAL =
            Boolean.parseBoolean(System.getProperty("chryssie.incremental", "true"));
    static final boolean DEFAULT_REUSE_NODES =
            Boolean.parseBoolean(System.getProperty("chryssie.reuseNodes", "true"));

    private TemplateDelimiters delimiters = TemplateDelimiters.DEFAULT;
    private boolean incremental = DEFAULT_INCREMENTAL;
    private boolean reuseNodes = DEFAULT_REUSE_NODES;
    private String sourceName;

    public TemplateParserOptions() {
    }

    /**
     * Copy constructor.
     *
     * @param other the options to copy
     */
    public TemplateParserOptions(TemplateParserOptions other) {
        delimiters = other.delimiters;
        incremental = other.incremental;
        reuseNodes = other.reuseNodes;
        sourceName = other.sourceName;
    }

    public TemplateDelimiters getDelimiters() {
        return delimiters;
    }

    /**
     * Sets the delimiter texts.
     *
     * @param delimiters the delimiters
     */
    public void setDelimiters(TemplateDelimiters delimiters) {
        if (delimiters == null) {
            throw new IllegalArgumentException("delimiters must not be null");
        }
        this.delimiters = delimiters;
    }

    public boolean isIncremental() {
        return incremental;
    }

    /**
     * Sets whether reparsing after a change reuses the previous tree.
     * When false, every reparse lexes the whole text.
     *
     * @param incremental whether to reuse the previous tree
     */
    public void setIncremental(boolean incremental) {
        this.incremental = incremental;
    }

    public boolean isReuseNodes() {
        return reuseNodes;
    }

    /**
     * Sets whether whole blocks may be reused during an incremental
     * reparse, rather than only their tokens.
     *
     * @param reuseNodes whether to reuse blocks
     */
    public void setReuseNodes(boolean reuseNodes) {
        this.reuseNodes = reuseNodes;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Sets the name of the template, used in diagnostics.
     *
     * @param sourceName the name, or null
     */
    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

}
