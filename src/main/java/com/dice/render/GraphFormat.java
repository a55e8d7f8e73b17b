package com.dice.render;

/**
 * Graph text formats for visualizing a syntax tree.
 */
public enum GraphFormat {
    /**
     * Graphviz {@code digraph}.
     */
    DOT,

    /**
     * Mermaid {@code graph TB}.
     */
    MERMAID
}
