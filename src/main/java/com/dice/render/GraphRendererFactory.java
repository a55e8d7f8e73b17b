package com.dice.render;

/**
 * Factory for creating GraphRenderer instances by output format.
 */
public final class GraphRendererFactory {

    private GraphRendererFactory() {
    }

    public static GraphRenderer create(GraphFormat format) {
        if (format == null) {
            format = GraphFormat.DOT;
        }

        return switch (format) {
            case DOT -> new DotRenderer();
            case MERMAID -> new MermaidRenderer();
        };
    }
}
