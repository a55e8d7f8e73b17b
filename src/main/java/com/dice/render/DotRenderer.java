package com.dice.render;

/**
 * Renders a syntax tree as a Graphviz {@code digraph}.
 * <p>
 * Example for {@code 1 + 2}:
 * <pre>
 * digraph {
 *     graph [rankdir=TB]
 *     node [shape=rect]
 *     edge [fontsize=10]
 *     node0001 [label="Add"]
 *     node0002 [label="1"]
 *     node0001 -&gt; node0002 [label="left"]
 *     node0003 [label="2"]
 *     node0001 -&gt; node0003 [label="right"]
 * }
 * </pre>
 */
public class DotRenderer extends GraphRenderer {

    private static final String INDENT = "    ";

    @Override
    protected void writeHeader(StringBuilder out) {
        out.append("digraph {\n");
        out.append(INDENT).append("graph [rankdir=TB]\n");
        out.append(INDENT).append("node [shape=rect]\n");
        out.append(INDENT).append("edge [fontsize=10]\n");
    }

    @Override
    protected void writeNode(StringBuilder out, String id, String label) {
        out.append(INDENT).append(id).append(" [label=\"").append(escape(label)).append("\"]\n");
    }

    @Override
    protected void writeEdge(StringBuilder out, String parentId, String childId, String role) {
        out.append(INDENT).append(parentId).append(" -> ").append(childId)
                .append(" [label=\"").append(escape(role)).append("\"]\n");
    }

    @Override
    protected void writeFooter(StringBuilder out) {
        out.append("}\n");
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
