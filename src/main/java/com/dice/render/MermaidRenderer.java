package com.dice.render;

/**
 * Renders a syntax tree as a Mermaid {@code graph TB}.
 * <p>
 * Example for {@code 1 + 2}:
 * <pre>
 * graph TB
 *     node0001("Add")
 *     node0002("1")
 *     node0001 --&gt;|left| node0002
 *     node0003("2")
 *     node0001 --&gt;|right| node0003
 * </pre>
 */
public class MermaidRenderer extends GraphRenderer {

    private static final String INDENT = "    ";

    @Override
    protected void writeHeader(StringBuilder out) {
        out.append("graph TB\n");
    }

    @Override
    protected void writeNode(StringBuilder out, String id, String label) {
        out.append(INDENT).append(id).append("(\"").append(escape(label)).append("\")\n");
    }

    @Override
    protected void writeEdge(StringBuilder out, String parentId, String childId, String role) {
        out.append(INDENT).append(parentId).append(" -->|").append(role).append("| ").append(childId).append('\n');
    }

    // Mermaid has no backslash escapes inside quoted labels
    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
