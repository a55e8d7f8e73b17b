package com.dice.render;

import com.dice.ast.Add;
import com.dice.ast.Advantage;
import com.dice.ast.BinaryNode;
import com.dice.ast.Disadvantage;
import com.dice.ast.Discard;
import com.dice.ast.Divide;
import com.dice.ast.Keep;
import com.dice.ast.Literal;
import com.dice.ast.Multiply;
import com.dice.ast.Negate;
import com.dice.ast.Node;
import com.dice.ast.Roll;
import com.dice.ast.SelectMode;
import com.dice.ast.Selector;
import com.dice.ast.Subtract;

import java.util.Objects;

/**
 * Serializes a syntax tree as graph text without evaluating it.
 * <p>
 * Nodes are numbered {@code node0001}, {@code node0002}, ... in pre-order (parent before
 * children, left before right), so rendering the same tree twice gives identical output.
 * Every node and every parent-to-child edge is written exactly once. Edges carry the child's
 * role: {@code left}, {@code right}, {@code inner}, {@code count}, {@code sides} or
 * {@code select}.
 */
public abstract class GraphRenderer {

    /**
     * Render a tree.
     *
     * @param root Parsed expression
     * @return Graph text, newline terminated
     */
    public String render(Node root) {
        Objects.requireNonNull(root, "root must not be null");

        StringBuilder out = new StringBuilder();
        writeHeader(out);
        new Walk(out).visit(root);
        writeFooter(out);
        return out.toString();
    }

    protected abstract void writeHeader(StringBuilder out);

    protected abstract void writeNode(StringBuilder out, String id, String label);

    protected abstract void writeEdge(StringBuilder out, String parentId, String childId, String role);

    protected void writeFooter(StringBuilder out) {
    }

    /**
     * Display label for a node.
     */
    static String label(Node node) {
        if (node instanceof Literal literal) {
            return String.valueOf(literal.value());
        }
        if (node instanceof Add) {
            return "Add";
        }
        if (node instanceof Subtract) {
            return "Subtract";
        }
        if (node instanceof Multiply) {
            return "Multiply";
        }
        if (node instanceof Divide) {
            return "Divide";
        }
        if (node instanceof Negate) {
            return "Negate";
        }
        if (node instanceof Roll) {
            return "Roll";
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    /**
     * Display label for a selector.
     */
    static String label(Selector selector) {
        if (selector instanceof Keep keep) {
            return (keep.mode() == SelectMode.HIGH ? "Keep Highest " : "Keep Lowest ") + keep.n();
        }
        if (selector instanceof Discard discard) {
            return (discard.mode() == SelectMode.HIGH ? "Discard Highest " : "Discard Lowest ") + discard.n();
        }
        if (selector instanceof Advantage) {
            return "Advantage";
        }
        if (selector instanceof Disadvantage) {
            return "Disadvantage";
        }
        throw new IllegalStateException("Unknown selector type: " + selector);
    }

    /**
     * One render pass. Holds the id counter so renders never share numbering.
     */
    private class Walk {
        private final StringBuilder out;
        private int nextId = 1;

        Walk(StringBuilder out) {
            this.out = out;
        }

        String visit(Node node) {
            String id = declare(label(node));

            if (node instanceof BinaryNode binary) {
                edge(id, visit(binary.left()), "left");
                edge(id, visit(binary.right()), "right");
            } else if (node instanceof Negate negate) {
                edge(id, visit(negate.inner()), "inner");
            } else if (node instanceof Roll roll) {
                edge(id, visit(roll.count()), "count");
                edge(id, visit(roll.sides()), "sides");
                for (Selector selector : roll.selectors()) {
                    edge(id, declare(label(selector)), "select");
                }
            }
            return id;
        }

        private String declare(String label) {
            String id = String.format("node%04x", nextId++);
            writeNode(out, id, label);
            return id;
        }

        private void edge(String parentId, String childId, String role) {
            writeEdge(out, parentId, childId, role);
        }
    }
}
