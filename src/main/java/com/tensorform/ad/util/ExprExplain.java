package com.tensorform.ad.util;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.node.BesselFunction;
import com.tensorform.ad.node.Condition;
import com.tensorform.ad.node.MathFunction;
import com.tensorform.ad.node.Restricted;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting the structure of an expression DAG.
 *
 * <p>
 * Nodes are numbered in post-order (operands before their parents) by object
 * identity, so a shared sub-expression appears exactly once and every
 * reference to it uses the same number.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports. Allocates
 * strings and walks the whole DAG.
 */
public final class ExprExplain {
    private final Expr root;
    private final List<Expr> order = new ArrayList<>();
    private final Map<Expr, Integer> ids = new IdentityHashMap<>();

    public ExprExplain(Expr root) {
        this.root = root;
        number(root);
    }

    private void number(Expr e) {
        if (ids.containsKey(e))
            return;
        for (Expr op : e.operands())
            number(op);
        ids.put(e, order.size());
        order.add(e);
    }

    /** Number of distinct node objects reachable from the root. */
    public int nodeCount() {
        return order.size();
    }

    /** Post-order number of {@code e}, or -1 if it is not part of the DAG. */
    public int idOf(Expr e) {
        Integer id = ids.get(e);
        return id == null ? -1 : id;
    }

    /**
     * Dumps the DAG, one line per distinct node.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Expression (").append(order.size()).append(" nodes, root [").append(ids.get(root))
                .append("]):\n");
        for (int i = 0; i < order.size(); i++) {
            Expr e = order.get(i);
            sb.append("  [").append(i).append("] ").append(label(e));
            if (!e.shape().isEmpty())
                sb.append(" shape=").append(e.shape());
            if (!e.freeIndices().isEmpty())
                sb.append(" free=").append(e.freeIndices());
            List<Expr> ops = e.operands();
            if (!ops.isEmpty()) {
                sb.append(" <- ");
                for (int j = 0; j < ops.size(); j++) {
                    sb.append('[').append(ids.get(ops.get(j))).append(']');
                    if (j < ops.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, edges pointing from operand to
     * parent.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (int i = 0; i < order.size(); i++) {
            Expr e = order.get(i);
            sb.append("  n").append(i).append("[\"").append(escape(label(e))).append("\"];\n");
        }

        // 2. Edges
        for (int i = 0; i < order.size(); i++) {
            for (Expr op : order.get(i).operands())
                sb.append("  n").append(ids.get(op)).append(" --> n").append(i).append(";\n");
        }
        return sb.toString();
    }

    /** Short description: terminals print themselves, operators their kind. */
    static String label(Expr e) {
        if (e.operands().isEmpty())
            return e.toString();
        if (e instanceof MathFunction mf)
            return mf.function().symbol();
        if (e instanceof BesselFunction bf)
            return "bessel_" + bf.function();
        if (e instanceof Condition c)
            return c.condition().symbol();
        if (e instanceof Restricted r)
            return "restricted(" + r.side().symbol() + ")";
        return e.kind().name();
    }

    private static String escape(String s) {
        return s.replace("\"", "#quot;");
    }
}
