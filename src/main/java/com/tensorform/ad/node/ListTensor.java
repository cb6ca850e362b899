package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** A tensor assembled from equally shaped components along a new leading axis. */
public final class ListTensor extends AbstractExpr {

    public ListTensor(List<Expr> components) {
        super(ExprKind.LIST_TENSOR, components, shape(components), first(components).freeIndices(),
                Signatures.mergeDims(components));
        Signatures.requireSameSignature(components, "ListTensor");
    }

    private static Expr first(List<Expr> components) {
        if (components.isEmpty())
            throw new IllegalArgumentException("ListTensor needs at least one component");
        return components.get(0);
    }

    private static List<Integer> shape(List<Expr> components) {
        List<Integer> sh = new ArrayList<>();
        sh.add(components.size());
        sh.addAll(first(components).shape());
        return sh;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new ListTensor(newOperands);
    }

    @Override
    public String toString() {
        return operands().stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
