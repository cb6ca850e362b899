package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds free indices of a scalar expression as tensor axes:
 * {@code as_tensor(A, ii)}.
 */
public final class ComponentTensor extends AbstractExpr {

    public ComponentTensor(Expr body, MultiIndex indices) {
        super(ExprKind.COMPONENT_TENSOR, List.of(body, indices), shape(body, indices),
                Signatures.without(body.freeIndices(), indices.symbolicIndices()), body.indexDimensions());
    }

    private static List<Integer> shape(Expr body, MultiIndex indices) {
        Signatures.requireScalar(body, "ComponentTensor");
        if (indices.size() == 0)
            throw new IllegalArgumentException("ComponentTensor needs at least one index");
        List<Integer> sh = new ArrayList<>(indices.size());
        for (var b : indices.indices()) {
            if (!(b instanceof Index i) || !body.freeIndices().contains(i))
                throw new IllegalArgumentException("Index " + b + " is not free in " + body);
            sh.add(body.indexDimensions().get(i));
        }
        return sh;
    }

    public Expr body() {
        return operands().get(0);
    }

    public MultiIndex indices() {
        return (MultiIndex) operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new ComponentTensor(newOperands.get(0), (MultiIndex) newOperands.get(1));
    }

    @Override
    public String toString() {
        return "{" + body() + "}_(" + indices() + ")";
    }
}
