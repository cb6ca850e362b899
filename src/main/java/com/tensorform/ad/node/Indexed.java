package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component access {@code A[jj]}. The multi-index must address every axis of
 * {@code A}, so the result is scalar.
 */
public final class Indexed extends AbstractExpr {

    public Indexed(Expr tensor, MultiIndex indices) {
        super(ExprKind.INDEXED, List.of(tensor, indices), List.of(),
                Signatures.unique(tensor.freeIndices(), indices.symbolicIndices()), dims(tensor, indices));
    }

    private static Map<Index, Integer> dims(Expr tensor, MultiIndex indices) {
        if (indices.size() != tensor.rank())
            throw new IllegalArgumentException("Indexing rank-" + tensor.rank() + " tensor " + tensor + " with "
                    + indices.size() + " indices");
        Map<Index, Integer> dims = new LinkedHashMap<>(tensor.indexDimensions());
        for (int k = 0; k < indices.size(); k++) {
            IndexBase b = indices.get(k);
            int d = tensor.shape().get(k);
            if (b instanceof FixedIndex f) {
                if (f.value() >= d)
                    throw new IndexOutOfBoundsException("Fixed index " + f + " out of range for axis of size " + d);
            } else {
                Signatures.putAll(dims, Map.of((Index) b, d));
            }
        }
        return dims;
    }

    public Expr tensor() {
        return operands().get(0);
    }

    public MultiIndex indices() {
        return (MultiIndex) operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Indexed(newOperands.get(0), (MultiIndex) newOperands.get(1));
    }

    @Override
    public String toString() {
        return tensor() + "[" + indices() + "]";
    }
}
