package com.tensorform.ad.engine;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.PreconditionException;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.dsl.IndexAlgebra;
import com.tensorform.ad.dsl.IndexAlgebra.Scalarized;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.CoefficientDerivativeMap;
import com.tensorform.ad.node.Signatures;
import com.tensorform.ad.node.Zero;

import java.util.List;
import java.util.Map;

/**
 * Gateaux derivative with respect to coefficients {@code w_k} in directions
 * {@code v_k}.
 *
 * {@code dw_k/dw = v_k}. For any other coefficient {@code g} the partial
 * derivative table is consulted: each entry {@code dg/dw} is contracted with
 * its direction over the direction's axes, and the contributions of all
 * directions are summed. A coefficient missing from the table is assumed
 * independent, with a warning.
 */
public class CoefficientAD extends ForwardAD {
    private final List<Coefficient> coefficients;
    private final List<Expr> directions;
    private final CoefficientDerivativeMap derivatives;

    public CoefficientAD(AdContext context, int spatialDimension, List<Coefficient> coefficients,
            List<Expr> directions, CoefficientDerivativeMap derivatives) {
        super(context, spatialDimension, List.of(), List.of(), Map.of());
        if (coefficients.size() != directions.size())
            throw new IllegalArgumentException("Expecting one direction per coefficient");
        this.coefficients = List.copyOf(coefficients);
        this.directions = List.copyOf(directions);
        this.derivatives = derivatives;
    }

    @Override
    public String describeVariable() {
        return "w=" + coefficients + " v=" + directions;
    }

    @Override
    protected Dual coefficient(Coefficient o) {
        for (int k = 0; k < coefficients.size(); k++)
            if (coefficients.get(k).equals(o))
                return new Dual(o, directions.get(k));

        Expr result = new Zero(o.shape());
        List<Expr> partials = derivatives.get(o);
        if (partials == null) {
            if (context.options().isWarnMissingCoefficientDerivatives())
                context.warnOnce("coefficient:" + o.count(),
                        "Assuming d{" + o + "}/d{" + coefficients + "} = 0.");
            return new Dual(o, result);
        }
        if (partials.size() != directions.size())
            throw fatal(new PreconditionException("Got " + partials.size() + " derivatives of " + o
                    + ", expecting one per direction (" + directions.size() + ")"));

        for (int k = 0; k < partials.size(); k++) {
            Expr partial = partials.get(k);
            Expr v = directions.get(k);
            List<Integer> expected = Signatures.concat(o.shape(), v.shape());
            if (!partial.shape().equals(expected))
                throw fatal(new PreconditionException("Derivative " + partial + " of " + o + " has shape "
                        + partial.shape() + ", expecting " + expected));

            Scalarized s = IndexAlgebra.asScalar(partial);
            List<Index> oi = s.indices();
            int split = oi.size() - v.rank();
            List<Index> outer = oi.subList(0, split);
            List<Index> contracted = oi.subList(split, oi.size());
            // Repeated indices are summed: an inner product over the direction's axes
            Expr prod = Exprs.multiply(s.scalar(), Exprs.indexed(v, contracted));
            result = Exprs.add(result, IndexAlgebra.asTensor(prod, outer));
        }
        return new Dual(o, result);
    }
}
