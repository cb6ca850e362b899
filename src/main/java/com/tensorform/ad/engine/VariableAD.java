package com.tensorform.ad.engine;

import com.tensorform.ad.node.Variable;

import java.util.List;

/**
 * Derivative with respect to a labeled variable.
 *
 * Variables are matched by label identity, not by the structure of the
 * expression they wrap.
 */
public class VariableAD extends ForwardAD {
    private final Variable variable;

    public VariableAD(AdContext context, int spatialDimension, Variable variable) {
        super(context, spatialDimension, variable.shape(), variable.freeIndices(), variable.indexDimensions());
        this.variable = variable;
    }

    public Variable variable() {
        return variable;
    }

    @Override
    public String describeVariable() {
        return variable.label().toString();
    }

    @Override
    protected Dual variable(Variable o) {
        Dual cached = cachedVariable(o.label());
        if (cached != null)
            return cached;

        if (o.label() == variable.label())
            return cacheVariable(o.label(), new Dual(o, makeOnesDiff(o)));

        Dual e = visit(o.expression());
        return cacheVariable(o.label(), new Dual(o.reconstruct(List.of(e.primal())), e.derivative()));
    }
}
