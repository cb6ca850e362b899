package com.tensorform.ad;

import com.tensorform.ad.api.DiagnosticSink;
import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.InternalErrorException;
import com.tensorform.ad.engine.AdContext;
import com.tensorform.ad.engine.CoefficientAD;
import com.tensorform.ad.engine.ForwardAD;
import com.tensorform.ad.engine.SpatialAD;
import com.tensorform.ad.engine.VariableAD;
import com.tensorform.ad.io.AdOptions;
import com.tensorform.ad.io.JsonExpressionCompiler.CompiledExpression;
import com.tensorform.ad.node.CoefficientDerivative;
import com.tensorform.ad.node.SpatialDerivative;
import com.tensorform.ad.node.VariableDerivative;
import com.tensorform.ad.util.CompositeDifferentiationListener;
import com.tensorform.ad.util.LoggingDiagnosticSink;
import com.tensorform.ad.util.TracingListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point: resolves one derivative marker into its derivative expression.
 *
 * <p>
 * The marker's operand must not contain unresolved derivative markers of its
 * own, and compound operators without a differentiation rule (cross product,
 * determinant, cofactor, inverse) must have been expanded beforehand.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Selecting the engine for the marker kind: spatial, variable or
 * coefficient (Gateaux) derivative</li>
 * <li>Creating a fresh {@link AdContext} for every call, so caches are never
 * shared between runs</li>
 * <li>Routing diagnostics to the configured {@link DiagnosticSink} and events
 * to the registered listeners</li>
 * </ul>
 *
 * <p>
 * An instance holds configuration only and may be reused; it is not meant to
 * be shared between threads while listeners are being added.
 */
public class ForwardAdDriver {
    private static final Logger log = LogManager.getLogger(ForwardAdDriver.class);

    private final AdOptions options;
    private final DiagnosticSink sink;
    private final CompositeDifferentiationListener compositeListener = new CompositeDifferentiationListener();

    public ForwardAdDriver() {
        this(AdOptions.defaults());
    }

    public ForwardAdDriver(AdOptions options) {
        this(options, LoggingDiagnosticSink.INSTANCE);
    }

    public ForwardAdDriver(AdOptions options, DiagnosticSink sink) {
        this.options = options;
        this.sink = sink;
        if (options.isTrace())
            compositeListener.addForComposite(new TracingListener());
    }

    /**
     * Differentiates with default options, logging diagnostics.
     *
     * @param marker           a spatial, variable or coefficient derivative
     *                         marker.
     * @param spatialDimension the geometric dimension of the domain.
     */
    public static Expr apply(Expr marker, int spatialDimension) {
        return new ForwardAdDriver().differentiate(marker, spatialDimension);
    }

    /**
     * Registers a listener for all subsequent runs. Adds to the listeners
     * already registered.
     */
    public ForwardAdDriver addListener(DifferentiationListener listener) {
        compositeListener.addForComposite(listener);
        return this;
    }

    public AdOptions options() {
        return options;
    }

    public DiagnosticSink sink() {
        return sink;
    }

    /**
     * Computes the derivative the marker stands for.
     *
     * @throws InternalErrorException if {@code marker} is not a derivative
     *                                marker.
     */
    public Expr differentiate(Expr marker, int spatialDimension) {
        AdContext context = new AdContext(options, sink, compositeListener.size() > 0 ? compositeListener : null);
        ForwardAD ad = switch (marker.kind()) {
            case SPATIAL_DERIVATIVE -> new SpatialAD(context, spatialDimension,
                    ((SpatialDerivative) marker).index().get(0));
            case VARIABLE_DERIVATIVE -> new VariableAD(context, spatialDimension,
                    ((VariableDerivative) marker).variable());
            case COEFFICIENT_DERIVATIVE -> {
                CoefficientDerivative cd = (CoefficientDerivative) marker;
                yield new CoefficientAD(context, spatialDimension, cd.coefficients(), cd.directions(),
                        cd.derivatives());
            }
            default -> {
                InternalErrorException error = new InternalErrorException(
                        "Expecting a derivative marker, got " + marker.kind() + ": " + marker);
                sink.fail(error);
                throw error;
            }
        };
        Expr operand = marker.operands().get(0);
        log.debug("Run {}: {} of {} with respect to {}", context.runId(), marker.kind(), operand.kind(),
                ad.describeVariable());
        return ad.differentiate(operand);
    }

    /**
     * Differentiates the root of a compiled JSON definition, using the
     * definition's spatial dimension.
     */
    public Expr differentiate(CompiledExpression expression) {
        return differentiate(expression.root(), expression.spatialDimension());
    }
}
