package com.astro.continuum.service;

import com.astro.continuum.model.FitModel;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Ajuste por minimos cuadrados acotados (Levenberg-Marquardt) del modelo
 * f(x) = A * sqrt((x - s0)^2 + eps^2) + B.
 *
 * <p>La curva AAD(c) es casi una V con un minimo agudo; eps suaviza el vertice para
 * que el optimizador tenga derivadas. Los limites son A &gt;= -1, 0 &lt;= s0 &lt;= s0Max,
 * eps &gt;= 0, B &gt;= 0; se imponen recortando cada punto de prueba.
 */
public class SmoothVFitter {

    static final int A = 0;
    static final int S0 = 1;
    static final int EPS = 2;
    static final int B = 3;

    private static final double MIN_AMPLITUDE = -1.0;
    private static final double RELATIVE_COST_TOLERANCE = 1e-10;

    private final int maxIterations;

    public SmoothVFitter(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * @param x      coeficientes muestreados, en orden creciente
     * @param y      AAD en cada coeficiente
     * @param s0Max  limite superior del vertice
     * @param initialEpsilon valor inicial de eps
     * @return parametros ajustados
     * @throws FitDivergenceException si el optimizador no converge o devuelve valores no finitos
     */
    public FitModel fit(double[] x, double[] y, double s0Max, double initialEpsilon) {
        if (x.length != y.length || x.length < 4) {
            throw new IllegalArgumentException("need at least 4 (c, aad) pairs, got " + x.length + "/" + y.length);
        }
        double upperVertex = Math.max(0.0, s0Max);
        double[] start = clamp(initialGuess(x, y, initialEpsilon), upperVertex);

        final LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
        final RealVector observed = new ArrayRealVector(y, true);
        final ConvergenceChecker<Evaluation> checker = (iteration, previous, current) -> {
            double p = previous.getCost();
            double c = current.getCost();
            return Math.abs(p - c) <= RELATIVE_COST_TOLERANCE * Math.max(Math.abs(p), Math.abs(c));
        };
        final ParameterValidator validator = point -> {
            double[] p = clamp(point.toArray(), upperVertex);
            for (int i = 0; i < p.length; i++) point.setEntry(i, p[i]);
            return point;
        };
        double[] ones = new double[y.length];
        Arrays.fill(ones, 1.0);
        final RealMatrix weights = new DiagonalMatrix(ones, false);

        final LeastSquaresProblem problem = LeastSquaresFactory.create(new SmoothVFunction(x), observed,
                new ArrayRealVector(start, false), weights, checker, Integer.MAX_VALUE, maxIterations, false, validator);
        try {
            final Optimum optimum = optimizer.optimize(problem);
            FitModel model = FitModel.fromArray(clamp(optimum.getPoint().toArray(), upperVertex));
            if (!model.isFinite()) {
                throw new FitDivergenceException("Smooth-V fit produced non-finite parameters: " + model);
            }
            LOG.debug("fit: {} after {} iterations, rms={}", model, optimum.getIterations(), optimum.getRMS());
            return model;
        } catch (TooManyIterationsException | ConvergenceException ex) {
            throw new FitDivergenceException("Smooth-V fit did not converge: " + ex.getMessage(), ex);
        }
    }

    /**
     * B0 = min(y), s0 = x en argmin(y), A0 = pendiente de la secante entre el primer y
     * el ultimo punto, eps0 dado.
     */
    static double[] initialGuess(double[] x, double[] y, double initialEpsilon) {
        int best = GridSampler.argMin(y);
        int last = x.length - 1;
        double slope = (y[last] - y[0]) / (x[last] - x[0]);
        double[] p = new double[4];
        p[A] = slope;
        p[S0] = x[best];
        p[EPS] = initialEpsilon;
        p[B] = y[best];
        return p;
    }

    static double[] clamp(double[] p, double upperVertex) {
        double[] q = p.clone();
        q[A] = Math.max(MIN_AMPLITUDE, q[A]);
        q[S0] = Math.min(upperVertex, Math.max(0.0, q[S0]));
        q[EPS] = Math.max(0.0, q[EPS]);
        q[B] = Math.max(0.0, q[B]);
        return q;
    }

    /**
     * Valores y jacobiano del modelo.
     *
     * <pre>
     * r = sqrt((x - s0)^2 + eps^2)
     * df/dA   = r
     * df/ds0  = -A (x - s0) / r
     * df/deps = A eps / r
     * df/dB   = 1
     * </pre>
     */
    static final class SmoothVFunction implements MultivariateJacobianFunction {
        private final double[] x;

        SmoothVFunction(double[] x) {
            this.x = x;
        }

        @Override
        public Pair<RealVector, RealMatrix> value(RealVector point) {
            final double a = point.getEntry(A);
            final double s0 = point.getEntry(S0);
            final double eps = point.getEntry(EPS);
            final double b = point.getEntry(B);

            final double[] value = new double[x.length];
            final double[][] jacobian = new double[x.length][4];
            for (int i = 0; i < x.length; i++) {
                final double d = x[i] - s0;
                final double r = Math.sqrt(d * d + eps * eps);
                value[i] = a * r + b;
                jacobian[i][A] = r;
                // en el vertice exacto con eps = 0 la derivada no existe; se toma 0
                jacobian[i][S0] = (r > 0) ? -a * d / r : 0.0;
                jacobian[i][EPS] = (r > 0) ? a * eps / r : 0.0;
                jacobian[i][B] = 1.0;
            }
            return new Pair<>(new ArrayRealVector(value, false), new Array2DRowRealMatrix(jacobian, false));
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SmoothVFitter.class);
}
