package com.astro.continuum.model;

/**
 * Parametros de las dos busquedas y del ajuste no lineal.
 */
public class EstimatorSettings {
    public static final double DEFAULT_COARSE_MIN = -1.0;
    public static final double DEFAULT_COARSE_MAX = 5.0;
    public static final int DEFAULT_COARSE_SAMPLES = 12;
    public static final double DEFAULT_FINE_HALF_WIDTH = 1.0;
    public static final int DEFAULT_FINE_SAMPLES = 40;
    public static final double DEFAULT_INITIAL_EPSILON = 0.01;
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    public final double coarseMin;
    public final double coarseMax;
    public final int coarseSamples;
    public final double fineHalfWidth;
    public final int fineSamples;
    public final double initialEpsilon;
    public final int maxIterations;

    public EstimatorSettings(double coarseMin, double coarseMax, int coarseSamples,
                             double fineHalfWidth, int fineSamples,
                             double initialEpsilon, int maxIterations) {
        if (!(coarseMax > coarseMin)) {
            throw new IllegalArgumentException("coarse interval is empty: [" + coarseMin + ", " + coarseMax + "]");
        }
        if (coarseSamples < 2 || fineSamples < 2) {
            throw new IllegalArgumentException("at least two samples per search phase are required");
        }
        if (!(fineHalfWidth > 0)) {
            throw new IllegalArgumentException("fine half width must be positive: " + fineHalfWidth);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("max iterations must be positive: " + maxIterations);
        }
        this.coarseMin = coarseMin;
        this.coarseMax = coarseMax;
        this.coarseSamples = coarseSamples;
        this.fineHalfWidth = fineHalfWidth;
        this.fineSamples = fineSamples;
        this.initialEpsilon = initialEpsilon;
        this.maxIterations = maxIterations;
    }

    public static EstimatorSettings defaults() {
        return new EstimatorSettings(DEFAULT_COARSE_MIN, DEFAULT_COARSE_MAX, DEFAULT_COARSE_SAMPLES,
                DEFAULT_FINE_HALF_WIDTH, DEFAULT_FINE_SAMPLES, DEFAULT_INITIAL_EPSILON, DEFAULT_MAX_ITERATIONS);
    }

    public int totalSamples() {
        return coarseSamples + fineSamples;
    }

    @Override
    public String toString() {
        return "EstimatorSettings[coarse=[" + coarseMin + ", " + coarseMax + "]x" + coarseSamples
                + ", fine=+-" + fineHalfWidth + "x" + fineSamples
                + ", eps0=" + initialEpsilon + ", maxIter=" + maxIterations + "]";
    }
}
