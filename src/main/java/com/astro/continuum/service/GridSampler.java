package com.astro.continuum.service;

import com.astro.continuum.model.OptimizationTrace;
import com.astro.continuum.model.RegionSample;

import java.util.Locale;

/**
 * Evalua la AAD sobre una rejilla de coeficientes, anotando cada punto en la traza.
 */
final class GridSampler {

    private GridSampler() {
    }

    /** Puntos equiespaciados en [min, max], extremos incluidos. */
    static double[] evenlySpaced(double min, double max, int count) {
        double[] grid = new double[count];
        double step = (max - min) / (count - 1);
        for (int i = 0; i < count; i++) grid[i] = min + i * step;
        grid[count - 1] = max;
        return grid;
    }

    static double[] evaluate(RegionSample sample, double[] grid, OptimizationTrace.Phase phase,
                             OptimizationTrace trace, ProgressTracker progress, CancellationToken token) {
        float[] nb = sample.narrowbandPixels();
        float[] co = sample.continuumPixels();
        String label = (phase == OptimizationTrace.Phase.COARSE) ? "Coarse search" : "Fine search";

        double[] values = new double[grid.length];
        for (int i = 0; i < grid.length; i++) {
            token.throwIfCancelled();
            values[i] = AadMetric.aad(nb, co, sample.baseline, grid[i]);
            trace.add(phase, grid[i], values[i]);
            progress.advance(String.format(Locale.US, "%s: c=%.4f (%d/%d)", label, grid[i], i + 1, grid.length));
        }
        return values;
    }

    /** Indice del minimo; ante empate, el primero. */
    static int argMin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) best = i;
        }
        return best;
    }
}
