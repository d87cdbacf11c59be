package com.astro.continuum.service;

import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.OptimizationTrace;
import com.astro.continuum.model.RegionSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Busqueda gruesa en un intervalo amplio: el optimo puede caer fuera de [0, 1] y
 * sirve para centrar la ventana de la busqueda fina.
 */
public class CoarseSearchService {

    private final EstimatorSettings settings;

    public CoarseSearchService(EstimatorSettings settings) {
        this.settings = settings;
    }

    public double search(RegionSample sample, OptimizationTrace trace) {
        return search(sample, trace, new ProgressTracker(ProgressListener.NONE, settings.coarseSamples),
                new CancellationToken());
    }

    double search(RegionSample sample, OptimizationTrace trace, ProgressTracker progress, CancellationToken token) {
        double[] grid = GridSampler.evenlySpaced(settings.coarseMin, settings.coarseMax, settings.coarseSamples);
        double[] values = GridSampler.evaluate(sample, grid, OptimizationTrace.Phase.COARSE, trace, progress, token);
        int best = GridSampler.argMin(values);

        LOG.debug("search: coarse minimum c0={} (aad={}) over [{}, {}]",
                grid[best], values[best], settings.coarseMin, settings.coarseMax);
        return grid[best];
    }

    private static final Logger LOG = LoggerFactory.getLogger(CoarseSearchService.class);
}
