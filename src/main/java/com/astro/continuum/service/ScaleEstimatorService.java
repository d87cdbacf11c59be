package com.astro.continuum.service;

import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.FitModel;
import com.astro.continuum.model.OptimizationTrace;
import com.astro.continuum.model.RegionSample;
import com.astro.continuum.model.ScaleEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Busqueda fina en [c0 - 1, c0 + 1] seguida del ajuste de la V suavizada. Si el ajuste
 * no converge se usa el mejor punto de la rejilla fina.
 */
public class ScaleEstimatorService {

    private final EstimatorSettings settings;
    private final SmoothVFitter fitter;

    public ScaleEstimatorService(EstimatorSettings settings) {
        this(settings, new SmoothVFitter(settings.maxIterations));
    }

    ScaleEstimatorService(EstimatorSettings settings, SmoothVFitter fitter) {
        this.settings = settings;
        this.fitter = fitter;
    }

    public ScaleEstimate estimate(RegionSample sample, double coarseMinimum, OptimizationTrace trace) {
        return estimate(sample, coarseMinimum, trace,
                new ProgressTracker(ProgressListener.NONE, settings.fineSamples), new CancellationToken());
    }

    ScaleEstimate estimate(RegionSample sample, double coarseMinimum, OptimizationTrace trace,
                           ProgressTracker progress, CancellationToken token) {
        double[] grid = GridSampler.evenlySpaced(coarseMinimum - settings.fineHalfWidth,
                coarseMinimum + settings.fineHalfWidth, settings.fineSamples);
        double[] values = GridSampler.evaluate(sample, grid, OptimizationTrace.Phase.FINE, trace, progress, token);

        double vertexMax = 2.0 * (coarseMinimum + settings.fineHalfWidth);
        FitModel model = null;
        double vertex;
        try {
            model = fitter.fit(grid, values, vertexMax, settings.initialEpsilon);
            vertex = model.vertex;
        } catch (FitDivergenceException e) {
            vertex = grid[GridSampler.argMin(values)];
            LOG.warn("estimate: {}; falling back to best fine-grid sample c={}", e.getMessage(), vertex);
        }

        double scale = clip(vertex);
        ScaleEstimate result = new ScaleEstimate(scale, vertex, coarseMinimum, sample.baseline,
                model != null, model, trace);
        LOG.info("estimate: {} over {}", result, sample.region);
        return result;
    }

    static double clip(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.min(1.0, Math.max(0.0, value));
    }

    private static final Logger LOG = LoggerFactory.getLogger(ScaleEstimatorService.class);
}
