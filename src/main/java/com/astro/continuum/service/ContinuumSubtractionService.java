package com.astro.continuum.service;

import com.astro.continuum.model.ChannelWeights;
import com.astro.continuum.model.EmissionLine;
import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.OptimizationTrace;
import com.astro.continuum.model.Region;
import com.astro.continuum.model.RegionSample;
import com.astro.continuum.model.ScaleEstimate;
import ij.ImageStack;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Punto de entrada del nucleo: estimacion del factor de escala, generacion de la
 * imagen sin continuo y composicion RGB. No guarda estado entre llamadas, por lo que
 * una misma instancia se puede usar desde un hilo de trabajo.
 */
public class ContinuumSubtractionService {

    private final EstimatorSettings settings;
    private final RegionStatsService regionStats = new RegionStatsService();
    private final CoarseSearchService coarseSearch;
    private final ScaleEstimatorService scaleEstimator;
    private final CompositorService compositor = new CompositorService();

    public ContinuumSubtractionService() {
        this(EstimatorSettings.defaults());
    }

    public ContinuumSubtractionService(EstimatorSettings settings) {
        this.settings = settings;
        this.coarseSearch = new CoarseSearchService(settings);
        this.scaleEstimator = new ScaleEstimatorService(settings);
    }

    public ScaleEstimate estimateScale(FloatProcessor narrowband, FloatProcessor continuum, Region region) {
        return estimateScale(narrowband, continuum, region, ProgressListener.NONE, new CancellationToken());
    }

    public ScaleEstimate estimateScale(FloatProcessor narrowband, FloatProcessor continuum, Region region,
                                       ProgressListener listener) {
        return estimateScale(narrowband, continuum, region, listener, new CancellationToken());
    }

    /**
     * @throws ShapeMismatchException       si las imagenes no tienen el mismo tamano
     * @throws InvalidRegionException       si la region esta vacia o fuera de la imagen
     * @throws EstimationCancelledException si se cancela el token durante la busqueda
     */
    public ScaleEstimate estimateScale(FloatProcessor narrowband, FloatProcessor continuum, Region region,
                                       ProgressListener listener, CancellationToken token) {
        RegionSample sample = regionStats.sample(narrowband, continuum, region);
        LOG.debug("estimateScale: {} baseline={}", region, sample.baseline);

        ProgressTracker progress = new ProgressTracker(listener, settings.totalSamples());
        OptimizationTrace trace = new OptimizationTrace();
        double c0 = coarseSearch.search(sample, trace, progress, token);
        ScaleEstimate estimate = scaleEstimator.estimate(sample, c0, trace, progress, token);
        progress.complete(String.format(java.util.Locale.US, "Scale factor c=%.4f", estimate.scale));
        return estimate;
    }

    public FloatProcessor generateSubtracted(FloatProcessor narrowband, FloatProcessor continuum, double scale) {
        return compositor.generateSubtracted(narrowband, continuum, scale);
    }

    /** Escala manual con la mediana del continuo dentro de {@code region} como linea base. */
    public FloatProcessor generateSubtracted(FloatProcessor narrowband, FloatProcessor continuum, double scale,
                                             Region region) {
        RegionSample sample = regionStats.sample(narrowband, continuum, region);
        return compositor.generateSubtracted(narrowband, continuum, scale, sample.baseline);
    }

    public FloatProcessor generateSubtracted(FloatProcessor narrowband, FloatProcessor continuum, ScaleEstimate estimate) {
        return compositor.generateSubtracted(narrowband, continuum, estimate.scale, estimate.baseline);
    }

    public ImageStack composite(FloatProcessor red, FloatProcessor green, FloatProcessor blue,
                                FloatProcessor subtracted, double strength, ChannelWeights weights) {
        return compositor.composite(red, green, blue, subtracted, strength, weights);
    }

    /**
     * Flujo completo para una linea de emision: toma del RGB el canal de continuo de la
     * linea, estima c en la region, genera la imagen sin continuo y la mezcla.
     *
     * @param rgb pila de tres planos R, G, B
     */
    public ImageStack subtractAndComposite(EmissionLine line, FloatProcessor narrowband, ImageStack rgb,
                                           Region region, ChannelWeights weights,
                                           ProgressListener listener, CancellationToken token) {
        FloatProcessor[] channels = channels(rgb);
        FloatProcessor continuum = channels[line.continuumChannel.plane];
        ScaleEstimate estimate = estimateScale(narrowband, continuum, region, listener, token);
        FloatProcessor subtracted = generateSubtracted(narrowband, continuum, estimate);
        LOG.info("subtractAndComposite: {} continuum from {} channel, {}", line.displayName,
                line.continuumChannel, estimate);
        return compositor.composite(channels[0], channels[1], channels[2], subtracted, weights);
    }

    static FloatProcessor[] channels(ImageStack rgb) {
        if (rgb.getSize() != 3) {
            throw new IllegalArgumentException("expected an R, G, B stack with 3 planes but got " + rgb.getSize());
        }
        FloatProcessor[] result = new FloatProcessor[3];
        for (int i = 0; i < 3; i++) {
            result[i] = rgb.getProcessor(i + 1).convertToFloatProcessor();
        }
        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ContinuumSubtractionService.class);
}
