package com.astro.continuum.service;

import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.FitModel;
import com.astro.continuum.model.OptimizationTrace;
import com.astro.continuum.model.Region;
import com.astro.continuum.model.RegionSample;
import com.astro.continuum.model.ScaleEstimate;
import ij.process.FloatProcessor;
import org.junit.Assert;
import org.junit.Test;

public class ScaleEstimatorServiceTest {

    private static RegionSample sample(double c, double noise) {
        FloatProcessor co = SyntheticImages.continuum(60, 60, 3);
        FloatProcessor nb = SyntheticImages.narrowband(co, c, noise, 5);
        return new RegionStatsService().sample(nb, co, Region.fullFrame(co));
    }

    @Test
    public void testFineSearchAndFit() {
        OptimizationTrace trace = new OptimizationTrace();
        double c0 = 7.0 / 11.0;

        ScaleEstimate estimate = new ScaleEstimatorService(EstimatorSettings.defaults()).estimate(sample(0.4, 0.5), c0, trace);

        Assert.assertTrue(estimate.fitted);
        Assert.assertNotNull(estimate.fitModel);
        Assert.assertEquals(0.4, estimate.scale, 0.01);
        Assert.assertEquals(c0, estimate.coarseMinimum, 0.0);
        Assert.assertEquals(40, trace.getSamples(OptimizationTrace.Phase.FINE).size());
        Assert.assertEquals(c0 - 1.0, trace.getSamples().get(0).coefficient, 1e-12);
        Assert.assertEquals(c0 + 1.0, trace.getSamples().get(39).coefficient, 1e-12);
    }

    @Test
    public void testFallsBackToBestGridSampleWhenFitDiverges() {
        SmoothVFitter failing = new SmoothVFitter(10) {
            @Override
            public FitModel fit(double[] x, double[] y, double s0Max, double initialEpsilon) {
                throw new FitDivergenceException("did not converge");
            }
        };
        double c0 = 7.0 / 11.0;
        ScaleEstimatorService service = new ScaleEstimatorService(EstimatorSettings.defaults(), failing);

        ScaleEstimate estimate = service.estimate(sample(0.4, 0.0), c0, new OptimizationTrace());

        Assert.assertFalse(estimate.fitted);
        Assert.assertNull(estimate.fitModel);
        double expected = (c0 - 1.0) + 15 * (2.0 / 39.0);
        Assert.assertEquals(expected, estimate.scale, 1e-9);
        Assert.assertEquals(expected, estimate.rawVertex, 1e-9);
    }

    @Test
    public void testIterationLimitFallsBackToBestFineSample() {
        FloatProcessor co = SyntheticImages.continuum(60, 60, 3);
        FloatProcessor nb = SyntheticImages.narrowband(co, 0.4, 0.5, 5);
        EstimatorSettings oneIteration = new EstimatorSettings(-1, 5, 12, 1, 40, 0.01, 1);

        ScaleEstimate estimate = new ContinuumSubtractionService(oneIteration)
                .estimateScale(nb, co, Region.fullFrame(co));

        Assert.assertFalse(estimate.fitted);
        Assert.assertNull(estimate.fitModel);
        OptimizationTrace.Sample best = null;
        for (OptimizationTrace.Sample s : estimate.trace.getSamples(OptimizationTrace.Phase.FINE)) {
            if (best == null || s.aad < best.aad) best = s;
        }
        Assert.assertNotNull(best);
        Assert.assertEquals(best.coefficient, estimate.rawVertex, 0.0);
        Assert.assertEquals(ScaleEstimatorService.clip(best.coefficient), estimate.scale, 0.0);
        Assert.assertTrue(estimate.scale >= 0.0 && estimate.scale <= 1.0);
        Assert.assertEquals(0.4, estimate.scale, 0.06);
    }

    @Test
    public void testClip() {
        Assert.assertEquals(0.0, ScaleEstimatorService.clip(-0.3), 0.0);
        Assert.assertEquals(1.0, ScaleEstimatorService.clip(1.7), 0.0);
        Assert.assertEquals(0.25, ScaleEstimatorService.clip(0.25), 0.0);
        Assert.assertEquals(0.0, ScaleEstimatorService.clip(Double.NaN), 0.0);
    }
}
