package com.astro.continuum.service;

import com.astro.continuum.model.MixWeights;
import ij.ImageStack;
import org.junit.Assert;
import org.junit.Test;

public class NarrowbandMixerServiceTest {

    private final NarrowbandMixerService mixer = new NarrowbandMixerService();

    @Test
    public void testDefaultMix() {
        ImageStack out = mixer.mix(SyntheticImages.of(2, 1, 10, 20), SyntheticImages.of(2, 1, 2, 4),
                MixWeights.defaults());

        Assert.assertEquals(3, out.getSize());
        Assert.assertArrayEquals(new float[] { 10, 20 }, (float[]) out.getProcessor(1).getPixels(), 1e-6f);
        Assert.assertArrayEquals(new float[] { 6, 12 }, (float[]) out.getProcessor(2).getPixels(), 1e-6f);
        Assert.assertArrayEquals(new float[] { 2, 4 }, (float[]) out.getProcessor(3).getPixels(), 1e-6f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsFractionOutsideUnitInterval() {
        mixer.mix(SyntheticImages.of(1, 1, 1), SyntheticImages.of(1, 1, 1), new MixWeights(1.2, 0.5, 0));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testShapeMismatch() {
        mixer.mix(SyntheticImages.of(2, 1, 1, 1), SyntheticImages.of(1, 2, 1, 1), MixWeights.defaults());
    }
}
