package com.astro.continuum.service;

import com.astro.continuum.model.MixWeights;
import com.astro.continuum.model.RgbChannel;
import ij.ImageStack;
import ij.process.FloatProcessor;

/**
 * Mezcla bicolor Ha + OIII: cada canal es h * Ha + (1 - h) * OIII.
 */
public class NarrowbandMixerService {

    public ImageStack mix(FloatProcessor ha, FloatProcessor oiii, MixWeights weights) {
        ShapeMismatchException.requireSameShape("narrowband mix", ha, oiii);
        float[] h = (float[]) ha.getPixels();
        float[] o = (float[]) oiii.getPixels();

        ImageStack stack = new ImageStack(ha.getWidth(), ha.getHeight());
        for (RgbChannel channel : RgbChannel.values()) {
            double fraction = weights.haFraction(channel);
            if (!(fraction >= 0.0 && fraction <= 1.0)) {
                throw new IllegalArgumentException(channel + " Ha fraction must be in [0, 1] but was " + fraction);
            }
            float[] dst = new float[h.length];
            for (int i = 0; i < h.length; i++) {
                dst[i] = (float) (fraction * h[i] + (1.0 - fraction) * o[i]);
            }
            stack.addSlice(channel.label, new FloatProcessor(ha.getWidth(), ha.getHeight(), dst));
        }
        return stack;
    }
}
