package com.astro.continuum.service;

import com.astro.continuum.model.ChannelWeights;
import com.astro.continuum.model.RgbChannel;
import ij.ImageStack;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompositorService {

    /**
     * cs = nb - scale * (co - baseline).
     */
    public FloatProcessor generateSubtracted(FloatProcessor narrowband, FloatProcessor continuum,
                                             double scale, double baseline) {
        ShapeMismatchException.requireSameShape("generate subtracted", narrowband, continuum);
        if (!Double.isFinite(scale) || scale < 0.0 || scale > 1.0) {
            throw new IllegalArgumentException("scale factor must be in [0, 1] but was " + scale);
        }
        if (!Double.isFinite(baseline)) {
            throw new IllegalArgumentException("baseline must be finite but was " + baseline);
        }
        float[] nb = (float[]) narrowband.getPixels();
        float[] co = (float[]) continuum.getPixels();
        float[] cs = new float[nb.length];
        for (int i = 0; i < nb.length; i++) {
            cs[i] = (float) (nb[i] - scale * (co[i] - baseline));
        }
        LOG.debug("generateSubtracted: c={}, baseline={}", scale, baseline);
        return new FloatProcessor(narrowband.getWidth(), narrowband.getHeight(), cs);
    }

    /** Sin estimacion previa: la linea base es la mediana del continuo en toda la imagen. */
    public FloatProcessor generateSubtracted(FloatProcessor narrowband, FloatProcessor continuum, double scale) {
        ShapeMismatchException.requireSameShape("generate subtracted", narrowband, continuum);
        double baseline = PixelStatistics.median((float[]) continuum.getPixels());
        return generateSubtracted(narrowband, continuum, scale, baseline);
    }

    /**
     * channel'_k = channel_k + (cs - median(cs)) * q * w_k. Recentrar en la mediana
     * conserva el nivel de fondo del canal y solo inyecta la senal.
     *
     * @return pila de tres planos R, G, B (primero el canal); las entradas no se modifican
     */
    public ImageStack composite(FloatProcessor red, FloatProcessor green, FloatProcessor blue,
                                FloatProcessor subtracted, ChannelWeights weights) {
        ShapeMismatchException.requireSameShape("composite", red, green, blue, subtracted);

        float[] cs = (float[]) subtracted.getPixels();
        double csMedian = PixelStatistics.median(cs);

        ImageStack stack = new ImageStack(red.getWidth(), red.getHeight());
        FloatProcessor[] channels = { red, green, blue };
        for (RgbChannel channel : RgbChannel.values()) {
            float[] src = (float[]) channels[channel.plane].getPixels();
            double gain = weights.strength * weights.weight(channel);
            float[] dst = new float[src.length];
            if (gain == 0.0) {
                System.arraycopy(src, 0, dst, 0, src.length);
            } else {
                for (int i = 0; i < src.length; i++) {
                    dst[i] = (float) (src[i] + (cs[i] - csMedian) * gain);
                }
            }
            stack.addSlice(channel.label, new FloatProcessor(red.getWidth(), red.getHeight(), dst));
        }
        LOG.debug("composite: {}, cs median={}", weights, csMedian);
        return stack;
    }

    public ImageStack composite(FloatProcessor red, FloatProcessor green, FloatProcessor blue,
                                FloatProcessor subtracted, double strength, ChannelWeights weights) {
        return composite(red, green, blue, subtracted, weights.withStrength(strength));
    }

    private static final Logger LOG = LoggerFactory.getLogger(CompositorService.class);
}
