package com.astro.continuum.model;

/**
 * Fraccion de Ha en cada canal de salida; el resto (1 - fraccion) es OIII.
 */
public class MixWeights {
    public final double redHa;
    public final double greenHa;
    public final double blueHa;

    public MixWeights(double redHa, double greenHa, double blueHa) {
        this.redHa = redHa;
        this.greenHa = greenHa;
        this.blueHa = blueHa;
    }

    public static MixWeights defaults() {
        return new MixWeights(1.0, 0.5, 0.0);
    }

    public double haFraction(RgbChannel channel) {
        switch (channel) {
            case RED: return redHa;
            case GREEN: return greenHa;
            default: return blueHa;
        }
    }
}
