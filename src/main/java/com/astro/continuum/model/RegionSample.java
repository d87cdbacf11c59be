package com.astro.continuum.model;

import ij.process.FloatProcessor;

public class RegionSample {
    public final Region region;
    public final FloatProcessor narrowband; // copia recortada
    public final FloatProcessor continuum;  // copia recortada
    public final double baseline;           // mediana del continuo en la region

    public RegionSample(Region region, FloatProcessor narrowband, FloatProcessor continuum, double baseline) {
        this.region = region;
        this.narrowband = narrowband;
        this.continuum = continuum;
        this.baseline = baseline;
    }

    public float[] narrowbandPixels() {
        return (float[]) narrowband.getPixels();
    }

    public float[] continuumPixels() {
        return (float[]) continuum.getPixels();
    }
}
