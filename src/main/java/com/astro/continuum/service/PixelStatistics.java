package com.astro.continuum.service;

import org.apache.commons.math3.stat.descriptive.rank.Median;

public final class PixelStatistics {

    private PixelStatistics() {
    }

    /** Mediana; con un numero par de muestras es la media de las dos centrales. */
    public static double median(float[] pixels) {
        if (pixels.length == 0) {
            throw new IllegalArgumentException("median of an empty image");
        }
        double[] values = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) values[i] = pixels[i];
        return new Median().evaluate(values);
    }

    public static double mean(float[] pixels) {
        if (pixels.length == 0) {
            throw new IllegalArgumentException("mean of an empty image");
        }
        double sum = 0;
        for (float p : pixels) sum += p;
        return sum / pixels.length;
    }
}
