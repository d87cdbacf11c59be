package com.astro.continuum.service;

import ij.process.FloatProcessor;

/**
 * Estimacion rapida: cociente de medias entre la banda estrecha y la suma R+G+B,
 * usando solo los pixeles donde R+G+B &gt; 0. Sirve como punto de partida para un
 * ajuste manual; no se recorta a [0, 1].
 */
public class RatioScaleEstimator {

    public double estimate(FloatProcessor narrowband, FloatProcessor red, FloatProcessor green, FloatProcessor blue) {
        ShapeMismatchException.requireSameShape("ratio estimate", narrowband, red, green, blue);
        float[] nb = (float[]) narrowband.getPixels();
        float[] r = (float[]) red.getPixels();
        float[] g = (float[]) green.getPixels();
        float[] b = (float[]) blue.getPixels();

        double nbSum = 0;
        double rgbSum = 0;
        int count = 0;
        for (int i = 0; i < nb.length; i++) {
            double s = (double) r[i] + g[i] + b[i];
            if (s > 0) {
                nbSum += nb[i];
                rgbSum += s;
                count++;
            }
        }
        if (count == 0 || rgbSum == 0) return 1.0;
        return (nbSum / count) / (rgbSum / count);
    }
}
