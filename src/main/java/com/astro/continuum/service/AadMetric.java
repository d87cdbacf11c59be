package com.astro.continuum.service;

/**
 * Desviacion absoluta media: mean(|d - mean(d)|). Es la funcion objetivo; su
 * minimo indica que el continuo quedo sustraido.
 */
public final class AadMetric {

    private AadMetric() {
    }

    public static double aad(float[] diff) {
        if (diff.length == 0) {
            throw new IllegalArgumentException("AAD of an empty array");
        }
        double mean = PixelStatistics.mean(diff);
        double sum = 0;
        for (float v : diff) sum += Math.abs(v - mean);
        return sum / diff.length;
    }

    public static double aad(double[][] diff) {
        long n = 0;
        double total = 0;
        for (double[] row : diff) {
            for (double v : row) {
                total += v;
                n++;
            }
        }
        if (n == 0) {
            throw new IllegalArgumentException("AAD of an empty array");
        }
        double mean = total / n;
        double sum = 0;
        for (double[] row : diff) {
            for (double v : row) sum += Math.abs(v - mean);
        }
        return sum / n;
    }

    /**
     * AAD de nb - c * (co - baseline) sin construir la imagen diferencia.
     */
    public static double aad(float[] narrowband, float[] continuum, double baseline, double c) {
        if (narrowband.length != continuum.length) {
            throw new ShapeMismatchException("AAD: " + narrowband.length + " narrowband samples vs "
                    + continuum.length + " continuum samples");
        }
        int n = narrowband.length;
        if (n == 0) {
            throw new IllegalArgumentException("AAD of an empty array");
        }
        double total = 0;
        for (int i = 0; i < n; i++) {
            total += narrowband[i] - c * (continuum[i] - baseline);
        }
        double mean = total / n;
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += Math.abs(narrowband[i] - c * (continuum[i] - baseline) - mean);
        }
        return sum / n;
    }
}
