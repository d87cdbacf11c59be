package com.astro.continuum.model;

/**
 * Resultado de una estimacion del factor de escala.
 */
public class ScaleEstimate {
    public final double scale;          // recortado a [0, 1]
    public final double rawVertex;      // s0 del ajuste (o argmin de la rejilla fina) sin recortar
    public final double coarseMinimum;  // c0
    public final double baseline;       // mediana del continuo en la region
    public final boolean fitted;        // false si se uso el mejor punto de la rejilla
    public final FitModel fitModel;     // null si el ajuste diverge
    public final OptimizationTrace trace;  // congelada

    public ScaleEstimate(double scale, double rawVertex, double coarseMinimum, double baseline,
                         boolean fitted, FitModel fitModel, OptimizationTrace trace) {
        this.scale = scale;
        this.rawVertex = rawVertex;
        this.coarseMinimum = coarseMinimum;
        this.baseline = baseline;
        this.fitted = fitted;
        this.fitModel = fitModel;
        this.trace = trace.freeze();
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "ScaleEstimate[c=%.4f, s0=%.4f, c0=%.4f, baseline=%.4g, %s]",
                scale, rawVertex, coarseMinimum, baseline, fitted ? "fit" : "grid");
    }
}
