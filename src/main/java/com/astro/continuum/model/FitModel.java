package com.astro.continuum.model;

/**
 * Modelo "V suavizada": f(x) = A * sqrt((x - s0)^2 + eps^2) + B.
 * El vertice s0 es el factor de escala antes de recortar a [0, 1].
 */
public class FitModel {
    public final double amplitude; // A
    public final double vertex;    // s0
    public final double epsilon;   // eps
    public final double offset;    // B

    public FitModel(double amplitude, double vertex, double epsilon, double offset) {
        this.amplitude = amplitude;
        this.vertex = vertex;
        this.epsilon = epsilon;
        this.offset = offset;
    }

    public static FitModel fromArray(double[] p) {
        return new FitModel(p[0], p[1], p[2], p[3]);
    }

    public double[] toArray() {
        return new double[] { amplitude, vertex, epsilon, offset };
    }

    public double value(double x) {
        double d = x - vertex;
        return amplitude * Math.sqrt(d * d + epsilon * epsilon) + offset;
    }

    public boolean isFinite() {
        return Double.isFinite(amplitude) && Double.isFinite(vertex)
                && Double.isFinite(epsilon) && Double.isFinite(offset);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "FitModel[A=%.6g, s0=%.6f, eps=%.6g, B=%.6g]",
                amplitude, vertex, epsilon, offset);
    }
}
