package com.astro.continuum.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Secuencia ordenada de pares (c, AAD) evaluados durante la busqueda gruesa y la fina.
 * Se congela al construir el {@link ScaleEstimate}; a partir de ahi no admite muestras.
 */
public class OptimizationTrace {

    public enum Phase { COARSE, FINE }

    public static class Sample {
        public final Phase phase;
        public final double coefficient;
        public final double aad;

        public Sample(Phase phase, double coefficient, double aad) {
            this.phase = phase;
            this.coefficient = coefficient;
            this.aad = aad;
        }

        @Override
        public String toString() {
            return phase + "(" + coefficient + ", " + aad + ")";
        }
    }

    private final List<Sample> samples = new ArrayList<>();
    private boolean frozen;

    /** @throws IllegalStateException si la traza ya pertenece a una estimacion */
    public void add(Phase phase, double coefficient, double aad) {
        if (frozen) {
            throw new IllegalStateException("trace is frozen after " + samples.size() + " samples");
        }
        samples.add(new Sample(phase, coefficient, aad));
    }

    public OptimizationTrace freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<Sample> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    public List<Sample> getSamples(Phase phase) {
        List<Sample> result = new ArrayList<>();
        for (Sample s : samples) {
            if (s.phase == phase) result.add(s);
        }
        return result;
    }

    public int size() {
        return samples.size();
    }
}
