package com.astro.continuum.service;

/**
 * Convierte los pasos de ambas busquedas en una fraccion no decreciente que acaba en 1.0.
 */
class ProgressTracker {

    private final ProgressListener listener;
    private final int totalSteps;
    private int step;

    ProgressTracker(ProgressListener listener, int totalSteps) {
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
        this.totalSteps = totalSteps;
    }

    void advance(String message) {
        step = Math.min(step + 1, totalSteps);
        listener.onProgress(message, (double) step / totalSteps);
    }

    void complete(String message) {
        step = totalSteps;
        listener.onProgress(message, 1.0);
        listener.reset();
    }
}
