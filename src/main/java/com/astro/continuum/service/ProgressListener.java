package com.astro.continuum.service;

/**
 * Receptor de progreso. Se invoca de forma sincrona desde el hilo que ejecuta la
 * estimacion; el host decide como pasarlo a su hilo de UI.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (message, fraction) -> { };

    /**
     * @param fraction progreso en [0, 1], no decreciente dentro de una estimacion
     */
    void onProgress(String message, double fraction);

    /** Llamado una vez al terminar, despues del ultimo 1.0. */
    default void reset() {
    }
}
