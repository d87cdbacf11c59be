package com.astro.continuum.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bandera de cancelacion compartida entre el hilo de UI y el hilo de trabajo.
 * Se consulta una vez por punto de la rejilla.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new EstimationCancelledException("Scale estimation cancelled");
        }
    }
}
