package com.astro.continuum.service;

/**
 * Base de los errores recuperables de estimacion y composicion. Ninguno es fatal:
 * el llamador muestra el mensaje y permite reintentar con otras entradas.
 */
public class ContinuumSubtractionException extends RuntimeException {

    public ContinuumSubtractionException(String message) {
        super(message);
    }

    public ContinuumSubtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
