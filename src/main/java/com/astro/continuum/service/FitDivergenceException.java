package com.astro.continuum.service;

public class FitDivergenceException extends ContinuumSubtractionException {

    public FitDivergenceException(String message) {
        super(message);
    }

    public FitDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
