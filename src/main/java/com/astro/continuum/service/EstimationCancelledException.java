package com.astro.continuum.service;

public class EstimationCancelledException extends ContinuumSubtractionException {

    public EstimationCancelledException(String message) {
        super(message);
    }
}
