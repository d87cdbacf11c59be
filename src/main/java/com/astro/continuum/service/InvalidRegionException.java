package com.astro.continuum.service;

public class InvalidRegionException extends ContinuumSubtractionException {

    public InvalidRegionException(String message) {
        super(message);
    }
}
