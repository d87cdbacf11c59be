package com.astro.continuum.service;

import ij.process.ImageProcessor;

public class ShapeMismatchException extends ContinuumSubtractionException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    /**
     * Exige que todas las imagenes tengan el mismo ancho y alto que la primera.
     *
     * @param what nombre de la operacion, para el mensaje
     */
    public static void requireSameShape(String what, ImageProcessor... images) {
        ImageProcessor first = images[0];
        for (int i = 1; i < images.length; i++) {
            ImageProcessor ip = images[i];
            if (ip.getWidth() != first.getWidth() || ip.getHeight() != first.getHeight()) {
                throw new ShapeMismatchException(String.format("%s: image %d is %dx%d but image 0 is %dx%d",
                        what, i, ip.getWidth(), ip.getHeight(), first.getWidth(), first.getHeight()));
            }
        }
    }
}
