package com.astro.continuum.service;

import com.astro.continuum.model.Region;
import com.astro.continuum.model.RegionSample;
import ij.process.FloatProcessor;

public class RegionStatsService {

    /**
     * Recorta la region de ambas imagenes (copias nuevas) y calcula la mediana del
     * continuo dentro de ella.
     */
    public RegionSample sample(FloatProcessor narrowband, FloatProcessor continuum, Region region) {
        ShapeMismatchException.requireSameShape("region stats", narrowband, continuum);
        validate(region, narrowband.getWidth(), narrowband.getHeight());

        FloatProcessor nbCrop = crop(narrowband, region);
        FloatProcessor coCrop = crop(continuum, region);
        double baseline = PixelStatistics.median((float[]) coCrop.getPixels());
        return new RegionSample(region, nbCrop, coCrop, baseline);
    }

    public static void validate(Region region, int imageWidth, int imageHeight) {
        if (region == null) {
            throw new InvalidRegionException("No region selected");
        }
        if (region.width <= 0 || region.height <= 0) {
            throw new InvalidRegionException("Region has zero area: " + region);
        }
        if (!region.fitsInside(imageWidth, imageHeight)) {
            throw new InvalidRegionException(region + " lies outside the " + imageWidth + "x" + imageHeight + " image");
        }
    }

    private static FloatProcessor crop(FloatProcessor ip, Region region) {
        float[] src = (float[]) ip.getPixels();
        float[] dst = new float[region.area()];
        int srcWidth = ip.getWidth();
        for (int row = 0; row < region.height; row++) {
            System.arraycopy(src, (region.y + row) * srcWidth + region.x, dst, row * region.width, region.width);
        }
        return new FloatProcessor(region.width, region.height, dst);
    }
}
