package com.astro.continuum.model;

import ij.process.ImageProcessor;

/**
 * Rectangulo de seleccion (x, y, w, h) en coordenadas de pixel.
 * La validacion contra los limites de la imagen la hace RegionStatsService.
 */
public class Region {
    public final int x;
    public final int y;
    public final int width;
    public final int height;

    public Region(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static Region fullFrame(ImageProcessor ip) {
        return new Region(0, 0, ip.getWidth(), ip.getHeight());
    }

    /** Acepta "x,y,w,h" (formato de la linea de comandos). */
    public static Region parse(String text) {
        String[] parts = text.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Region must be x,y,w,h but was '" + text + "'");
        }
        try {
            return new Region(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Region must be x,y,w,h but was '" + text + "'", e);
        }
    }

    public int area() {
        return width * height;
    }

    public boolean fitsInside(int imageWidth, int imageHeight) {
        return x >= 0 && y >= 0
                && width > 0 && height > 0
                && (long) x + width <= imageWidth
                && (long) y + height <= imageHeight;
    }

    @Override
    public String toString() {
        return "Region[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
    }
}
