package com.astro.continuum.model;

public enum RgbChannel {
    RED("R", 0), GREEN("G", 1), BLUE("B", 2);

    public final String label;
    public final int plane; // posicion en el cubo [plano][y][x]

    RgbChannel(String label, int plane) {
        this.label = label;
        this.plane = plane;
    }
}
