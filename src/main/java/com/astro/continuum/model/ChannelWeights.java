package com.astro.continuum.model;

/**
 * Fuerza global (q) y peso por canal de la senal sustraida que se suma al RGB.
 */
public class ChannelWeights {
    public final double strength;
    public final double red;
    public final double green;
    public final double blue;

    public ChannelWeights(double strength, double red, double green, double blue) {
        this.strength = strength;
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public ChannelWeights withStrength(double q) {
        return new ChannelWeights(q, red, green, blue);
    }

    public double weight(RgbChannel channel) {
        switch (channel) {
            case RED: return red;
            case GREEN: return green;
            default: return blue;
        }
    }

    @Override
    public String toString() {
        return "ChannelWeights[q=" + strength + ", r=" + red + ", g=" + green + ", b=" + blue + "]";
    }
}
