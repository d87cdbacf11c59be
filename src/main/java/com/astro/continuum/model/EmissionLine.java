package com.astro.continuum.model;

/**
 * Linea de emision tratada como banda estrecha, con el canal de banda ancha que
 * hace de continuo y los pesos de mezcla por defecto.
 */
public enum EmissionLine {
    HA("H-alpha", RgbChannel.RED, new ChannelWeights(2.0, 1.0, 0.0, 0.2)),
    SII("S-II", RgbChannel.RED, new ChannelWeights(2.0, 1.0, 0.0, 0.0)),
    OIII("O-III", RgbChannel.GREEN, new ChannelWeights(2.0, 0.0, 0.5, 1.0));

    public final String displayName;
    public final RgbChannel continuumChannel;
    public final ChannelWeights defaultWeights;

    EmissionLine(String displayName, RgbChannel continuumChannel, ChannelWeights defaultWeights) {
        this.displayName = displayName;
        this.continuumChannel = continuumChannel;
        this.defaultWeights = defaultWeights;
    }
}
