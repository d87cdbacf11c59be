package com.astro.continuum.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Busqueda / ajuste
    private static final String KEY_COARSE_MIN = "coarse_min";
    private static final String KEY_COARSE_MAX = "coarse_max";
    private static final String KEY_COARSE_SAMPLES = "coarse_samples";
    private static final String KEY_FINE_HALF_WIDTH = "fine_half_width";
    private static final String KEY_FINE_SAMPLES = "fine_samples";
    private static final String KEY_MAX_ITER = "fit_max_iterations";

    // Mezcla
    private static final String KEY_STRENGTH = "blend_strength";
    private static final String KEY_BLUE_MIX = "blue_mix";
    private static final String KEY_LINE = "emission_line";

    // --- ESTIMADOR ---
    public static double getCoarseMin() { return prefs.getDouble(KEY_COARSE_MIN, EstimatorSettings.DEFAULT_COARSE_MIN); }
    public static void setCoarseMin(double v) { prefs.putDouble(KEY_COARSE_MIN, v); }

    public static double getCoarseMax() { return prefs.getDouble(KEY_COARSE_MAX, EstimatorSettings.DEFAULT_COARSE_MAX); }
    public static void setCoarseMax(double v) { prefs.putDouble(KEY_COARSE_MAX, v); }

    public static int getCoarseSamples() { return prefs.getInt(KEY_COARSE_SAMPLES, EstimatorSettings.DEFAULT_COARSE_SAMPLES); }
    public static void setCoarseSamples(int v) { prefs.putInt(KEY_COARSE_SAMPLES, v); }

    public static double getFineHalfWidth() { return prefs.getDouble(KEY_FINE_HALF_WIDTH, EstimatorSettings.DEFAULT_FINE_HALF_WIDTH); }
    public static void setFineHalfWidth(double v) { prefs.putDouble(KEY_FINE_HALF_WIDTH, v); }

    public static int getFineSamples() { return prefs.getInt(KEY_FINE_SAMPLES, EstimatorSettings.DEFAULT_FINE_SAMPLES); }
    public static void setFineSamples(int v) { prefs.putInt(KEY_FINE_SAMPLES, v); }

    public static int getFitMaxIterations() { return prefs.getInt(KEY_MAX_ITER, EstimatorSettings.DEFAULT_MAX_ITERATIONS); }
    public static void setFitMaxIterations(int v) { prefs.putInt(KEY_MAX_ITER, v); }

    public static EstimatorSettings getEstimatorSettings() {
        return new EstimatorSettings(getCoarseMin(), getCoarseMax(), getCoarseSamples(),
                getFineHalfWidth(), getFineSamples(), EstimatorSettings.DEFAULT_INITIAL_EPSILON, getFitMaxIterations());
    }

    // --- MEZCLA ---
    public static double getBlendStrength() { return prefs.getDouble(KEY_STRENGTH, 2.0); }
    public static void setBlendStrength(double v) { prefs.putDouble(KEY_STRENGTH, v); }

    public static double getBlueMix() { return prefs.getDouble(KEY_BLUE_MIX, 0.2); }
    public static void setBlueMix(double v) { prefs.putDouble(KEY_BLUE_MIX, v); }

    public static EmissionLine getEmissionLine() {
        String name = prefs.get(KEY_LINE, EmissionLine.HA.name());
        try {
            return EmissionLine.valueOf(name);
        } catch (IllegalArgumentException e) {
            return EmissionLine.HA; // valor guardado por una version anterior
        }
    }
    public static void setEmissionLine(EmissionLine v) { prefs.put(KEY_LINE, v.name()); }

    /** Borra los valores guardados; los getters vuelven a los valores por defecto. */
    public static void reset() {
        for (String key : new String[] { KEY_COARSE_MIN, KEY_COARSE_MAX, KEY_COARSE_SAMPLES, KEY_FINE_HALF_WIDTH,
                KEY_FINE_SAMPLES, KEY_MAX_ITER, KEY_STRENGTH, KEY_BLUE_MIX, KEY_LINE }) {
            prefs.remove(key);
        }
    }

    /** Pesos por defecto de la linea, con la fuerza y la mezcla azul guardadas (solo Ha usa la mezcla azul). */
    public static ChannelWeights getChannelWeights(EmissionLine line) {
        ChannelWeights w = line.defaultWeights;
        double blue = (line == EmissionLine.HA) ? getBlueMix() : w.blue;
        return new ChannelWeights(getBlendStrength(), w.red, w.green, blue);
    }
}
