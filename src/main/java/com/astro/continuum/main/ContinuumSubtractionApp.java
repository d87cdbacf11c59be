package com.astro.continuum.main;

import com.astro.continuum.model.AppConfig;
import com.astro.continuum.model.ChannelWeights;
import com.astro.continuum.model.EmissionLine;
import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.MixWeights;
import com.astro.continuum.model.Region;
import com.astro.continuum.model.ScaleEstimate;
import com.astro.continuum.service.CompositorService;
import com.astro.continuum.service.ContinuumSubtractionException;
import com.astro.continuum.service.ContinuumSubtractionService;
import com.astro.continuum.service.FitsImageService;
import com.astro.continuum.service.NarrowbandMixerService;
import com.astro.continuum.service.RatioScaleEstimator;
import com.astro.continuum.service.ShapeMismatchException;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import ij.ImageStack;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Linea de comandos: "subtract" (sustraccion de continuo + mezcla RGB), "mix"
 * (mezcla bicolor Ha/OIII) y "config" (valores por defecto guardados).
 */
public class ContinuumSubtractionApp {

    public static class RegionConverter implements IStringConverter<Region> {
        @Override
        public Region convert(String value) {
            try {
                return Region.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    @Parameters(commandDescription = "Estimate the continuum scale factor and blend the subtracted image into RGB")
    public static class SubtractCommand {
        @Parameter(names = "--narrowband", description = "Narrowband FITS file", required = true)
        public File narrowband;

        @Parameter(names = "--rgb", description = "3-plane RGB FITS cube (alternative to --red/--green/--blue)")
        public File rgb;

        @Parameter(names = "--red", description = "Red channel FITS file")
        public File red;

        @Parameter(names = "--green", description = "Green channel FITS file")
        public File green;

        @Parameter(names = "--blue", description = "Blue channel FITS file")
        public File blue;

        @Parameter(names = "--line", description = "Emission line of the narrowband image")
        public EmissionLine line = AppConfig.getEmissionLine();

        @Parameter(names = "--region", description = "Region x,y,w,h used for the estimate and the continuum "
                + "baseline (default: full frame)", converter = RegionConverter.class)
        public Region region;

        @Parameter(names = "--scale", description = "Use this scale factor instead of estimating it")
        public Double scale;

        @Parameter(names = "--ratio-scale", description = "Use the quick mean ratio NB / (R+G+B), clipped to [0, 1], "
                + "instead of estimating the scale")
        public boolean ratioScale;

        @Parameter(names = "--strength", description = "Overall blend strength q")
        public Double strength;

        @Parameter(names = "--red-weight", description = "Red channel weight")
        public Double redWeight;

        @Parameter(names = "--green-weight", description = "Green channel weight")
        public Double greenWeight;

        @Parameter(names = "--blue-weight", description = "Blue channel weight")
        public Double blueWeight;

        @Parameter(names = "--subtracted-output", description = "Also write the continuum-subtracted image here")
        public File subtractedOutput;

        @Parameter(names = "--output", description = "Output RGB FITS cube", required = true)
        public File output;

        ChannelWeights weights() {
            ChannelWeights base = AppConfig.getChannelWeights(line);
            return new ChannelWeights(
                    strength != null ? strength : base.strength,
                    redWeight != null ? redWeight : base.red,
                    greenWeight != null ? greenWeight : base.green,
                    blueWeight != null ? blueWeight : base.blue);
        }
    }

    @Parameters(commandDescription = "Mix Ha and OIII images into an RGB cube")
    public static class MixCommand {
        @Parameter(names = "--ha", description = "Ha FITS file", required = true)
        public File ha;

        @Parameter(names = "--oiii", description = "OIII FITS file", required = true)
        public File oiii;

        @Parameter(names = "--red-ha", description = "Fraction of Ha in the red channel")
        public double redHa = MixWeights.defaults().redHa;

        @Parameter(names = "--green-ha", description = "Fraction of Ha in the green channel")
        public double greenHa = MixWeights.defaults().greenHa;

        @Parameter(names = "--blue-ha", description = "Fraction of Ha in the blue channel")
        public double blueHa = MixWeights.defaults().blueHa;

        @Parameter(names = "--output", description = "Output RGB FITS cube", required = true)
        public File output;
    }

    @Parameters(commandDescription = "Save defaults used by later runs; prints the resulting settings")
    public static class ConfigCommand {
        @Parameter(names = "--coarse-min", description = "Lower end of the coarse search interval")
        public Double coarseMin;

        @Parameter(names = "--coarse-max", description = "Upper end of the coarse search interval")
        public Double coarseMax;

        @Parameter(names = "--coarse-samples", description = "Number of coarse samples")
        public Integer coarseSamples;

        @Parameter(names = "--fine-half-width", description = "Half width of the fine search window around c0")
        public Double fineHalfWidth;

        @Parameter(names = "--fine-samples", description = "Number of fine samples")
        public Integer fineSamples;

        @Parameter(names = "--max-iterations", description = "Iteration limit of the smooth-V fit")
        public Integer maxIterations;

        @Parameter(names = "--strength", description = "Default blend strength q")
        public Double strength;

        @Parameter(names = "--blue-mix", description = "Default blue weight for Ha")
        public Double blueMix;

        @Parameter(names = "--line", description = "Default emission line")
        public EmissionLine line;

        @Parameter(names = "--reset", description = "Forget all saved values before applying the others")
        public boolean reset;
    }

    @Parameter(names = "--help", description = "Display this note", help = true)
    public boolean help;

    final SubtractCommand subtract = new SubtractCommand();
    final MixCommand mix = new MixCommand();
    final ConfigCommand config = new ConfigCommand();

    private final FitsImageService fitsService = new FitsImageService();

    public static void main(String[] args) {
        System.exit(new ContinuumSubtractionApp().run(args));
    }

    /** @return codigo de salida: 0 si todo fue bien */
    public int run(String[] args) {
        JCommander jc = JCommander.newBuilder()
                .addObject(this)
                .addCommand("subtract", subtract)
                .addCommand("mix", mix)
                .addCommand("config", config)
                .build();
        jc.setProgramName("astro-continuum");

        String command;
        try {
            jc.parse(args);
            command = jc.getParsedCommand();
        } catch (ParameterException pe) {
            LOG.error("failed to parse command line arguments: {}", pe.getMessage());
            jc.usage();
            return 1;
        }
        if (help || command == null) {
            jc.usage();
            return help ? 0 : 1;
        }

        try {
            if ("subtract".equals(command)) {
                runSubtract(subtract);
            } else if ("mix".equals(command)) {
                runMix(mix);
            } else {
                runConfig(config);
            }
            return 0;
        } catch (ContinuumSubtractionException | IllegalArgumentException | IOException e) {
            LOG.error("{} failed: {}", command, e.getMessage(), e);
            return 1;
        }
    }

    void runSubtract(SubtractCommand cmd) throws IOException {
        FloatProcessor narrowband = fitsService.read(cmd.narrowband);
        ImageStack rgb = loadRgb(cmd);
        ContinuumSubtractionService service = new ContinuumSubtractionService(AppConfig.getEstimatorSettings());
        FloatProcessor continuum = rgb.getProcessor(cmd.line.continuumChannel.plane + 1).convertToFloatProcessor();

        if (cmd.scale != null && cmd.ratioScale) {
            throw new IllegalArgumentException("--scale and --ratio-scale cannot be used together");
        }
        Region region = (cmd.region != null) ? cmd.region : Region.fullFrame(narrowband);
        FloatProcessor subtracted;
        if (cmd.scale != null || cmd.ratioScale) {
            double scale = (cmd.scale != null) ? cmd.scale : ratioScale(narrowband, rgb);
            LOG.info("runSubtract: using manual scale factor c={} with baseline over {}", scale, region);
            subtracted = service.generateSubtracted(narrowband, continuum, scale, region);
        } else {
            ScaleEstimate estimate = service.estimateScale(narrowband, continuum, region,
                    (message, fraction) -> LOG.debug("{} ({}%)", message, Math.round(fraction * 100)));
            subtracted = service.generateSubtracted(narrowband, continuum, estimate);
        }

        if (cmd.subtractedOutput != null) {
            fitsService.write(cmd.subtractedOutput, subtracted, "Continuum subtracted (" + cmd.line.displayName + ")");
        }

        ChannelWeights weights = cmd.weights();
        ImageStack blended = new CompositorService().composite(
                rgb.getProcessor(1).convertToFloatProcessor(),
                rgb.getProcessor(2).convertToFloatProcessor(),
                rgb.getProcessor(3).convertToFloatProcessor(),
                subtracted, weights);
        fitsService.write(cmd.output, blended, String.format(Locale.US,
                "Blended %s continuum-subtracted data, q=%.2f r=%.2f g=%.2f b=%.2f",
                cmd.line.displayName, weights.strength, weights.red, weights.green, weights.blue));
    }

    private double ratioScale(FloatProcessor narrowband, ImageStack rgb) {
        double ratio = new RatioScaleEstimator().estimate(narrowband,
                rgb.getProcessor(1).convertToFloatProcessor(),
                rgb.getProcessor(2).convertToFloatProcessor(),
                rgb.getProcessor(3).convertToFloatProcessor());
        double scale = Math.min(1.0, Math.max(0.0, ratio));
        if (scale != ratio) {
            LOG.warn("ratioScale: mean ratio {} is outside [0, 1], using {}", ratio, scale);
        }
        return scale;
    }

    void runMix(MixCommand cmd) throws IOException {
        FloatProcessor ha = fitsService.read(cmd.ha);
        FloatProcessor oiii = fitsService.read(cmd.oiii);
        ImageStack blended = new NarrowbandMixerService().mix(ha, oiii, new MixWeights(cmd.redHa, cmd.greenHa, cmd.blueHa));
        fitsService.write(cmd.output, blended, "Blended using NarrowBandMixer");
    }

    void runConfig(ConfigCommand cmd) {
        if (cmd.reset) {
            AppConfig.reset();
        }
        EstimatorSettings current = AppConfig.getEstimatorSettings();
        // valida el conjunto completo antes de guardar nada
        EstimatorSettings updated = new EstimatorSettings(
                cmd.coarseMin != null ? cmd.coarseMin : current.coarseMin,
                cmd.coarseMax != null ? cmd.coarseMax : current.coarseMax,
                cmd.coarseSamples != null ? cmd.coarseSamples : current.coarseSamples,
                cmd.fineHalfWidth != null ? cmd.fineHalfWidth : current.fineHalfWidth,
                cmd.fineSamples != null ? cmd.fineSamples : current.fineSamples,
                current.initialEpsilon,
                cmd.maxIterations != null ? cmd.maxIterations : current.maxIterations);
        if (cmd.strength != null && !Double.isFinite(cmd.strength)) {
            throw new IllegalArgumentException("strength must be finite but was " + cmd.strength);
        }
        if (cmd.blueMix != null && !Double.isFinite(cmd.blueMix)) {
            throw new IllegalArgumentException("blue mix must be finite but was " + cmd.blueMix);
        }

        AppConfig.setCoarseMin(updated.coarseMin);
        AppConfig.setCoarseMax(updated.coarseMax);
        AppConfig.setCoarseSamples(updated.coarseSamples);
        AppConfig.setFineHalfWidth(updated.fineHalfWidth);
        AppConfig.setFineSamples(updated.fineSamples);
        AppConfig.setFitMaxIterations(updated.maxIterations);
        if (cmd.strength != null) AppConfig.setBlendStrength(cmd.strength);
        if (cmd.blueMix != null) AppConfig.setBlueMix(cmd.blueMix);
        if (cmd.line != null) AppConfig.setEmissionLine(cmd.line);

        EmissionLine line = AppConfig.getEmissionLine();
        LOG.info("runConfig: {}, line={}, weights={}", AppConfig.getEstimatorSettings(), line,
                AppConfig.getChannelWeights(line));
    }

    private ImageStack loadRgb(SubtractCommand cmd) throws IOException {
        if (cmd.rgb != null) {
            ImageStack stack = fitsService.readPlanes(cmd.rgb);
            if (stack.getSize() != 3) {
                throw new IllegalArgumentException(cmd.rgb + " has " + stack.getSize() + " planes, expected 3");
            }
            return stack;
        }
        if (cmd.red == null || cmd.green == null || cmd.blue == null) {
            throw new IllegalArgumentException("either --rgb or all of --red, --green, --blue are required");
        }
        FloatProcessor r = fitsService.read(cmd.red);
        FloatProcessor g = fitsService.read(cmd.green);
        FloatProcessor b = fitsService.read(cmd.blue);
        ShapeMismatchException.requireSameShape("load RGB", r, g, b);
        ImageStack stack = new ImageStack(r.getWidth(), r.getHeight());
        stack.addSlice("R", r);
        stack.addSlice("G", g);
        stack.addSlice("B", b);
        return stack;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ContinuumSubtractionApp.class);
}
