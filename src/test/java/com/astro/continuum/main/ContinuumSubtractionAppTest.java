package com.astro.continuum.main;

import com.astro.continuum.model.AppConfig;
import com.astro.continuum.model.ChannelWeights;
import com.astro.continuum.model.EmissionLine;
import com.astro.continuum.model.EstimatorSettings;
import com.astro.continuum.model.Region;
import com.astro.continuum.service.PixelStatistics;
import com.astro.continuum.service.RegionStatsService;
import com.astro.continuum.service.FitsImageService;
import com.astro.continuum.service.SyntheticImages;
import ij.ImageStack;
import ij.process.FloatProcessor;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

public class ContinuumSubtractionAppTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final FitsImageService fits = new FitsImageService();

    @Before
    public void setUp() {
        AppConfig.reset();
    }

    @After
    public void tearDown() {
        AppConfig.reset();
    }

    private File write(String name, FloatProcessor image) throws Exception {
        File file = new File(folder.getRoot(), name);
        fits.write(file, image, null);
        return file;
    }

    @Test
    public void testRegionConverter() {
        Assert.assertEquals(40, new ContinuumSubtractionApp.RegionConverter().convert("1,2,40,50").width);
    }

    @Test
    public void testSubtractWeightsOverrideDefaults() {
        ContinuumSubtractionApp.SubtractCommand cmd = new ContinuumSubtractionApp.SubtractCommand();
        cmd.line = EmissionLine.OIII;
        cmd.strength = 3.0;
        cmd.redWeight = 0.25;

        ChannelWeights w = cmd.weights();

        Assert.assertEquals(3.0, w.strength, 0.0);
        Assert.assertEquals(0.25, w.red, 0.0);
        Assert.assertEquals(EmissionLine.OIII.defaultWeights.green, w.green, 0.0);
        Assert.assertEquals(EmissionLine.OIII.defaultWeights.blue, w.blue, 0.0);
    }

    @Test
    public void testSubtractWithEstimatedScale() throws Exception {
        FloatProcessor red = SyntheticImages.continuum(48, 48, 1);
        FloatProcessor green = SyntheticImages.continuum(48, 48, 2);
        FloatProcessor blue = SyntheticImages.continuum(48, 48, 3);
        FloatProcessor ha = SyntheticImages.narrowband(red, 0.5, 0.2, 4);
        File output = new File(folder.getRoot(), "blended.fits");
        File subtracted = new File(folder.getRoot(), "hacs.fits");

        int code = new ContinuumSubtractionApp().run(new String[] {
                "subtract",
                "--narrowband", write("ha.fits", ha).getPath(),
                "--red", write("r.fits", red).getPath(),
                "--green", write("g.fits", green).getPath(),
                "--blue", write("b.fits", blue).getPath(),
                "--line", "HA",
                "--region", "4,4,40,40",
                "--strength", "0",
                "--subtracted-output", subtracted.getPath(),
                "--output", output.getPath() });

        Assert.assertEquals(0, code);
        ImageStack out = fits.readPlanes(output);
        Assert.assertEquals(3, out.getSize());
        Assert.assertArrayEquals((float[]) green.getPixels(),
                (float[]) out.getProcessor(2).convertToFloatProcessor().getPixels(), 0f);
        Assert.assertTrue(subtracted.isFile());
    }

    @Test
    public void testSubtractWithManualScale() throws Exception {
        FloatProcessor red = SyntheticImages.constant(8, 8, 10f);
        FloatProcessor ha = SyntheticImages.constant(8, 8, 25f);
        File rgb = new File(folder.getRoot(), "rgb.fits");
        ImageStack stack = new ImageStack(8, 8);
        stack.addSlice("R", red);
        stack.addSlice("G", SyntheticImages.constant(8, 8, 20f));
        stack.addSlice("B", SyntheticImages.constant(8, 8, 30f));
        fits.write(rgb, stack, null);
        File output = new File(folder.getRoot(), "out.fits");

        int code = new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", write("ha.fits", ha).getPath(), "--rgb", rgb.getPath(),
                "--scale", "0.3", "--output", output.getPath() });

        Assert.assertEquals(0, code);
        // senal constante: tras recentrar en la mediana no se suma nada
        Assert.assertEquals(10f, fits.read(output).getf(3, 3), 1e-5f);
    }

    @Test
    public void testMix() throws Exception {
        File output = new File(folder.getRoot(), "nb.fits");

        int code = new ContinuumSubtractionApp().run(new String[] {
                "mix",
                "--ha", write("ha.fits", SyntheticImages.constant(4, 4, 10f)).getPath(),
                "--oiii", write("oiii.fits", SyntheticImages.constant(4, 4, 2f)).getPath(),
                "--green-ha", "0.25",
                "--output", output.getPath() });

        Assert.assertEquals(0, code);
        ImageStack out = fits.readPlanes(output);
        Assert.assertEquals(10f, out.getProcessor(1).getf(0, 0), 1e-6f);
        Assert.assertEquals(4f, out.getProcessor(2).getf(0, 0), 1e-6f);
        Assert.assertEquals(2f, out.getProcessor(3).getf(0, 0), 1e-6f);
    }

    @Test
    public void testMissingRequiredOptionFails() {
        Assert.assertEquals(1, new ContinuumSubtractionApp().run(new String[] { "mix", "--ha", "a.fits" }));
    }

    @Test
    public void testMissingChannelsFail() throws Exception {
        File ha = write("ha.fits", SyntheticImages.constant(4, 4, 1f));
        Assert.assertEquals(1, new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", ha.getPath(), "--red", ha.getPath(),
                "--output", new File(folder.getRoot(), "x.fits").getPath() }));
    }

    @Test
    public void testInvalidRegionFails() throws Exception {
        File img = write("img.fits", SyntheticImages.constant(4, 4, 1f));
        Assert.assertEquals(1, new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", img.getPath(), "--red", img.getPath(), "--green", img.getPath(),
                "--blue", img.getPath(), "--region", "2,2,5,5",
                "--output", new File(folder.getRoot(), "x.fits").getPath() }));
    }

    @Test
    public void testManualScaleWithRegionUsesRegionBaseline() throws Exception {
        FloatProcessor red = SyntheticImages.continuum(16, 16, 5);
        FloatProcessor ha = SyntheticImages.narrowband(red, 0.3, 0.0, 6);
        File zero = write("zero.fits", SyntheticImages.constant(16, 16, 0f));
        File subtracted = new File(folder.getRoot(), "cs.fits");
        double regionMedian = new RegionStatsService().sample(ha, red, new Region(0, 0, 4, 4)).baseline;

        int code = new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", write("ha.fits", ha).getPath(),
                "--red", write("r.fits", red).getPath(), "--green", zero.getPath(), "--blue", zero.getPath(),
                "--scale", "0.3", "--region", "0,0,4,4",
                "--subtracted-output", subtracted.getPath(),
                "--output", new File(folder.getRoot(), "out.fits").getPath() });

        Assert.assertEquals(0, code);
        FloatProcessor cs = fits.read(subtracted);
        Assert.assertEquals(ha.getf(7, 9) - 0.3 * (red.getf(7, 9) - regionMedian), cs.getf(7, 9), 1e-3);
    }

    @Test
    public void testRatioScale() throws Exception {
        FloatProcessor red = SyntheticImages.continuum(16, 16, 7);
        float[] half = ((float[]) red.getPixels()).clone();
        for (int i = 0; i < half.length; i++) half[i] *= 0.5f;
        FloatProcessor ha = new FloatProcessor(16, 16, half);
        File zero = write("zero.fits", SyntheticImages.constant(16, 16, 0f));
        File subtracted = new File(folder.getRoot(), "cs.fits");

        int code = new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", write("ha.fits", ha).getPath(),
                "--red", write("r.fits", red).getPath(), "--green", zero.getPath(), "--blue", zero.getPath(),
                "--ratio-scale", "--subtracted-output", subtracted.getPath(),
                "--output", new File(folder.getRoot(), "out.fits").getPath() });

        // c = 0.5: cs = 0.5 * red - 0.5 * (red - median(red)) = 0.5 * median(red)
        Assert.assertEquals(0, code);
        double expected = 0.5 * PixelStatistics.median((float[]) red.getPixels());
        FloatProcessor cs = fits.read(subtracted);
        Assert.assertEquals(expected, cs.getf(0, 0), 1e-2);
        Assert.assertEquals(expected, cs.getf(11, 5), 1e-2);
    }

    @Test
    public void testScaleAndRatioScaleConflict() throws Exception {
        File img = write("img.fits", SyntheticImages.constant(4, 4, 1f));
        Assert.assertEquals(1, new ContinuumSubtractionApp().run(new String[] {
                "subtract", "--narrowband", img.getPath(), "--red", img.getPath(), "--green", img.getPath(),
                "--blue", img.getPath(), "--scale", "0.2", "--ratio-scale",
                "--output", new File(folder.getRoot(), "x.fits").getPath() }));
    }

    @Test
    public void testConfigSavesDefaults() {
        int code = new ContinuumSubtractionApp().run(new String[] {
                "config", "--line", "OIII", "--strength", "3", "--blue-mix", "0.4",
                "--fine-samples", "20", "--max-iterations", "200" });

        Assert.assertEquals(0, code);
        Assert.assertEquals(EmissionLine.OIII, AppConfig.getEmissionLine());
        Assert.assertEquals(0.4, AppConfig.getChannelWeights(EmissionLine.HA).blue, 0.0);
        EstimatorSettings settings = AppConfig.getEstimatorSettings();
        Assert.assertEquals(20, settings.fineSamples);
        Assert.assertEquals(200, settings.maxIterations);
        Assert.assertEquals(EstimatorSettings.DEFAULT_COARSE_SAMPLES, settings.coarseSamples);

        // el siguiente "subtract" parte de los valores guardados
        ContinuumSubtractionApp.SubtractCommand cmd = new ContinuumSubtractionApp.SubtractCommand();
        Assert.assertEquals(EmissionLine.OIII, cmd.line);
        Assert.assertEquals(3.0, cmd.weights().strength, 0.0);
    }

    @Test
    public void testConfigRejectsInvalidSettingsWithoutSaving() {
        int code = new ContinuumSubtractionApp().run(new String[] { "config", "--coarse-min", "6", "--line", "SII" });

        Assert.assertEquals(1, code);
        Assert.assertEquals(EstimatorSettings.DEFAULT_COARSE_MIN, AppConfig.getCoarseMin(), 0.0);
        Assert.assertEquals(EmissionLine.HA, AppConfig.getEmissionLine());
    }

    @Test
    public void testConfigReset() {
        AppConfig.setBlendStrength(5.0);

        Assert.assertEquals(0, new ContinuumSubtractionApp().run(new String[] { "config", "--reset" }));
        Assert.assertEquals(2.0, AppConfig.getBlendStrength(), 0.0);
    }
}
