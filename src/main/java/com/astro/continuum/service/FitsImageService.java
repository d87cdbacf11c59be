package com.astro.continuum.service;

import ij.ImageStack;
import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.FitsOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Lectura y escritura FITS del HDU primario. El orden de filas es el del fichero
 * (data[y][x]), sin voltear, para que las regiones coincidan con las del host.
 */
public class FitsImageService {

    /** Primer plano del HDU primario. */
    public FloatProcessor read(File file) throws IOException {
        return readPlanes(file).getProcessor(1).convertToFloatProcessor();
    }

    /** Todos los planos del HDU primario (uno si la imagen es 2-D). */
    public ImageStack readPlanes(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new IOException("No primary HDU in " + file);
            }
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            Object kernel = hdu.getKernel();
            Object[] planes = (kernel instanceof Object[] && ((Object[]) kernel).length > 0
                    && ((Object[]) kernel)[0] instanceof Object[])
                    ? (Object[]) kernel
                    : new Object[] { kernel };

            ImageStack stack = null;
            for (int i = 0; i < planes.length; i++) {
                FloatProcessor fp = toFloat(planes[i], bzero, bscale, file);
                if (stack == null) stack = new ImageStack(fp.getWidth(), fp.getHeight());
                stack.addSlice("plane " + (i + 1), fp);
            }
            LOG.debug("readPlanes: {} -> {} plane(s) {}x{}", file, stack.getSize(), stack.getWidth(), stack.getHeight());
            return stack;
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Escribe la pila como cubo float [plano][y][x] (o 2-D si hay un solo plano),
     * sobrescribiendo el fichero.
     */
    public void write(File file, ImageStack stack, String history) throws IOException {
        int w = stack.getWidth();
        int h = stack.getHeight();
        float[][][] cube = new float[stack.getSize()][h][w];
        for (int p = 0; p < stack.getSize(); p++) {
            float[] px = (float[]) stack.getProcessor(p + 1).convertToFloatProcessor().getPixels();
            for (int y = 0; y < h; y++) {
                System.arraycopy(px, y * w, cube[p][y], 0, w);
            }
        }
        Object data = (cube.length == 1) ? cube[0] : cube;

        Files.deleteIfExists(file.toPath());
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            if (history != null && !history.isEmpty()) {
                hdu.getHeader().insertHistory(history);
            }
            fits.addHDU(hdu);
            try (FitsOutputStream out = new FitsOutputStream(new FileOutputStream(file))) {
                fits.write(out);
            }
        } catch (FitsException e) {
            throw new IOException("Cannot write FITS file " + file + ": " + e.getMessage(), e);
        }
        LOG.info("write: {} ({} plane(s) {}x{})", file, cube.length, w, h);
    }

    public void write(File file, FloatProcessor image, String history) throws IOException {
        ImageStack stack = new ImageStack(image.getWidth(), image.getHeight());
        stack.addSlice("plane 1", image);
        write(file, stack, history);
    }

    private static FloatProcessor toFloat(Object plane, double bzero, double bscale, File file) throws IOException {
        if (plane instanceof float[][]) {
            float[][] f = (float[][]) plane;
            return build(f.length, f[0].length, (y, x) -> f[y][x]);
        }
        if (plane instanceof double[][]) {
            double[][] d = (double[][]) plane;
            return build(d.length, d[0].length, (y, x) -> d[y][x]);
        }
        if (plane instanceof short[][]) {
            short[][] s = (short[][]) plane;
            return build(s.length, s[0].length, (y, x) -> s[y][x] * bscale + bzero);
        }
        if (plane instanceof int[][]) {
            int[][] n = (int[][]) plane;
            return build(n.length, n[0].length, (y, x) -> n[y][x] * bscale + bzero);
        }
        if (plane instanceof byte[][]) {
            byte[][] b = (byte[][]) plane;
            return build(b.length, b[0].length, (y, x) -> (b[y][x] & 0xFF) * bscale + bzero);
        }
        throw new IOException("Unsupported FITS image data in " + file + ": "
                + (plane == null ? "null" : plane.getClass().getSimpleName()));
    }

    private interface PixelSource {
        double get(int y, int x);
    }

    private static FloatProcessor build(int height, int width, PixelSource source) {
        float[] px = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                px[y * width + x] = (float) source.get(y, x);
            }
        }
        return new FloatProcessor(width, height, px);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsImageService.class);
}
