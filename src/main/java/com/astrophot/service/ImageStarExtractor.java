package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.CelestialPoint;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Extracción de estrellas sobre imágenes FITS: umbral sobre el cielo, segmentación con el
 * ParticleAnalyzer de ImageJ y flujo de apertura por blob. No ajusta PSF.
 */
public class ImageStarExtractor {

    private static final Logger log = LoggerFactory.getLogger(ImageStarExtractor.class);

    private static final double DETECTION_SIGMA = 5.0;
    private static final double MIN_AREA = 3;
    private static final double MAX_AREA = 99999;
    private static final int SKY_SAMPLES = 100_000;
    private static final double MAD_TO_SIGMA = 1.4826;

    private final FitsHeaderService headerService;

    public ImageStarExtractor() {
        this(new FitsHeaderService());
    }

    public ImageStarExtractor(FitsHeaderService headerService) {
        this.headerService = headerService;
    }

    public Frame extract(File fitsFile) {
        try (Fits fits = new Fits(fitsFile)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new PhotometryIngestException("FITS sin imagen: " + fitsFile.getName());
            Header header = hdu.getHeader();
            FitsHeaderService.FitsMetadata meta = headerService.fromHeader(header);
            if (Double.isNaN(meta.mjd)) throw new PhotometryIngestException("Sin fecha de observación en " + fitsFile.getName());

            double bzero = header.getDoubleValue("BZERO", 0);
            double bscale = header.getDoubleValue("BSCALE", 1);
            double[][] data = toDouble(hdu.getKernel(), bzero, bscale, fitsFile.getName());

            Optional<WcsTransform> wcs = WcsTransform.fromHeader(header);
            if (wcs.isEmpty()) log.warn("{}: sin WCS, solo coordenadas de píxel", fitsFile.getName());

            String frameId = PhotometryFileReader.frameId(fitsFile.toPath());
            List<Detection> detections = extract(frameId, data, meta.gain, wcs);
            log.info("{}: {} estrellas detectadas", fitsFile.getName(), detections.size());
            return new Frame(frameId, meta.mjd, detections, meta.airmass, meta.filter);
        } catch (FitsException | IOException e) {
            throw new PhotometryIngestException("No se pudo leer la imagen " + fitsFile.getName(), e);
        }
    }

    List<Detection> extract(String frameId, double[][] data, double gain, Optional<WcsTransform> wcs) {
        int h = data.length, w = h == 0 ? 0 : data[0].length;
        if (w == 0) return List.of();

        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) px[y * w + x] = (float) data[y][x];
        }

        // --- CIELO ---
        double[] sky = skyLevel(px);
        double skyLevel = sky[0], noise = sky[1];
        if (!(noise > 0)) {
            log.warn("Frame {}: imagen sin ruido de cielo medible", frameId);
            return List.of();
        }

        // --- DETECCIÓN ---
        ip.resetMinAndMax();
        ip.setThreshold(skyLevel + DETECTION_SIGMA * noise, Math.max(ip.getMax(), skyLevel + DETECTION_SIGMA * noise),
                ImageProcessor.NO_LUT_UPDATE);
        int measurements = Measurements.AREA | Measurements.MEAN | Measurements.CENTER_OF_MASS;
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE | ParticleAnalyzer.EXCLUDE_EDGE_PARTICLES,
                measurements, rt, MIN_AREA, MAX_AREA);
        pa.setHideOutputImage(true);
        pa.analyze(new ImagePlus(frameId, ip));

        List<Detection> out = new ArrayList<>();
        double g = gain > 0 ? gain : 1.0;
        for (int i = 0; i < rt.getCounter(); i++) {
            double area = rt.getValue("Area", i);
            double flux = (rt.getValue("Mean", i) - skyLevel) * area;
            if (!(flux > 0)) continue;
            // ecuación CCD en ADU: Poisson de la fuente más ruido de cielo en la apertura
            double fluxErr = Math.sqrt(flux / g + area * noise * noise);
            // ImageJ mide desde el borde del píxel, no desde el centro
            double x = rt.getValue("XM", i) - 0.5, y = rt.getValue("YM", i) - 0.5;
            double ra = Double.NaN, dec = Double.NaN;
            if (wcs.isPresent()) {
                CelestialPoint p = wcs.get().toSky(x, y);
                ra = p.ra;
                dec = p.dec;
            }
            out.add(Detection.fromCounts(frameId, ra, dec, x, y, flux, fluxErr, 0));
        }
        log.debug("Frame {}: cielo {} ruido {} -> {} blobs", frameId, String.format("%.1f", skyLevel),
                String.format("%.2f", noise), out.size());
        return out;
    }

    // Mediana y MAD sobre una muestra regular de píxeles
    static double[] skyLevel(float[] px) {
        int step = Math.max(1, px.length / SKY_SAMPLES);
        double[] sample = new double[(px.length + step - 1) / step];
        for (int i = 0, k = 0; i < px.length; i += step, k++) sample[k] = px[i];
        Arrays.sort(sample);
        double median = median(sample);
        double[] dev = new double[sample.length];
        for (int i = 0; i < sample.length; i++) dev[i] = Math.abs(sample[i] - median);
        Arrays.sort(dev);
        return new double[]{median, MAD_TO_SIGMA * median(dev)};
    }

    private static double median(double[] sorted) {
        int n = sorted.length, mid = n / 2;
        return n % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static double[][] toDouble(Object k, double bzero, double bscale, String name) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][];
            for (int i = 0; i < f.length; i++) {
                d[i] = new double[f[i].length];
                for (int j = 0; j < f[i].length; j++) d[i][j] = bzero + bscale * f[i][j];
            }
            return d;
        }
        if (k instanceof double[][]) {
            double[][] f = (double[][]) k;
            double[][] d = new double[f.length][];
            for (int i = 0; i < f.length; i++) {
                d[i] = new double[f[i].length];
                for (int j = 0; j < f[i].length; j++) d[i][j] = bzero + bscale * f[i][j];
            }
            return d;
        }
        throw new PhotometryIngestException("Formato de imagen no soportado en " + name
                + (k == null ? "" : ": " + k.getClass().getSimpleName()));
    }
}
