package com.astrophot.service;

import com.astrophot.model.CelestialPoint;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Campo estelar sintético: estrellas alineadas en RA cada 60", una curva de magnitudes por estrella
 * (NaN = no detectada en ese frame) y un pequeño temblor de posición determinista.
 */
final class SyntheticField {

    static final double RA0 = 150.0;
    static final double DEC0 = 20.0;
    static final double SPACING_ARCSEC = 60.0;
    static final double MJD0 = 60000.0;

    private final int frameCount;
    private final List<CelestialPoint> positions = new ArrayList<>();
    private final List<double[]> magnitudes = new ArrayList<>();
    private final List<double[]> errors = new ArrayList<>();
    private double[] transparency;

    SyntheticField(int frameCount) {
        this.frameCount = frameCount;
        this.transparency = new double[frameCount];
    }

    /** Desplazamiento común a todas las estrellas en cada frame (nubes, airmass). */
    SyntheticField transparency(double... offsets) {
        this.transparency = offsets.clone();
        return this;
    }

    int addStar(double[] mags, double error) {
        double[] err = new double[mags.length];
        Arrays.fill(err, error);
        return addStar(mags, err);
    }

    int addStar(double[] mags, double[] errs) {
        int index = positions.size();
        double ra = RA0 + index * SPACING_ARCSEC / 3600.0 / Math.cos(Math.toRadians(DEC0));
        return addStarAt(new CelestialPoint(ra, DEC0), mags, errs);
    }

    int addStarAt(CelestialPoint position, double[] mags, double[] errs) {
        if (mags.length != frameCount || errs.length != frameCount)
            throw new IllegalArgumentException("Se esperaban " + frameCount + " valores");
        positions.add(position);
        magnitudes.add(mags.clone());
        errors.add(errs.clone());
        return positions.size() - 1;
    }

    CelestialPoint position(int star) {
        return positions.get(star);
    }

    static String frameId(int frame) {
        return String.format("f%02d", frame);
    }

    List<Frame> frames() {
        List<Frame> frames = new ArrayList<>(frameCount);
        for (int f = 0; f < frameCount; f++) {
            List<Detection> detections = new ArrayList<>();
            for (int s = 0; s < positions.size(); s++) {
                double mag = magnitudes.get(s)[f];
                if (Double.isNaN(mag)) continue;
                // temblor de ~0.3" entre frames
                double jitter = 0.3 / 3600.0 * Math.sin(1.7 * f + s);
                CelestialPoint p = positions.get(s);
                double x = 500 + s * SPACING_ARCSEC + 0.3 * Math.sin(1.7 * f + s);
                double y = 500 + 0.3 * Math.cos(1.3 * f + s);
                detections.add(new Detection(frameId(f), p.ra + jitter, p.dec - jitter, x, y,
                        mag + transparency[f], errors.get(s)[f], 0));
            }
            frames.add(new Frame(frameId(f), MJD0 + f * 0.01, detections, 1.2, "V"));
        }
        return frames;
    }

    /** Id maestro de la estrella sintética más cercana. */
    static int idOf(MasterCatalog catalog, CelestialPoint p) {
        MasterStar best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (MasterStar s : catalog.stars()) {
            double d = CelestialPoint.separationArcsec(s.ra(), s.dec(), p.ra, p.dec);
            if (d < bestDist) { bestDist = d; best = s; }
        }
        if (best == null || bestDist > 5) throw new IllegalStateException("Sin estrella cerca de " + p);
        return best.id();
    }

    static double[] constant(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    static double[] offsets(double base, double... deviations) {
        double[] out = new double[deviations.length];
        for (int i = 0; i < out.length; i++) out[i] = base + deviations[i];
        return out;
    }

    static double[] gaussian(Random rnd, int n, double base, double sigma) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = base + sigma * rnd.nextGaussian();
        return out;
    }
}
