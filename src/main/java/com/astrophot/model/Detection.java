package com.astrophot.model;

/**
 * Una estrella detectada en un frame. Las coordenadas que la fuente no aporta van como NaN
 * (tablas sin WCS no tienen RA/DEC, catálogos solo-cielo no tienen X/Y).
 */
public class Detection {

    // 2.5 / ln(10)
    public static final double MAG_ERROR_FACTOR = 1.0857;

    public final String frameId;
    public final double ra;
    public final double dec;
    public final double x;
    public final double y;
    public final double magnitude;      // instrumental
    public final double magnitudeError;
    public final int flags;             // 0 = limpia

    public Detection(String frameId, double ra, double dec, double x, double y,
                     double magnitude, double magnitudeError, int flags) {
        if (frameId == null) throw new IllegalArgumentException("frameId nulo");
        if (Double.isNaN(magnitude) || Double.isInfinite(magnitude))
            throw new IllegalArgumentException("Magnitud inválida en frame " + frameId);
        if (!(magnitudeError >= 0)) throw new IllegalArgumentException("Error de magnitud negativo o NaN en frame " + frameId);
        this.frameId = frameId;
        this.ra = ra;
        this.dec = dec;
        this.x = x;
        this.y = y;
        this.magnitude = magnitude;
        this.magnitudeError = magnitudeError;
        this.flags = flags;
    }

    public static Detection fromCounts(String frameId, double ra, double dec, double x, double y,
                                       double counts, double countsError, int flags) {
        if (!(counts > 0)) throw new IllegalArgumentException("Cuentas no positivas: " + counts);
        double mag = -2.5 * Math.log10(counts);
        double err = MAG_ERROR_FACTOR * Math.abs(countsError) / counts;
        return new Detection(frameId, ra, dec, x, y, mag, err, flags);
    }

    public boolean hasSky() { return !Double.isNaN(ra) && !Double.isNaN(dec); }

    public boolean hasPixel() { return !Double.isNaN(x) && !Double.isNaN(y); }

    public boolean isClean() { return flags == 0; }
}
