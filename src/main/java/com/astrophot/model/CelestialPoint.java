package com.astrophot.model;

public class CelestialPoint {
    public final double ra;  // grados, [0, 360)
    public final double dec; // grados

    public CelestialPoint(double ra, double dec) {
        if (Double.isNaN(ra) || Double.isNaN(dec)) throw new IllegalArgumentException("Coordenadas NaN");
        if (dec < -90.0 || dec > 90.0) throw new IllegalArgumentException("DEC fuera de rango: " + dec);
        this.ra = ((ra % 360.0) + 360.0) % 360.0;
        this.dec = dec;
    }

    public double separationArcsec(CelestialPoint other) {
        return separationArcsec(ra, dec, other.ra, other.dec);
    }

    // Haversine: estable para separaciones de pocos arcosegundos
    public static double separationArcsec(double ra1, double dec1, double ra2, double dec2) {
        double d1 = Math.toRadians(dec1), d2 = Math.toRadians(dec2);
        double dDec = d2 - d1;
        double dRa = Math.toRadians(ra2 - ra1);
        double h = Math.pow(Math.sin(dDec / 2), 2) + Math.cos(d1) * Math.cos(d2) * Math.pow(Math.sin(dRa / 2), 2);
        return Math.toDegrees(2 * Math.asin(Math.min(1.0, Math.sqrt(h)))) * 3600.0;
    }

    /** Diferencia en RA llevada a [-180, 180). */
    public static double wrapRaDelta(double delta) {
        double d = ((delta + 180.0) % 360.0 + 360.0) % 360.0;
        return d - 180.0;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "(RA %.5f, DEC %.5f)", ra, dec);
    }
}
