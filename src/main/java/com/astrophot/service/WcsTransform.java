package com.astrophot.service;

import com.astrophot.model.CelestialPoint;
import nom.tam.fits.Header;

import java.util.Optional;

/**
 * Proyección gnomónica (TAN) de píxel a cielo a partir de CRVAL/CRPIX/CD.
 * Los píxeles se reciben en base 0, como los entrega ImageJ; FITS cuenta desde 1.
 */
public class WcsTransform {

    private final double ra0, dec0;
    private final double crpix1, crpix2;
    private final double cd11, cd12, cd21, cd22;

    public WcsTransform(double ra0, double dec0, double crpix1, double crpix2,
                        double cd11, double cd12, double cd21, double cd22) {
        double det = cd11 * cd22 - cd12 * cd21;
        if (det == 0 || Double.isNaN(det)) throw new IllegalArgumentException("Matriz CD singular");
        this.ra0 = ra0;
        this.dec0 = dec0;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
    }

    public static Optional<WcsTransform> fromHeader(Header h) {
        if (!h.containsKey("CRVAL1") || !h.containsKey("CRVAL2") || !h.containsKey("CRPIX1")) return Optional.empty();
        String ctype = h.getStringValue("CTYPE1");
        if (ctype != null && !ctype.contains("TAN")) return Optional.empty();

        double cd11, cd12, cd21, cd22;
        if (h.containsKey("CD1_1")) {
            cd11 = h.getDoubleValue("CD1_1", 0);
            cd12 = h.getDoubleValue("CD1_2", 0);
            cd21 = h.getDoubleValue("CD2_1", 0);
            cd22 = h.getDoubleValue("CD2_2", 0);
        } else if (h.containsKey("CDELT1")) {
            double c1 = h.getDoubleValue("CDELT1", 0), c2 = h.getDoubleValue("CDELT2", 0);
            double rho = Math.toRadians(h.getDoubleValue("CROTA2", 0));
            cd11 = c1 * Math.cos(rho);
            cd12 = -c2 * Math.sin(rho);
            cd21 = c1 * Math.sin(rho);
            cd22 = c2 * Math.cos(rho);
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(new WcsTransform(h.getDoubleValue("CRVAL1", 0), h.getDoubleValue("CRVAL2", 0),
                    h.getDoubleValue("CRPIX1", 0), h.getDoubleValue("CRPIX2", 0), cd11, cd12, cd21, cd22));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public CelestialPoint toSky(double x, double y) {
        double dx = x + 1 - crpix1, dy = y + 1 - crpix2;
        double xi = Math.toRadians(cd11 * dx + cd12 * dy);
        double eta = Math.toRadians(cd21 * dx + cd22 * dy);
        double d0 = Math.toRadians(dec0);

        double denom = Math.cos(d0) - eta * Math.sin(d0);
        double ra = Math.toRadians(ra0) + Math.atan2(xi, denom);
        double dec = Math.atan2(eta * Math.cos(d0) + Math.sin(d0), Math.hypot(xi, denom));
        return new CelestialPoint(Math.toDegrees(ra), Math.toDegrees(dec));
    }

    /** Inversa de {@link #toSky}; devuelve {x, y} en base 0. */
    public double[] toPixel(double ra, double dec) {
        double a = Math.toRadians(ra - ra0);
        double d = Math.toRadians(dec), d0 = Math.toRadians(dec0);
        double denom = Math.sin(d) * Math.sin(d0) + Math.cos(d) * Math.cos(d0) * Math.cos(a);
        double xi = Math.toDegrees(Math.cos(d) * Math.sin(a) / denom);
        double eta = Math.toDegrees((Math.sin(d) * Math.cos(d0) - Math.cos(d) * Math.sin(d0) * Math.cos(a)) / denom);

        double det = cd11 * cd22 - cd12 * cd21;
        double dx = (cd22 * xi - cd12 * eta) / det;
        double dy = (-cd21 * xi + cd11 * eta) / det;
        return new double[]{dx + crpix1 - 1, dy + crpix2 - 1};
    }
}
