package com.astrophot.model;

/**
 * Espacio en el que se comparan posiciones entre frames. La tolerancia de la configuración
 * se interpreta en arcosegundos (SKY) o en píxeles (PIXEL).
 */
public enum PositionMetric {

    SKY {
        @Override public boolean supports(Detection d) { return d.hasSky(); }
        @Override public double u(Detection d) { return d.ra; }
        @Override public double v(Detection d) { return d.dec; }
        @Override public double distance(double u1, double v1, double u2, double v2) {
            return CelestialPoint.separationArcsec(u1, v1, u2, v2);
        }
    },

    PIXEL {
        @Override public boolean supports(Detection d) { return d.hasPixel(); }
        @Override public double u(Detection d) { return d.x; }
        @Override public double v(Detection d) { return d.y; }
        @Override public double distance(double u1, double v1, double u2, double v2) {
            return Math.hypot(u1 - u2, v1 - v2);
        }
    };

    public abstract boolean supports(Detection d);

    public abstract double u(Detection d);

    public abstract double v(Detection d);

    public abstract double distance(double u1, double v1, double u2, double v2);

    public double distance(Detection a, Detection b) {
        return distance(u(a), v(a), u(b), v(b));
    }
}
