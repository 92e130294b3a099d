package com.astrophot.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identidad de una estrella a lo largo de la serie. Guarda la posición media (cielo y píxel),
 * la magnitud media y un mapa disperso frameId -> detección. Nunca se fusiona con otra.
 * Solo acepta detecciones mientras dura el matching: al entrar en un {@link MasterCatalog} queda congelada.
 */
public class MasterStar {

    private final int id;
    private final Map<String, Detection> detections = new LinkedHashMap<>();

    private double ra = Double.NaN, dec = Double.NaN;
    private int skyCount;
    private double x = Double.NaN, y = Double.NaN;
    private int pixelCount;
    private double magnitude;
    private boolean frozen;

    public MasterStar(int id, Detection seed) {
        this.id = id;
        record(seed);
    }

    public void record(Detection d) {
        if (frozen) throw new IllegalStateException("La estrella " + id + " ya pertenece a un catálogo cerrado");
        if (detections.containsKey(d.frameId))
            throw new IllegalStateException("La estrella " + id + " ya tiene detección en " + d.frameId);
        detections.put(d.frameId, d);

        // --- MEDIAS INCREMENTALES ---
        magnitude += (d.magnitude - magnitude) / detections.size();
        if (d.hasSky()) {
            skyCount++;
            if (skyCount == 1) { ra = d.ra; dec = d.dec; }
            else {
                ra += CelestialPoint.wrapRaDelta(d.ra - ra) / skyCount;
                ra = ((ra % 360.0) + 360.0) % 360.0;
                dec += (d.dec - dec) / skyCount;
            }
        }
        if (d.hasPixel()) {
            pixelCount++;
            if (pixelCount == 1) { x = d.x; y = d.y; }
            else {
                x += (d.x - x) / pixelCount;
                y += (d.y - y) / pixelCount;
            }
        }
    }

    void freeze() { frozen = true; }

    public int id() { return id; }

    public double ra() { return ra; }

    public double dec() { return dec; }

    public double x() { return x; }

    public double y() { return y; }

    public double meanMagnitude() { return magnitude; }

    public boolean hasSky() { return skyCount > 0; }

    public double u(PositionMetric metric) { return metric == PositionMetric.SKY ? ra : x; }

    public double v(PositionMetric metric) { return metric == PositionMetric.SKY ? dec : y; }

    public Optional<Detection> detection(String frameId) { return Optional.ofNullable(detections.get(frameId)); }

    public Map<String, Detection> detections() { return Collections.unmodifiableMap(detections); }

    public int coverage() { return detections.size(); }

    @Override
    public String toString() {
        return String.format("MasterStar[%d ra=%.6f dec=%.6f mag=%.3f n=%d]", id, ra, dec, magnitude, coverage());
    }
}
