package com.astrophot.model;

import java.util.List;

/**
 * Una exposición ya reducida: instante (MJD) y lista de detecciones.
 */
public class Frame {
    public final String id;
    public final double timestamp; // MJD
    public final List<Detection> detections;
    public final double airmass;
    public final String filter;

    public Frame(String id, double timestamp, List<Detection> detections, double airmass, String filter) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Frame sin id");
        if (Double.isNaN(timestamp)) throw new IllegalArgumentException("Frame " + id + " sin timestamp");
        for (Detection d : detections) {
            if (!id.equals(d.frameId))
                throw new IllegalArgumentException("Detección de " + d.frameId + " dentro del frame " + id);
        }
        this.id = id;
        this.timestamp = timestamp;
        this.detections = List.copyOf(detections);
        this.airmass = airmass;
        this.filter = filter;
    }

    public Frame(String id, double timestamp, List<Detection> detections) {
        this(id, timestamp, detections, Double.NaN, null);
    }

    public boolean isEmpty() { return detections.isEmpty(); }
}
