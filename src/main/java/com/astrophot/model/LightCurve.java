package com.astrophot.model;

import java.util.List;

/**
 * Curva de luz diferencial de una estrella. {@code coverage} empieza en el total de frames
 * y se descuenta una vez por cada hueco.
 */
public class LightCurve {

    public static class Gap {
        public final String frameId;
        public final double timestamp;
        public final GapReason reason;

        public Gap(String frameId, double timestamp, GapReason reason) {
            this.frameId = frameId;
            this.timestamp = timestamp;
            this.reason = reason;
        }
    }

    public final int starId;
    public final List<LightCurvePoint> points;
    public final double zeroPoint;
    public final int totalFrames;
    public final List<Gap> gaps;

    public LightCurve(int starId, List<LightCurvePoint> points, double zeroPoint, int totalFrames, List<Gap> gaps) {
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).timestamp <= points.get(i - 1).timestamp)
                throw new IllegalArgumentException("Puntos fuera de orden temporal en " + points.get(i).frameId);
        }
        this.starId = starId;
        this.points = List.copyOf(points);
        this.zeroPoint = zeroPoint;
        this.totalFrames = totalFrames;
        this.gaps = List.copyOf(gaps);
    }

    public int coverage() { return totalFrames - gaps.size(); }

    public int size() { return points.size(); }
}
