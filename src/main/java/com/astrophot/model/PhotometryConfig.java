package com.astrophot.model;

import java.util.List;

/**
 * Parámetros de una corrida para un objetivo. Inmutable: se construye una vez y se pasa
 * a las tres etapas, así varias corridas pueden convivir en el mismo proceso.
 */
public final class PhotometryConfig {

    /** Radio de exclusión en arcsec cuando el matching trabaja en píxeles. */
    public static final double DEFAULT_EXCLUSION_RADIUS = 5.0;

    private final CelestialPoint target;
    private final double targetX, targetY;
    private final PositionMetric positionMetric;
    private final double matchTolerance;
    private final double targetTolerance;
    private final double magnitudeWeight;
    private final int minEnsembleSize;
    private final double sigmaClip;
    private final ClipStatistic clipStatistic;
    private final double minCoverageFraction;
    private final int minEnsemblePerFrame;
    private final int minUsableFrames;
    private final double maxMagnitudeError;
    private final double variabilityMultiplier;
    private final int maxComparisonStars;
    private final double outlierSigma;
    private final int minObservations;
    private final int parallelism;
    private final List<CelestialPoint> excludedStars;
    private final double exclusionRadius;

    private PhotometryConfig(Builder b) {
        this.target = b.target;
        this.targetX = b.targetX;
        this.targetY = b.targetY;
        this.positionMetric = b.positionMetric;
        this.matchTolerance = b.matchTolerance;
        this.targetTolerance = Double.isNaN(b.targetTolerance) ? b.matchTolerance : b.targetTolerance;
        this.magnitudeWeight = b.magnitudeWeight;
        this.minEnsembleSize = b.minEnsembleSize;
        this.sigmaClip = b.sigmaClip;
        this.clipStatistic = b.clipStatistic;
        this.minCoverageFraction = b.minCoverageFraction;
        this.minEnsemblePerFrame = b.minEnsemblePerFrame;
        this.minUsableFrames = b.minUsableFrames;
        this.maxMagnitudeError = b.maxMagnitudeError;
        this.variabilityMultiplier = b.variabilityMultiplier;
        this.maxComparisonStars = b.maxComparisonStars;
        this.outlierSigma = b.outlierSigma;
        this.minObservations = b.minObservations;
        this.parallelism = b.parallelism;
        this.excludedStars = List.copyOf(b.excludedStars);
        if (!Double.isNaN(b.exclusionRadius)) this.exclusionRadius = b.exclusionRadius;
        else this.exclusionRadius = b.positionMetric == PositionMetric.SKY ? b.matchTolerance : DEFAULT_EXCLUSION_RADIUS;
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.target = target;
        b.targetX = targetX;
        b.targetY = targetY;
        b.positionMetric = positionMetric;
        b.matchTolerance = matchTolerance;
        b.targetTolerance = targetTolerance;
        b.magnitudeWeight = magnitudeWeight;
        b.minEnsembleSize = minEnsembleSize;
        b.sigmaClip = sigmaClip;
        b.clipStatistic = clipStatistic;
        b.minCoverageFraction = minCoverageFraction;
        b.minEnsemblePerFrame = minEnsemblePerFrame;
        b.minUsableFrames = minUsableFrames;
        b.maxMagnitudeError = maxMagnitudeError;
        b.variabilityMultiplier = variabilityMultiplier;
        b.maxComparisonStars = maxComparisonStars;
        b.outlierSigma = outlierSigma;
        b.minObservations = minObservations;
        b.parallelism = parallelism;
        b.excludedStars = excludedStars;
        b.exclusionRadius = exclusionRadius;
        return b;
    }

    public CelestialPoint target() { return target; }

    public boolean hasTargetPixel() { return !Double.isNaN(targetX) && !Double.isNaN(targetY); }

    public double targetX() { return targetX; }

    public double targetY() { return targetY; }

    public PositionMetric positionMetric() { return positionMetric; }

    public double matchTolerance() { return matchTolerance; }

    public double targetTolerance() { return targetTolerance; }

    public double magnitudeWeight() { return magnitudeWeight; }

    public int minEnsembleSize() { return minEnsembleSize; }

    public double sigmaClip() { return sigmaClip; }

    public ClipStatistic clipStatistic() { return clipStatistic; }

    public double minCoverageFraction() { return minCoverageFraction; }

    public int minEnsemblePerFrame() { return minEnsemblePerFrame; }

    public int minUsableFrames() { return minUsableFrames; }

    public double maxMagnitudeError() { return maxMagnitudeError; }

    public double variabilityMultiplier() { return variabilityMultiplier; }

    public int maxComparisonStars() { return maxComparisonStars; }

    public double outlierSigma() { return outlierSigma; }

    public int minObservations() { return minObservations; }

    public int parallelism() { return parallelism; }

    /** Coordenadas que nunca entran como comparación (variables conocidas, otros objetivos). */
    public List<CelestialPoint> excludedStars() { return excludedStars; }

    /** Radio de exclusión en arcsec; en SKY vale por defecto la tolerancia de matching. */
    public double exclusionRadius() { return exclusionRadius; }

    @Override
    public String toString() {
        return String.format("PhotometryConfig[target=%s metric=%s tol=%.2f minEns=%d clip=%.1f(%s) cov=%.2f minFrames=%d excl=%d]",
                target, positionMetric, matchTolerance, minEnsembleSize, sigmaClip, clipStatistic,
                minCoverageFraction, minUsableFrames, excludedStars.size());
    }

    public static final class Builder {
        private CelestialPoint target;
        private double targetX = Double.NaN, targetY = Double.NaN;
        private PositionMetric positionMetric = PositionMetric.SKY;
        private double matchTolerance = 5.0;
        private double targetTolerance = Double.NaN;
        private double magnitudeWeight = 0.25;
        private int minEnsembleSize = 3;
        private double sigmaClip = 3.0;
        private ClipStatistic clipStatistic = ClipStatistic.NOISE_NORMALIZED;
        private double minCoverageFraction = 0.8;
        private int minEnsemblePerFrame = 1;
        private int minUsableFrames = 3;
        private double maxMagnitudeError = 0.5;
        private double variabilityMultiplier = Double.POSITIVE_INFINITY;
        private int maxComparisonStars = Integer.MAX_VALUE;
        private double outlierSigma = 4.0;
        private int minObservations = 10;
        private int parallelism = 4;
        private List<CelestialPoint> excludedStars = List.of();
        private double exclusionRadius = Double.NaN;

        private Builder() {}

        public Builder target(CelestialPoint v) { this.target = v; return this; }
        public Builder target(double ra, double dec) { this.target = new CelestialPoint(ra, dec); return this; }
        public Builder targetPixel(double x, double y) { this.targetX = x; this.targetY = y; return this; }
        public Builder positionMetric(PositionMetric v) { this.positionMetric = v; return this; }
        public Builder matchTolerance(double v) { this.matchTolerance = v; return this; }
        public Builder targetTolerance(double v) { this.targetTolerance = v; return this; }
        public Builder magnitudeWeight(double v) { this.magnitudeWeight = v; return this; }
        public Builder minEnsembleSize(int v) { this.minEnsembleSize = v; return this; }
        public Builder sigmaClip(double v) { this.sigmaClip = v; return this; }
        public Builder clipStatistic(ClipStatistic v) { this.clipStatistic = v; return this; }
        public Builder minCoverageFraction(double v) { this.minCoverageFraction = v; return this; }
        public Builder minEnsemblePerFrame(int v) { this.minEnsemblePerFrame = v; return this; }
        public Builder minUsableFrames(int v) { this.minUsableFrames = v; return this; }
        public Builder maxMagnitudeError(double v) { this.maxMagnitudeError = v; return this; }
        public Builder variabilityMultiplier(double v) { this.variabilityMultiplier = v; return this; }
        public Builder maxComparisonStars(int v) { this.maxComparisonStars = v; return this; }
        public Builder outlierSigma(double v) { this.outlierSigma = v; return this; }
        public Builder minObservations(int v) { this.minObservations = v; return this; }
        public Builder parallelism(int v) { this.parallelism = v; return this; }
        public Builder excludedStars(List<CelestialPoint> v) { this.excludedStars = v; return this; }
        public Builder exclusionRadius(double v) { this.exclusionRadius = v; return this; }

        public PhotometryConfig build() {
            if (target == null && !(positionMetric == PositionMetric.PIXEL && !Double.isNaN(targetX) && !Double.isNaN(targetY)))
                throw new IllegalArgumentException("Falta la coordenada del objetivo");
            if (positionMetric == null || clipStatistic == null) throw new IllegalArgumentException("Métrica o estadístico nulo");
            requirePositive("matchTolerance", matchTolerance);
            if (!Double.isNaN(targetTolerance)) requirePositive("targetTolerance", targetTolerance);
            if (!(magnitudeWeight >= 0)) throw new IllegalArgumentException("magnitudeWeight debe ser >= 0");
            if (minEnsembleSize < 1) throw new IllegalArgumentException("minEnsembleSize debe ser >= 1");
            requirePositive("sigmaClip", sigmaClip);
            if (!(minCoverageFraction >= 0 && minCoverageFraction <= 1))
                throw new IllegalArgumentException("minCoverageFraction fuera de [0,1]: " + minCoverageFraction);
            if (minEnsemblePerFrame < 1) throw new IllegalArgumentException("minEnsemblePerFrame debe ser >= 1");
            if (minUsableFrames < 1) throw new IllegalArgumentException("minUsableFrames debe ser >= 1");
            requirePositive("maxMagnitudeError", maxMagnitudeError);
            if (!(variabilityMultiplier >= 1)) throw new IllegalArgumentException("variabilityMultiplier debe ser >= 1");
            if (maxComparisonStars < minEnsembleSize)
                throw new IllegalArgumentException("maxComparisonStars menor que minEnsembleSize");
            if (!(outlierSigma >= 0)) throw new IllegalArgumentException("outlierSigma debe ser >= 0 (0 = desactivado)");
            if (minObservations < 1) throw new IllegalArgumentException("minObservations debe ser >= 1");
            if (parallelism < 1) throw new IllegalArgumentException("parallelism debe ser >= 1");
            if (excludedStars == null) throw new IllegalArgumentException("Lista de exclusión nula");
            for (CelestialPoint p : excludedStars)
                if (p == null) throw new IllegalArgumentException("Coordenada nula en la lista de exclusión");
            if (!Double.isNaN(exclusionRadius)) requirePositive("exclusionRadius", exclusionRadius);
            return new PhotometryConfig(this);
        }

        private static void requirePositive(String name, double v) {
            if (!(v > 0)) throw new IllegalArgumentException(name + " debe ser > 0: " + v);
        }
    }
}
