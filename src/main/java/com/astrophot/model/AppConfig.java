package com.astrophot.model;

import java.util.List;
import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Claves de matching
    private static final String KEY_METRIC = "position_metric";
    private static final String KEY_TOLERANCE = "match_tolerance";
    private static final String KEY_MAG_WEIGHT = "magnitude_weight";

    // Claves de selección de comparaciones
    private static final String KEY_MIN_ENSEMBLE = "min_ensemble_size";
    private static final String KEY_SIGMA = "sigma_clip";
    private static final String KEY_CLIP_STAT = "clip_statistic";
    private static final String KEY_COVERAGE = "min_coverage_fraction";
    private static final String KEY_MAX_ERR = "max_magnitude_error";
    private static final String KEY_EXCLUSION_FILE = "exclusion_file";

    // Claves de curva de luz
    private static final String KEY_MIN_FRAMES = "min_usable_frames";
    private static final String KEY_MIN_PER_FRAME = "min_ensemble_per_frame";
    private static final String KEY_OUTLIER = "outlier_sigma";

    // Última sesión
    private static final String KEY_LAST_DIR = "last_folder";
    private static final String KEY_LAST_OBJECT = "last_object";

    public static PositionMetric getPositionMetric() {
        try {
            return PositionMetric.valueOf(prefs.get(KEY_METRIC, PositionMetric.SKY.name()));
        } catch (IllegalArgumentException e) {
            return PositionMetric.SKY;
        }
    }
    public static void setPositionMetric(PositionMetric v) { prefs.put(KEY_METRIC, v.name()); }

    public static double getMatchTolerance() { return prefs.getDouble(KEY_TOLERANCE, 5.0); }
    public static void setMatchTolerance(double v) { prefs.putDouble(KEY_TOLERANCE, v); }

    public static double getMagnitudeWeight() { return prefs.getDouble(KEY_MAG_WEIGHT, 0.25); }
    public static void setMagnitudeWeight(double v) { prefs.putDouble(KEY_MAG_WEIGHT, v); }

    public static int getMinEnsembleSize() { return prefs.getInt(KEY_MIN_ENSEMBLE, 3); }
    public static void setMinEnsembleSize(int v) { prefs.putInt(KEY_MIN_ENSEMBLE, v); }

    public static double getSigmaClip() { return prefs.getDouble(KEY_SIGMA, 3.0); }
    public static void setSigmaClip(double v) { prefs.putDouble(KEY_SIGMA, v); }

    public static ClipStatistic getClipStatistic() {
        try {
            return ClipStatistic.valueOf(prefs.get(KEY_CLIP_STAT, ClipStatistic.NOISE_NORMALIZED.name()));
        } catch (IllegalArgumentException e) {
            return ClipStatistic.NOISE_NORMALIZED;
        }
    }
    public static void setClipStatistic(ClipStatistic v) { prefs.put(KEY_CLIP_STAT, v.name()); }

    public static double getMinCoverageFraction() { return prefs.getDouble(KEY_COVERAGE, 0.8); }
    public static void setMinCoverageFraction(double v) { prefs.putDouble(KEY_COVERAGE, v); }

    public static double getMaxMagnitudeError() { return prefs.getDouble(KEY_MAX_ERR, 0.5); }
    public static void setMaxMagnitudeError(double v) { prefs.putDouble(KEY_MAX_ERR, v); }

    /** CSV con coordenadas a excluir de las comparaciones; vacío = sin lista. */
    public static String getExclusionFile() { return prefs.get(KEY_EXCLUSION_FILE, ""); }
    public static void setExclusionFile(String v) { prefs.put(KEY_EXCLUSION_FILE, v); }

    public static int getMinUsableFrames() { return prefs.getInt(KEY_MIN_FRAMES, 3); }
    public static void setMinUsableFrames(int v) { prefs.putInt(KEY_MIN_FRAMES, v); }

    public static int getMinEnsemblePerFrame() { return prefs.getInt(KEY_MIN_PER_FRAME, 1); }
    public static void setMinEnsemblePerFrame(int v) { prefs.putInt(KEY_MIN_PER_FRAME, v); }

    public static double getOutlierSigma() { return prefs.getDouble(KEY_OUTLIER, 4.0); }
    public static void setOutlierSigma(double v) { prefs.putDouble(KEY_OUTLIER, v); }

    public static String getLastFolder() { return prefs.get(KEY_LAST_DIR, ""); }
    public static void setLastFolder(String v) { prefs.put(KEY_LAST_DIR, v); }

    public static String getLastObject() { return prefs.get(KEY_LAST_OBJECT, ""); }
    public static void setLastObject(String v) { prefs.put(KEY_LAST_OBJECT, v); }

    // Foto inmutable de las preferencias actuales para una corrida
    public static PhotometryConfig toPhotometryConfig(CelestialPoint target, List<CelestialPoint> excludedStars) {
        return PhotometryConfig.builder()
                .target(target)
                .positionMetric(getPositionMetric())
                .matchTolerance(getMatchTolerance())
                .magnitudeWeight(getMagnitudeWeight())
                .minEnsembleSize(getMinEnsembleSize())
                .sigmaClip(getSigmaClip())
                .clipStatistic(getClipStatistic())
                .minCoverageFraction(getMinCoverageFraction())
                .maxMagnitudeError(getMaxMagnitudeError())
                .minUsableFrames(getMinUsableFrames())
                .minEnsemblePerFrame(getMinEnsemblePerFrame())
                .outlierSigma(getOutlierSigma())
                .excludedStars(excludedStars)
                .build();
    }
}
