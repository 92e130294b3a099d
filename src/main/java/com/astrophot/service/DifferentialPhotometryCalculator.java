package com.astrophot.service;

import com.astrophot.exception.InsufficientCoverageException;
import com.astrophot.model.ComparisonEnsemble;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.astrophot.model.GapReason;
import com.astrophot.model.LightCurve;
import com.astrophot.model.LightCurvePoint;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.QualityFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Curva de luz diferencial: objetivo menos ensemble, centrada en la mediana.
 * Los miembros ausentes en un frame se compensan renormalizando pesos y refiriendo cada
 * estrella a su magnitud media, de modo que una caída de miembro no mueve la curva.
 */
public class DifferentialPhotometryCalculator {

    private static final Logger log = LoggerFactory.getLogger(DifferentialPhotometryCalculator.class);

    // por debajo de esto la curva es plana salvo redondeo
    private static final double FLAT_CURVE_STD = 1e-12;

    public LightCurve calculate(MasterCatalog catalog, ComparisonEnsemble ensemble, PhotometryConfig cfg) {
        return calculate(catalog, catalog.target(), ensemble, cfg);
    }

    public LightCurve calculate(MasterCatalog catalog, MasterStar star, ComparisonEnsemble ensemble,
                                PhotometryConfig cfg) {
        // la propia estrella nunca se compara consigo misma
        List<MasterStar> members = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (ComparisonEnsemble.Member m : ensemble.members) {
            if (m.starId == star.id()) continue;
            members.add(catalog.star(m.starId));
            weights.add(m.weight);
        }
        double reference = 0, totalWeight = 0;
        for (int i = 0; i < members.size(); i++) {
            reference += weights.get(i) * members.get(i).meanMagnitude();
            totalWeight += weights.get(i);
        }
        if (totalWeight > 0) reference /= totalWeight;

        List<LightCurvePoint> raw = new ArrayList<>();
        List<LightCurve.Gap> gaps = new ArrayList<>();
        for (Frame frame : catalog.frames()) {
            Detection target = star.detection(frame.id).orElse(null);
            if (target == null) {
                gaps.add(new LightCurve.Gap(frame.id, frame.timestamp, GapReason.TARGET_MISSING));
                continue;
            }
            if (target.magnitudeError > cfg.maxMagnitudeError()) {
                gaps.add(new LightCurve.Gap(frame.id, frame.timestamp, GapReason.TARGET_ERROR_TOO_LARGE));
                continue;
            }

            // --- ENSEMBLE DEL FRAME ---
            double presentWeight = 0;
            int present = 0;
            for (int i = 0; i < members.size(); i++) {
                if (members.get(i).detection(frame.id).isPresent() && weights.get(i) > 0) {
                    presentWeight += weights.get(i);
                    present++;
                }
            }
            if (present < cfg.minEnsemblePerFrame() || presentWeight <= 0) {
                gaps.add(new LightCurve.Gap(frame.id, frame.timestamp, GapReason.ENSEMBLE_DROPOUT));
                continue;
            }
            double offset = 0, variance = 0;
            for (int i = 0; i < members.size(); i++) {
                Detection d = members.get(i).detection(frame.id).orElse(null);
                if (d == null || weights.get(i) <= 0) continue;
                double w = weights.get(i) / presentWeight;
                offset += w * (d.magnitude - members.get(i).meanMagnitude());
                variance += w * w * d.magnitudeError * d.magnitudeError;
            }
            double ensembleMag = reference + offset;
            double error = Math.sqrt(target.magnitudeError * target.magnitudeError + variance);

            QualityFlag flag = ensemble.degraded ? QualityFlag.DEGRADED_ENSEMBLE
                    : present < members.size() ? QualityFlag.PARTIAL_ENSEMBLE : QualityFlag.GOOD;
            raw.add(new LightCurvePoint(frame.timestamp, target.magnitude - ensembleMag, error, frame.id,
                    flag, target.magnitude, ensembleMag, present));
        }

        for (LightCurve.Gap g : gaps)
            log.debug("Estrella {}: hueco en {} ({})", star.id(), g.frameId, g.reason);
        if (raw.size() < cfg.minUsableFrames())
            throw new InsufficientCoverageException(raw.size(), cfg.minUsableFrames());

        // --- PUNTO CERO ---
        double[] diffs = new double[raw.size()];
        for (int i = 0; i < raw.size(); i++) diffs[i] = raw.get(i).differentialMagnitude;
        double zeroPoint = Stats.median(diffs);
        List<LightCurvePoint> points = new ArrayList<>(raw.size());
        for (LightCurvePoint p : raw) {
            points.add(new LightCurvePoint(p.timestamp, p.differentialMagnitude - zeroPoint, p.error,
                    p.frameId, p.flag, p.targetMagnitude, p.ensembleMagnitude, p.comparisonsUsed));
        }
        points = flagOutliers(points, cfg.outlierSigma());

        return new LightCurve(star.id(), points, zeroPoint, catalog.frames().size(), gaps);
    }

    // Rechazo iterativo a N sigma de la media; los puntos se marcan, no se borran
    static List<LightCurvePoint> flagOutliers(List<LightCurvePoint> points, double sigma) {
        if (sigma <= 0 || points.size() < 3) return points;
        boolean[] outlier = new boolean[points.size()];
        boolean changed = true;
        while (changed) {
            changed = false;
            double[] kept = new double[points.size()];
            for (int i = 0; i < points.size(); i++)
                kept[i] = outlier[i] ? Double.NaN : points.get(i).differentialMagnitude;
            double mean = Stats.mean(kept);
            double std = Stats.std(kept);
            if (!(std > FLAT_CURVE_STD)) break;
            for (int i = 0; i < points.size(); i++) {
                if (!outlier[i] && Math.abs(points.get(i).differentialMagnitude - mean) > sigma * std) {
                    outlier[i] = true;
                    changed = true;
                }
            }
        }
        List<LightCurvePoint> out = new ArrayList<>(points.size());
        int flagged = 0;
        for (int i = 0; i < points.size(); i++) {
            out.add(outlier[i] ? points.get(i).withFlag(QualityFlag.OUTLIER) : points.get(i));
            if (outlier[i]) flagged++;
        }
        if (flagged > 0) log.warn("{} puntos marcados como outlier (> {} sigma)", flagged, sigma);
        return out;
    }
}
