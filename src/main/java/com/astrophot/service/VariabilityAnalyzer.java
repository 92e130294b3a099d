package com.astrophot.service;

import com.astrophot.exception.InsufficientCoverageException;
import com.astrophot.model.ComparisonEnsemble;
import com.astrophot.model.LightCurve;
import com.astrophot.model.LightCurvePoint;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.QualityFlag;
import com.astrophot.model.StarVariability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Relevamiento de variabilidad del campo: curva diferencial de cada estrella contra el
 * ensemble, sin outliers, resumida en mediana y desviación estándar.
 */
public class VariabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(VariabilityAnalyzer.class);

    private final DifferentialPhotometryCalculator calculator;

    public VariabilityAnalyzer() {
        this(new DifferentialPhotometryCalculator());
    }

    public VariabilityAnalyzer(DifferentialPhotometryCalculator calculator) {
        this.calculator = calculator;
    }

    public List<StarVariability> analyze(MasterCatalog catalog, ComparisonEnsemble ensemble, PhotometryConfig cfg) {
        List<MasterStar> stars = new ArrayList<>(catalog.stars());
        stars.sort(Comparator.comparingInt(MasterStar::id));

        List<StarVariability> out = new ArrayList<>();
        int skipped = 0;
        for (MasterStar star : stars) {
            if (star.coverage() < cfg.minObservations()) { skipped++; continue; }
            LightCurve curve;
            try {
                curve = calculator.calculate(catalog, star, ensemble, cfg);
            } catch (InsufficientCoverageException e) {
                log.debug("Estrella {} sin cobertura suficiente: {}", star.id(), e.getMessage());
                skipped++;
                continue;
            }
            List<Double> values = new ArrayList<>();
            for (LightCurvePoint p : curve.points)
                if (p.flag != QualityFlag.OUTLIER) values.add(p.differentialMagnitude);
            if (values.size() < cfg.minObservations()) { skipped++; continue; }

            double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
            out.add(new StarVariability(star.id(), star.ra(), star.dec(), Stats.median(values), Stats.std(arr),
                    values.size()));
        }
        log.info("Variabilidad: {} estrellas analizadas, {} sin observaciones suficientes", out.size(), skipped);
        return out;
    }
}
