package com.astrophot.service;

import com.astrophot.exception.InsufficientComparisonStarsException;
import com.astrophot.model.ComparisonEnsemble;
import com.astrophot.model.Frame;
import com.astrophot.model.LightCurve;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PhotometryResult;
import com.astrophot.model.StarVariability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Encadena matching, selección de comparaciones y curva diferencial para un objetivo.
 * Sin estado entre corridas: cada llamada recibe su propia configuración.
 */
public class PhotometryPipeline {

    private static final Logger log = LoggerFactory.getLogger(PhotometryPipeline.class);

    private final StarMatcher matcher;
    private final ComparisonSelector selector;
    private final DifferentialPhotometryCalculator calculator;
    private final VariabilityAnalyzer variabilityAnalyzer;

    public PhotometryPipeline() {
        this(new StarMatcher(), new ComparisonSelector(), new DifferentialPhotometryCalculator());
    }

    public PhotometryPipeline(StarMatcher matcher, ComparisonSelector selector,
                              DifferentialPhotometryCalculator calculator) {
        this.matcher = matcher;
        this.selector = selector;
        this.calculator = calculator;
        this.variabilityAnalyzer = new VariabilityAnalyzer(calculator);
    }

    public PhotometryResult run(List<Frame> frames, PhotometryConfig cfg) {
        return run(frames, cfg, false);
    }

    public PhotometryResult run(List<Frame> frames, PhotometryConfig cfg, boolean surveyField) {
        log.info("Iniciando fotometría diferencial: {} frames, {}", frames.size(), cfg);

        MasterCatalog catalog = matcher.match(frames, cfg);

        ComparisonEnsemble ensemble;
        try {
            ensemble = selector.select(catalog, cfg);
        } catch (InsufficientComparisonStarsException e) {
            log.warn("{}. Se continúa con el ensemble degradado de {} estrellas", e.getMessage(),
                    e.getFallback().size());
            ensemble = e.getFallback();
        }

        LightCurve curve = calculator.calculate(catalog, ensemble, cfg);
        if (!curve.gaps.isEmpty())
            log.warn("Curva del objetivo con {} huecos sobre {} frames", curve.gaps.size(), curve.totalFrames);
        log.info("Curva de luz: {} puntos, punto cero {}", curve.size(), String.format("%.4f", curve.zeroPoint));

        List<StarVariability> variability = surveyField ? variabilityAnalyzer.analyze(catalog, ensemble, cfg) : List.of();
        return new PhotometryResult(catalog, ensemble, curve, variability);
    }
}
