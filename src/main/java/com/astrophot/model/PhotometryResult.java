package com.astrophot.model;

import java.util.List;

public class PhotometryResult {
    public final MasterCatalog catalog;
    public final ComparisonEnsemble ensemble;
    public final LightCurve lightCurve;

    // Relevamiento del campo; vacío si no se pidió
    public final List<StarVariability> variability;

    public PhotometryResult(MasterCatalog catalog, ComparisonEnsemble ensemble, LightCurve lightCurve,
                            List<StarVariability> variability) {
        this.catalog = catalog;
        this.ensemble = ensemble;
        this.lightCurve = lightCurve;
        this.variability = List.copyOf(variability);
    }

    public boolean isDegraded() {
        return ensemble.degraded;
    }
}
