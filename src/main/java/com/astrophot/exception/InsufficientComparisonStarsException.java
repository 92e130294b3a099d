package com.astrophot.exception;

import com.astrophot.model.ComparisonEnsemble;

/**
 * Recuperable: lleva el ensemble de respaldo (todos los candidatos, pesos uniformes, marcado degradado).
 */
public class InsufficientComparisonStarsException extends PhotometryException {

    private final ComparisonEnsemble fallback;

    public InsufficientComparisonStarsException(int available, int required, ComparisonEnsemble fallback) {
        super("Solo " + available + " estrellas de comparación (mínimo " + required + ")");
        this.fallback = fallback;
    }

    public ComparisonEnsemble getFallback() {
        return fallback;
    }
}
