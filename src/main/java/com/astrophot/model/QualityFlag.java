package com.astrophot.model;

public enum QualityFlag {
    GOOD,
    // faltan miembros del ensemble en este frame
    PARTIAL_ENSEMBLE,
    // la selección cayó al ensemble uniforme
    DEGRADED_ENSEMBLE,
    OUTLIER
}
