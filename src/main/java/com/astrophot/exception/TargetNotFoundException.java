package com.astrophot.exception;

public class TargetNotFoundException extends PhotometryException {

    private final double closestDistance;

    public TargetNotFoundException(String target, double closestDistance, double tolerance) {
        super(String.format("Objetivo %s sin estrella dentro de la tolerancia (más cercana a %.2f, tolerancia %.2f)",
                target, closestDistance, tolerance));
        this.closestDistance = closestDistance;
    }

    /** Distancia a la estrella más cercana; infinito si el catálogo no tiene posiciones comparables. */
    public double getClosestDistance() {
        return closestDistance;
    }
}
