package com.astrophot.model;

public class StarVariability {
    public final int starId;
    public final double ra;
    public final double dec;
    public final double medianMagnitude; // mediana de la curva diferencial
    public final double standardDeviation;
    public final int observations;

    public StarVariability(int starId, double ra, double dec, double medianMagnitude, double standardDeviation,
                           int observations) {
        this.starId = starId;
        this.ra = ra;
        this.dec = dec;
        this.medianMagnitude = medianMagnitude;
        this.standardDeviation = standardDeviation;
        this.observations = observations;
    }
}
