package com.astrophot.model;

public class LightCurvePoint {
    public final double timestamp;
    public final double differentialMagnitude; // ya centrada en el punto cero
    public final double error;
    public final String frameId;
    public final QualityFlag flag;
    public final double targetMagnitude;
    public final double ensembleMagnitude;
    public final int comparisonsUsed;

    public LightCurvePoint(double timestamp, double differentialMagnitude, double error, String frameId,
                           QualityFlag flag, double targetMagnitude, double ensembleMagnitude, int comparisonsUsed) {
        this.timestamp = timestamp;
        this.differentialMagnitude = differentialMagnitude;
        this.error = error;
        this.frameId = frameId;
        this.flag = flag;
        this.targetMagnitude = targetMagnitude;
        this.ensembleMagnitude = ensembleMagnitude;
        this.comparisonsUsed = comparisonsUsed;
    }

    public LightCurvePoint withFlag(QualityFlag newFlag) {
        return new LightCurvePoint(timestamp, differentialMagnitude, error, frameId, newFlag,
                targetMagnitude, ensembleMagnitude, comparisonsUsed);
    }
}
