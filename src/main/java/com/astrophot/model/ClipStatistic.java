package com.astrophot.model;

/**
 * Criterio de rechazo del sigma-clipping de comparaciones.
 */
public enum ClipStatistic {
    /** RMS residual en unidades del ruido esperado; se rechaza si supera sigmaClip. */
    NOISE_NORMALIZED,
    /** Desviación residual; se rechaza si supera mediana + sigmaClip * 1.4826 * MAD del conjunto. */
    ROBUST_POPULATION
}
