package com.astrophot.model;

public enum GapReason { TARGET_MISSING, TARGET_ERROR_TOO_LARGE, ENSEMBLE_DROPOUT }
