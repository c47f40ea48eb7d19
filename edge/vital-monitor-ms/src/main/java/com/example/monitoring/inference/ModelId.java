package com.example.monitoring.inference;

public enum ModelId {
    ARRHYTHMIA,
    ST_ELEVATION,
    BLOOD_PRESSURE,
    HYPOGLYCEMIA,
    SPO2,
    FALL,
    TROPONIN
}
