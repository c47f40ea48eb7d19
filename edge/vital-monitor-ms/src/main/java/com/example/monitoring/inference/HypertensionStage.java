package com.example.monitoring.inference;

public enum HypertensionStage {
    NORMAL,
    ELEVATED,
    STAGE_1,
    STAGE_2,
    CRISIS;

    /** ACC/AHA 2017 office cut-offs, applied to an estimated reading. */
    public static HypertensionStage classify(int systolic, int diastolic) {
        if (systolic > 180 || diastolic > 120) return CRISIS;
        if (systolic >= 140 || diastolic >= 90) return STAGE_2;
        if (systolic >= 130 || diastolic >= 80) return STAGE_1;
        if (systolic >= 120) return ELEVATED;
        return NORMAL;
    }
}
