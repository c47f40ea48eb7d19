package com.example.monitoring.store;

public enum RecordType {
    VITAL_SIGNS("vital_signs"),
    BIOMARKERS("biomarkers"),
    ECG_WAVEFORM("ecg_waveform"),
    ALERT("critical_alerts"),
    EDGE_PREDICTION("edge_predictions");

    private final String category;

    RecordType(String category) {
        this.category = category;
    }

    /** Category name used on the wire and as associated data when sealing payloads. */
    public String category() {
        return category;
    }
}
