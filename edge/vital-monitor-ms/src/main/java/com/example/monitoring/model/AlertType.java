package com.example.monitoring.model;

public enum AlertType {
    CARDIAC,
    GLUCOSE,
    RESPIRATORY,
    FALL,
    MEDICATION
}
