package com.example.monitoring.inference;

public record Spo2Assessment(Spo2AlertLevel level, double mean, double min) {}
