package com.example.monitoring.inference;

public record StElevationAssessment(boolean detected, double deviationMv) {}
