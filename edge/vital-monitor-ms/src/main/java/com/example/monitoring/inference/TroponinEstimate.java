package com.example.monitoring.inference;

/**
 * @param level  troponin proxy in ng/L
 * @param miRisk probability-like score in [0, 1]
 */
public record TroponinEstimate(double level, double miRisk) {}
