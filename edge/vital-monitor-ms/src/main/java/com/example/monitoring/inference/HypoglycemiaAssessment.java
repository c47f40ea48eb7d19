package com.example.monitoring.inference;

/**
 * @param currentMgDl latest glucose reading, {@code NaN} when no reading was available
 * @param trend       last minus first of the evaluated window
 * @param rate        mean successive difference of the evaluated window
 */
public record HypoglycemiaAssessment(HypoglycemiaRisk risk, double currentMgDl, double trend, double rate) {}
