package com.example.monitoring.inference;

public record FallAssessment(boolean detected, double peakG) {}
