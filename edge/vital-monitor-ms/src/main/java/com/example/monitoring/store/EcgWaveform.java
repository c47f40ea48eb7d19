package com.example.monitoring.store;

import java.time.Instant;

public record EcgWaveform(Instant capturedAt, double sampleRate, float[] samples, double arrhythmiaConfidence) {}
