package com.example.monitoring.store;

import com.example.monitoring.inference.HypoglycemiaRisk;
import java.time.Instant;

public record BiomarkerReading(
    Instant recordedAt,
    double glucoseMgDl,
    double glucoseTrend,
    HypoglycemiaRisk hypoglycemiaRisk,
    double troponinLevel,
    double cardiacRiskScore
) {}
