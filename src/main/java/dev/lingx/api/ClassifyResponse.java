package dev.lingx.api;

import dev.lingx.quality.QualityDecision;

public record ClassifyResponse(int score, QualityDecision decision) {}
