package com.selfplay.pipeline;

public record GameOutcome(String winner, double finalScore, boolean endedByResignation) {
}
