package com.selfplay.pipeline;

/**
 * One recorded position: the move played from it plus the policy and value targets the search produced.
 */
public record PositionRecord(int turn, String move, float[] policyTarget, float[] valueTarget) {
}
