package com.evedmv.analysis.pool;

/** Outcome of one autoscaler evaluation. */
public enum ScalingDecision {
  UP,
  DOWN,
  NONE
}
