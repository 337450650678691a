package com.pingpay.scheduler.service;

/**
 * Counts from one {@link QueueReconciler#reconcileAll()} pass.
 *
 * armed     - put back into the execution lane
 * parked    - moved into the dead-letter lane
 * unchanged - already in the right lane
 * unarmed   - no future run (finished one-shot jobs), left out of both lanes
 * orphans   - lane entries whose job row no longer exists, removed
 */
public record ReconcileReport(int armed, int parked, int unchanged, int unarmed, int orphans) {
}
