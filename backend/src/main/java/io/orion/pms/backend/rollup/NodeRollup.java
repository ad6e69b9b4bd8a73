package io.orion.pms.backend.rollup;

import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthStatus;

/**
 * Rolled-up values for a single WBS node: its own snapshot when it is a leaf, otherwise the sum
 * over all leaves beneath it.
 */
public record NodeRollup(
    String nodeId,
    int leafCount,
    BaseSnapshot baseSnapshot,
    DerivedMetrics derived,
    HealthStatus status) {}
