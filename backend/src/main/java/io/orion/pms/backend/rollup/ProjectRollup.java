package io.orion.pms.backend.rollup;

import io.orion.pms.backend.domain.DomainBucket;
import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.evm.MetricCalculator;
import java.util.List;

/**
 * Project-level result of a WBS rollup.
 *
 * @param projectId the project
 * @param leafCount number of WBS leaves summed
 * @param baseSnapshot component-wise sum over all WBS leaves
 * @param derived metrics derived from {@code baseSnapshot}
 * @param status project health
 * @param domains one bucket per EPCIC phase in canonical order; empty for a failed project
 */
public record ProjectRollup(
    String projectId,
    int leafCount,
    BaseSnapshot baseSnapshot,
    DerivedMetrics derived,
    HealthStatus status,
    List<DomainBucket> domains) {

  public ProjectRollup {
    domains = List.copyOf(domains);
  }

  /** Placeholder for a project whose WBS could not be assembled. */
  public static ProjectRollup failed(String projectId) {
    return new ProjectRollup(
        projectId,
        0,
        BaseSnapshot.ZERO,
        MetricCalculator.computeDerived(BaseSnapshot.ZERO),
        HealthStatus.ERROR,
        List.of());
  }
}
