package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.rollup.ProjectRollup;
import java.math.BigDecimal;
import java.util.List;

/** Project totals rolled up from its WBS leaves, with per-phase breakdown. */
public record ProjectRollupResponse(
    String projectId,
    String projectName,
    int leafCount,
    BigDecimal pv,
    BigDecimal ev,
    BigDecimal ac,
    BigDecimal bac,
    MetricsResponse metrics,
    HealthStatus status,
    List<DomainResponse> domains) {

  public static ProjectRollupResponse from(ProjectRollup rollup, String projectName) {
    var base = rollup.baseSnapshot();
    return new ProjectRollupResponse(
        rollup.projectId(),
        projectName,
        rollup.leafCount(),
        EvmRounding.money(base.plannedValue()),
        EvmRounding.money(base.earnedValue()),
        EvmRounding.money(base.actualCost()),
        EvmRounding.money(base.budgetAtCompletion()),
        MetricsResponse.from(rollup.derived()),
        rollup.status(),
        rollup.domains().stream().map(DomainResponse::from).toList());
  }
}
