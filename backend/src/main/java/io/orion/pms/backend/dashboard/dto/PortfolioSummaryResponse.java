package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.portfolio.PortfolioRollup;
import java.math.BigDecimal;
import java.util.List;

/**
 * Portfolio health card: counts by status, unweighted average indices, portfolio status and the
 * projects that failed to load.
 */
public record PortfolioSummaryResponse(
    int totalProjects,
    int onTrackCount,
    int atRiskCount,
    int criticalCount,
    int noDataCount,
    int errorCount,
    BigDecimal avgSPI,
    BigDecimal avgCPI,
    HealthStatus status,
    List<ProjectFailure> failedProjects) {

  public static PortfolioSummaryResponse from(
      PortfolioRollup rollup, List<ProjectFailure> failedProjects) {
    return new PortfolioSummaryResponse(
        rollup.totalProjects(),
        rollup.onTrackCount(),
        rollup.atRiskCount(),
        rollup.criticalCount(),
        rollup.noDataCount(),
        rollup.errorCount(),
        EvmRounding.index(rollup.avgSPI()),
        EvmRounding.index(rollup.avgCPI()),
        rollup.status(),
        List.copyOf(failedProjects));
  }
}
