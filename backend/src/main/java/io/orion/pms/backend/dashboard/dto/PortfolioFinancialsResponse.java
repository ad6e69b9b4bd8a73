package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.BaseSnapshot;
import java.math.BigDecimal;

/**
 * Portfolio money totals over the latest snapshot of every project, for the finance overview.
 *
 * @param projectCount projects that contributed a snapshot
 * @param totalPv summed planned value
 * @param totalEv summed earned value
 * @param totalAc summed actual cost
 * @param totalBac summed budget at completion
 */
public record PortfolioFinancialsResponse(
    int projectCount,
    BigDecimal totalPv,
    BigDecimal totalEv,
    BigDecimal totalAc,
    BigDecimal totalBac) {

  public static PortfolioFinancialsResponse from(int projectCount, BaseSnapshot totals) {
    return new PortfolioFinancialsResponse(
        projectCount,
        EvmRounding.money(totals.plannedValue()),
        EvmRounding.money(totals.earnedValue()),
        EvmRounding.money(totals.actualCost()),
        EvmRounding.money(totals.budgetAtCompletion()));
  }
}
