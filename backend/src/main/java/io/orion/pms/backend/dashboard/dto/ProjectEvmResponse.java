package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.source.ProjectSnapshotRecord;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Latest EVM snapshot of one project with its derived metrics, for the EVM module table. */
public record ProjectEvmResponse(
    String projectId,
    String projectName,
    LocalDate snapshotDate,
    int percentComplete,
    BigDecimal bac,
    BigDecimal pv,
    BigDecimal ev,
    BigDecimal ac,
    BigDecimal sv,
    BigDecimal cv,
    BigDecimal vac,
    BigDecimal spi,
    BigDecimal cpi,
    BigDecimal tcpi,
    BigDecimal eac,
    BigDecimal etc,
    HealthStatus status) {

  public static ProjectEvmResponse from(
      ProjectSnapshotRecord snapshot, DerivedMetrics metrics, HealthStatus status) {
    var base = snapshot.baseSnapshot();
    return new ProjectEvmResponse(
        snapshot.projectId(),
        snapshot.projectName() != null ? snapshot.projectName() : "Unnamed Project",
        snapshot.snapshotDate(),
        metrics.percentComplete(),
        EvmRounding.money(base.budgetAtCompletion()),
        EvmRounding.money(base.plannedValue()),
        EvmRounding.money(base.earnedValue()),
        EvmRounding.money(base.actualCost()),
        EvmRounding.money(metrics.sv()),
        EvmRounding.money(metrics.cv()),
        EvmRounding.money(metrics.vac()),
        EvmRounding.index(metrics.spi()),
        EvmRounding.index(metrics.cpi()),
        EvmRounding.index(metrics.tcpi()),
        EvmRounding.money(metrics.eac()),
        EvmRounding.money(metrics.etc()),
        status);
  }
}
