package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.domain.DomainBucket;
import io.orion.pms.backend.domain.DomainType;
import io.orion.pms.backend.evm.HealthStatus;
import java.math.BigDecimal;

/** EPCIC phase progress for the project dashboard. */
public record DomainResponse(
    DomainType domain,
    String label,
    int leafCount,
    BigDecimal plannedValue,
    BigDecimal earnedValue,
    BigDecimal actualCost,
    BigDecimal budgetAtCompletion,
    int percentComplete,
    BigDecimal spi,
    BigDecimal cpi,
    HealthStatus status) {

  public static DomainResponse from(DomainBucket bucket) {
    var base = bucket.baseSnapshot();
    var derived = bucket.derived();
    return new DomainResponse(
        bucket.domain(),
        bucket.domain().label(),
        bucket.leafCount(),
        EvmRounding.money(base.plannedValue()),
        EvmRounding.money(base.earnedValue()),
        EvmRounding.money(base.actualCost()),
        EvmRounding.money(base.budgetAtCompletion()),
        derived.percentComplete(),
        EvmRounding.index(derived.spi()),
        EvmRounding.index(derived.cpi()),
        bucket.status());
  }
}
