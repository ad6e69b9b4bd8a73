package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.DerivedMetrics;
import java.math.BigDecimal;

/** Rounded derived metrics. Indices that are undefined are serialized as null. */
public record MetricsResponse(
    BigDecimal spi,
    BigDecimal cpi,
    BigDecimal sv,
    BigDecimal cv,
    BigDecimal eac,
    BigDecimal etc,
    BigDecimal vac,
    BigDecimal tcpi,
    int percentComplete) {

  public static MetricsResponse from(DerivedMetrics metrics) {
    return new MetricsResponse(
        EvmRounding.index(metrics.spi()),
        EvmRounding.index(metrics.cpi()),
        EvmRounding.money(metrics.sv()),
        EvmRounding.money(metrics.cv()),
        EvmRounding.money(metrics.eac()),
        EvmRounding.money(metrics.etc()),
        EvmRounding.money(metrics.vac()),
        EvmRounding.index(metrics.tcpi()),
        metrics.percentComplete());
  }
}
