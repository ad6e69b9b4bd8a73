package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.HealthStatus;
import java.math.BigDecimal;

/**
 * Gauge values for the project performance panel.
 *
 * @param spi schedule performance index
 * @param cpi cost performance index
 * @param healthScore 0-100 gauge score, null without both indices
 * @param sv schedule variance
 * @param cv cost variance
 * @param tcpi to-complete performance index
 * @param status project health
 */
public record PerformanceResponse(
    BigDecimal spi,
    BigDecimal cpi,
    Integer healthScore,
    BigDecimal sv,
    BigDecimal cv,
    BigDecimal tcpi,
    HealthStatus status) {}
