package io.orion.pms.backend.portfolio;

import io.orion.pms.backend.evm.HealthStatus;
import java.math.BigDecimal;

/**
 * Portfolio summary over all projects of a tenant.
 *
 * @param totalProjects every project passed in, including ones without data or with errors
 * @param onTrackCount projects classified ON_TRACK
 * @param atRiskCount projects classified AT_RISK
 * @param criticalCount projects classified CRITICAL
 * @param noDataCount projects without both indices
 * @param errorCount projects whose WBS could not be assembled
 * @param avgSPI unweighted mean SPI over classified projects, null when there are none
 * @param avgCPI unweighted mean CPI over classified projects, null when there are none
 * @param status portfolio-level status derived from the distribution of the three counts
 */
public record PortfolioRollup(
    int totalProjects,
    int onTrackCount,
    int atRiskCount,
    int criticalCount,
    int noDataCount,
    int errorCount,
    BigDecimal avgSPI,
    BigDecimal avgCPI,
    HealthStatus status) {}
