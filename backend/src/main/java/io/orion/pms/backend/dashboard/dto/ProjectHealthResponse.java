package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.HealthStatus;
import java.math.BigDecimal;

/** Row of the project health list. */
public record ProjectHealthResponse(
    String projectId,
    String projectName,
    int percentComplete,
    BigDecimal spi,
    BigDecimal cpi,
    HealthStatus status) {}
