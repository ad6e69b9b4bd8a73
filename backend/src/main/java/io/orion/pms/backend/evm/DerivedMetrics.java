package io.orion.pms.backend.evm;

import java.math.BigDecimal;

/**
 * Full EVM metric set derived from a {@link BaseSnapshot}. Values are kept at full precision;
 * rounding is applied only when a response is serialized.
 *
 * @param spi schedule performance index EV/PV, null when PV is zero
 * @param cpi cost performance index EV/AC, null when AC is zero
 * @param sv schedule variance EV - PV
 * @param cv cost variance EV - AC
 * @param eac estimate at completion BAC/CPI, or BAC when CPI is undefined or not positive
 * @param etc estimate to complete EAC - AC
 * @param vac variance at completion BAC - EAC
 * @param tcpi to-complete performance index (BAC - EV)/(BAC - AC), null when no budget remains
 * @param percentComplete EV/BAC as a whole percentage, 0 when BAC is zero
 */
public record DerivedMetrics(
    BigDecimal spi,
    BigDecimal cpi,
    BigDecimal sv,
    BigDecimal cv,
    BigDecimal eac,
    BigDecimal etc,
    BigDecimal vac,
    BigDecimal tcpi,
    int percentComplete) {}
