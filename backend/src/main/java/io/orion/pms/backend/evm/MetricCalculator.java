package io.orion.pms.backend.evm;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Derives the EVM metric set from a base cost/schedule tuple. Pure utility class with no Spring
 * dependencies; every call recomputes from its input.
 *
 * <p>Undefined ratios (division by a zero PV, AC or remaining budget) are returned as {@code null},
 * never coerced to 0 or 1.
 */
public final class MetricCalculator {

  /** Precision used for every division. Results are never rounded here. */
  public static final MathContext PRECISION = MathContext.DECIMAL128;

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private MetricCalculator() {}

  /**
   * Computes all derived metrics for a snapshot.
   *
   * @param base the raw PV/EV/AC/BAC values
   * @return the derived metrics
   */
  public static DerivedMetrics computeDerived(BaseSnapshot base) {
    BigDecimal pv = base.plannedValue();
    BigDecimal ev = base.earnedValue();
    BigDecimal ac = base.actualCost();
    BigDecimal bac = base.budgetAtCompletion();

    BigDecimal spi = pv.signum() > 0 ? ev.divide(pv, PRECISION) : null;
    BigDecimal cpi = ac.signum() > 0 ? ev.divide(ac, PRECISION) : null;
    BigDecimal sv = ev.subtract(pv);
    BigDecimal cv = ev.subtract(ac);

    // Without cost performance the budget itself is the forecast
    BigDecimal eac = cpi == null || cpi.signum() <= 0 ? bac : bac.divide(cpi, PRECISION);
    BigDecimal etc = eac.subtract(ac);
    BigDecimal vac = bac.subtract(eac);

    BigDecimal remainingBudget = bac.subtract(ac);
    BigDecimal tcpi =
        remainingBudget.signum() != 0 ? bac.subtract(ev).divide(remainingBudget, PRECISION) : null;

    return new DerivedMetrics(spi, cpi, sv, cv, eac, etc, vac, tcpi, percentComplete(ev, bac));
  }

  /** EV/BAC as a whole percentage, rounded half-up; 0 when there is no budget. */
  static int percentComplete(BigDecimal ev, BigDecimal bac) {
    if (bac.signum() <= 0) {
      return 0;
    }
    return ev.multiply(HUNDRED).divide(bac, 0, RoundingMode.HALF_UP).intValue();
  }
}
