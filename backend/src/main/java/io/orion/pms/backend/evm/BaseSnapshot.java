package io.orion.pms.backend.evm;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Raw cost/schedule tuple for one WBS element, project or domain at a single as-of date. All
 * amounts are in the same currency.
 *
 * @param plannedValue budgeted cost of work scheduled to date (PV)
 * @param earnedValue budgeted cost of work performed to date (EV)
 * @param actualCost cost actually incurred to date (AC)
 * @param budgetAtCompletion total planned budget (BAC)
 */
public record BaseSnapshot(
    BigDecimal plannedValue,
    BigDecimal earnedValue,
    BigDecimal actualCost,
    BigDecimal budgetAtCompletion) {

  public static final BaseSnapshot ZERO =
      new BaseSnapshot(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

  public BaseSnapshot {
    Objects.requireNonNull(plannedValue, "plannedValue");
    Objects.requireNonNull(earnedValue, "earnedValue");
    Objects.requireNonNull(actualCost, "actualCost");
    Objects.requireNonNull(budgetAtCompletion, "budgetAtCompletion");
  }

  /** Builds a snapshot from nullable source columns, treating a missing amount as zero. */
  public static BaseSnapshot of(BigDecimal pv, BigDecimal ev, BigDecimal ac, BigDecimal bac) {
    return new BaseSnapshot(orZero(pv), orZero(ev), orZero(ac), orZero(bac));
  }

  public static BaseSnapshot of(long pv, long ev, long ac, long bac) {
    return new BaseSnapshot(
        BigDecimal.valueOf(pv),
        BigDecimal.valueOf(ev),
        BigDecimal.valueOf(ac),
        BigDecimal.valueOf(bac));
  }

  /** Component-wise sum. Ratios are never summed; only these four base values are. */
  public BaseSnapshot plus(BaseSnapshot other) {
    return new BaseSnapshot(
        plannedValue.add(other.plannedValue),
        earnedValue.add(other.earnedValue),
        actualCost.add(other.actualCost),
        budgetAtCompletion.add(other.budgetAtCompletion));
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
