package io.orion.pms.backend.dashboard.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Presentation rounding for EVM values. Applied only when building response records; the
 * calculators and rollups work at full precision.
 */
public final class EvmRounding {

  static final int INDEX_SCALE = 2;
  static final int MONEY_SCALE = 0;

  private EvmRounding() {}

  /** Rounds a performance index to two decimals, half-up. Null stays null. */
  public static BigDecimal index(BigDecimal value) {
    return value != null ? value.setScale(INDEX_SCALE, RoundingMode.HALF_UP) : null;
  }

  /** Rounds a monetary amount to whole currency units, half-up. Null stays null. */
  public static BigDecimal money(BigDecimal value) {
    return value != null ? value.setScale(MONEY_SCALE, RoundingMode.HALF_UP) : null;
  }
}
