package io.orion.pms.backend.evm;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps a pair of performance indices to a {@link HealthStatus}. Project, domain, WBS and portfolio
 * callers all go through this class so that every level shares the same thresholds.
 *
 * <p>Rules:
 *
 * <ol>
 *   <li>Either index missing -> NO_DATA
 *   <li>SPI >= 0.95 and CPI >= 0.95 -> ON_TRACK
 *   <li>SPI < 0.85 or CPI < 0.85 -> CRITICAL
 *   <li>Otherwise -> AT_RISK
 * </ol>
 */
public final class HealthClassifier {

  public static final BigDecimal ON_TRACK_THRESHOLD = new BigDecimal("0.95");
  public static final BigDecimal CRITICAL_THRESHOLD = new BigDecimal("0.85");

  private static final BigDecimal SCORE_WEIGHT = BigDecimal.valueOf(50);
  private static final BigDecimal SCORE_MAX = BigDecimal.valueOf(100);
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private HealthClassifier() {}

  /**
   * Classifies a pair of indices.
   *
   * @param spi schedule performance index, may be null
   * @param cpi cost performance index, may be null
   * @return the health status
   */
  public static HealthStatus classify(BigDecimal spi, BigDecimal cpi) {
    if (spi == null || cpi == null) {
      return HealthStatus.NO_DATA;
    }
    if (spi.compareTo(ON_TRACK_THRESHOLD) >= 0 && cpi.compareTo(ON_TRACK_THRESHOLD) >= 0) {
      return HealthStatus.ON_TRACK;
    }
    if (spi.compareTo(CRITICAL_THRESHOLD) < 0 || cpi.compareTo(CRITICAL_THRESHOLD) < 0) {
      return HealthStatus.CRITICAL;
    }
    return HealthStatus.AT_RISK;
  }

  public static HealthStatus classify(DerivedMetrics metrics) {
    return classify(metrics.spi(), metrics.cpi());
  }

  /**
   * Gauge score in [0, 100]: each index contributes {@code index * 50} clamped to [0, 100], and
   * the two contributions are averaged and rounded half-up.
   *
   * @return the score, or null when either index is missing
   */
  public static Integer healthScore(BigDecimal spi, BigDecimal cpi) {
    if (spi == null || cpi == null) {
      return null;
    }
    BigDecimal total = componentScore(spi).add(componentScore(cpi));
    return total.divide(TWO, 0, RoundingMode.HALF_UP).intValue();
  }

  private static BigDecimal componentScore(BigDecimal index) {
    BigDecimal score = index.multiply(SCORE_WEIGHT);
    if (score.signum() < 0) {
      return BigDecimal.ZERO;
    }
    return score.min(SCORE_MAX);
  }
}
