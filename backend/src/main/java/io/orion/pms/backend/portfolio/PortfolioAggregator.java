package io.orion.pms.backend.portfolio;

import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.evm.MetricCalculator;
import io.orion.pms.backend.rollup.ProjectRollup;
import java.math.BigDecimal;
import java.util.List;

/**
 * Combines project rollups into a {@link PortfolioRollup}.
 *
 * <p>Average SPI and CPI are plain arithmetic means over the projects that have both indices; they
 * are not weighted by budget. A small on-track project therefore counts as much as a large late
 * one, so the averages can hide risk concentrated in the biggest projects. The CFO dashboard has
 * always shown the unweighted figure and this class reproduces it.
 */
public final class PortfolioAggregator {

  static final BigDecimal CRITICAL_SHARE_THRESHOLD = new BigDecimal("0.3");
  static final BigDecimal AT_RISK_SHARE_THRESHOLD = new BigDecimal("0.4");

  private PortfolioAggregator() {}

  /**
   * Aggregates project rollups.
   *
   * @param projects project results, possibly including NO_DATA and ERROR entries
   * @return the portfolio summary; averages are null when no project has both indices
   */
  public static PortfolioRollup aggregate(List<ProjectRollup> projects) {
    int onTrack = 0;
    int atRisk = 0;
    int critical = 0;
    int noData = 0;
    int error = 0;
    BigDecimal spiSum = BigDecimal.ZERO;
    BigDecimal cpiSum = BigDecimal.ZERO;
    int indexed = 0;

    for (ProjectRollup project : projects) {
      switch (project.status()) {
        case ON_TRACK -> onTrack++;
        case AT_RISK -> atRisk++;
        case CRITICAL -> critical++;
        case NO_DATA -> noData++;
        case ERROR -> error++;
      }
      if (project.status().isClassified()) {
        spiSum = spiSum.add(project.derived().spi());
        cpiSum = cpiSum.add(project.derived().cpi());
        indexed++;
      }
    }

    BigDecimal avgSpi = indexed > 0 ? mean(spiSum, indexed) : null;
    BigDecimal avgCpi = indexed > 0 ? mean(cpiSum, indexed) : null;
    return new PortfolioRollup(
        projects.size(),
        onTrack,
        atRisk,
        critical,
        noData,
        error,
        avgSpi,
        avgCpi,
        overallStatus(onTrack, atRisk, critical));
  }

  /**
   * Sums the base values of the given project snapshots. Only PV, EV, AC and BAC are added up; no
   * ratio is derived from the total.
   *
   * @param snapshots one snapshot per project, normally the latest
   * @return the component-wise total, {@link BaseSnapshot#ZERO} for no snapshots
   */
  public static BaseSnapshot totals(List<BaseSnapshot> snapshots) {
    return snapshots.stream().reduce(BaseSnapshot.ZERO, BaseSnapshot::plus);
  }

  /**
   * Portfolio status from the distribution of project statuses: CRITICAL when at least 30% of
   * classified projects are critical, AT_RISK when any is critical or at least 40% are at risk,
   * otherwise ON_TRACK. NO_DATA when no project is classified.
   */
  public static HealthStatus overallStatus(int onTrack, int atRisk, int critical) {
    int total = onTrack + atRisk + critical;
    if (total == 0) {
      return HealthStatus.NO_DATA;
    }
    BigDecimal criticalShare = share(critical, total);
    BigDecimal atRiskShare = share(atRisk, total);
    if (criticalShare.compareTo(CRITICAL_SHARE_THRESHOLD) >= 0) {
      return HealthStatus.CRITICAL;
    }
    if (critical > 0 || atRiskShare.compareTo(AT_RISK_SHARE_THRESHOLD) >= 0) {
      return HealthStatus.AT_RISK;
    }
    return HealthStatus.ON_TRACK;
  }

  private static BigDecimal mean(BigDecimal sum, int count) {
    return sum.divide(BigDecimal.valueOf(count), MetricCalculator.PRECISION);
  }

  private static BigDecimal share(int part, int total) {
    return BigDecimal.valueOf(part).divide(BigDecimal.valueOf(total), MetricCalculator.PRECISION);
  }
}
