package io.orion.pms.backend.domain;

import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthClassifier;
import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.evm.MetricCalculator;

/**
 * Summed base values of every WBS leaf in one project whose code maps to {@code domain}, with
 * metrics derived from that sum.
 *
 * @param domain the EPCIC phase
 * @param leafCount number of WBS leaves that contributed
 * @param baseSnapshot component-wise sum over the contributing leaves
 * @param derived metrics derived from {@code baseSnapshot}
 * @param status health of the bucket
 */
public record DomainBucket(
    DomainType domain,
    int leafCount,
    BaseSnapshot baseSnapshot,
    DerivedMetrics derived,
    HealthStatus status) {

  public static DomainBucket of(DomainType domain, int leafCount, BaseSnapshot sum) {
    if (leafCount == 0) {
      return new DomainBucket(
          domain, 0, sum, MetricCalculator.computeDerived(sum), HealthStatus.NO_DATA);
    }
    var derived = MetricCalculator.computeDerived(sum);
    return new DomainBucket(domain, leafCount, sum, derived, HealthClassifier.classify(derived));
  }
}
