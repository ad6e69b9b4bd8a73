package io.orion.pms.backend.rollup;

import io.orion.pms.backend.domain.DomainBucket;
import io.orion.pms.backend.domain.DomainClassifier;
import io.orion.pms.backend.domain.DomainType;
import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthClassifier;
import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.evm.MetricCalculator;
import io.orion.pms.backend.wbs.WbsNode;
import io.orion.pms.backend.wbs.WbsTree;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls WBS leaf values up through the tree and into EPCIC domain buckets.
 *
 * <p>Only the four base values (PV, EV, AC, BAC) are ever summed. Indices and forecasts are derived
 * afresh from the sums at each reported level; child SPI/CPI values are never averaged, since an
 * unweighted mean over children with unequal budgets does not equal the parent's index.
 *
 * <p>An internal node's own source values are ignored: its contribution is the sum of the leaves
 * beneath it.
 */
public final class HierarchicalAggregator {

  private HierarchicalAggregator() {}

  /**
   * Rolls up a whole project.
   *
   * @param tree the project's WBS tree
   * @return the project rollup; all-zero with status NO_DATA when the tree has no leaves
   */
  public static ProjectRollup rollup(WbsTree tree) {
    List<WbsNode> leaves = tree.leaves();

    BaseSnapshot total = BaseSnapshot.ZERO;
    for (WbsNode leaf : leaves) {
      total = total.plus(leaf.baseSnapshot());
    }

    DerivedMetrics derived = MetricCalculator.computeDerived(total);
    HealthStatus status =
        leaves.isEmpty() ? HealthStatus.NO_DATA : HealthClassifier.classify(derived);
    return new ProjectRollup(
        tree.projectId(), leaves.size(), total, derived, status, domainBuckets(leaves));
  }

  /**
   * Rolls up every node of the tree in one post-order pass.
   *
   * @param tree the project's WBS tree
   * @return rollups keyed by node id, in source order
   */
  public static Map<String, NodeRollup> rollupNodes(WbsTree tree) {
    Map<String, NodeRollup> postOrder = new HashMap<>();
    for (WbsNode root : tree.roots()) {
      rollupNode(tree, root, postOrder);
    }
    Map<String, NodeRollup> byNodeId = new LinkedHashMap<>();
    for (WbsNode node : tree.nodes()) {
      byNodeId.put(node.id(), postOrder.get(node.id()));
    }
    return byNodeId;
  }

  /**
   * Sums the leaves into one bucket per EPCIC phase, grouping by each leaf's classification code
   * rather than by tree position. Every phase is present, in canonical order.
   */
  public static List<DomainBucket> domainBuckets(List<WbsNode> leaves) {
    Map<DomainType, BaseSnapshot> sums = new EnumMap<>(DomainType.class);
    Map<DomainType, Integer> counts = new EnumMap<>(DomainType.class);
    for (WbsNode leaf : leaves) {
      DomainType domain = DomainClassifier.classifyDomain(leaf.classificationCode());
      sums.merge(domain, leaf.baseSnapshot(), BaseSnapshot::plus);
      counts.merge(domain, 1, Integer::sum);
    }

    List<DomainBucket> buckets = new ArrayList<>();
    for (DomainType domain : DomainType.values()) {
      BaseSnapshot sum = sums.getOrDefault(domain, BaseSnapshot.ZERO);
      buckets.add(DomainBucket.of(domain, counts.getOrDefault(domain, 0), sum));
    }
    return List.copyOf(buckets);
  }

  private static NodeRollup rollupNode(
      WbsTree tree, WbsNode node, Map<String, NodeRollup> byNodeId) {
    BaseSnapshot sum;
    int leafCount;
    if (node.isLeaf()) {
      sum = node.baseSnapshot();
      leafCount = 1;
    } else {
      sum = BaseSnapshot.ZERO;
      leafCount = 0;
      for (WbsNode child : tree.children(node)) {
        NodeRollup childRollup = rollupNode(tree, child, byNodeId);
        sum = sum.plus(childRollup.baseSnapshot());
        leafCount += childRollup.leafCount();
      }
    }
    DerivedMetrics derived = MetricCalculator.computeDerived(sum);
    NodeRollup result =
        new NodeRollup(node.id(), leafCount, sum, derived, HealthClassifier.classify(derived));
    byNodeId.put(node.id(), result);
    return result;
  }
}
