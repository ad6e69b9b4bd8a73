package io.orion.pms.backend.wbs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable WBS hierarchy for one project, held as an arena of {@link WbsNode}s keyed by id. Child
 * order is the order in which records arrived from the source; the tree never re-sorts.
 *
 * <p>Instances are produced by {@link WbsTreeBuilder}, which guarantees that every parent reference
 * resolves, that there are no cycles, and that each node's level is its parent's level plus one.
 */
public final class WbsTree {

  private final String projectId;
  private final List<String> rootIds;
  private final Map<String, WbsNode> nodesById;
  private final Set<String> initiallyExpandedIds;

  WbsTree(
      String projectId,
      List<String> rootIds,
      Map<String, WbsNode> nodesById,
      Set<String> initiallyExpandedIds) {
    this.projectId = projectId;
    this.rootIds = List.copyOf(rootIds);
    this.nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
    this.initiallyExpandedIds =
        Collections.unmodifiableSet(new LinkedHashSet<>(initiallyExpandedIds));
  }

  public String projectId() {
    return projectId;
  }

  public int size() {
    return nodesById.size();
  }

  public boolean isEmpty() {
    return nodesById.isEmpty();
  }

  public boolean contains(String nodeId) {
    return nodesById.containsKey(nodeId);
  }

  public Optional<WbsNode> findNode(String nodeId) {
    return Optional.ofNullable(nodesById.get(nodeId));
  }

  public List<WbsNode> roots() {
    return rootIds.stream().map(nodesById::get).toList();
  }

  public List<WbsNode> children(WbsNode node) {
    return node.childIds().stream().map(nodesById::get).toList();
  }

  public boolean isLeaf(WbsNode node) {
    return node.childIds().isEmpty();
  }

  /** All nodes in source order. */
  public List<WbsNode> nodes() {
    return List.copyOf(nodesById.values());
  }

  /** Leaf nodes in depth-first display order. */
  public List<WbsNode> leaves() {
    List<WbsNode> leaves = new ArrayList<>();
    for (WbsNode root : roots()) {
      collectLeaves(root, leaves);
    }
    return leaves;
  }

  /**
   * Returns the ancestors of a node from its root down to and including the node itself, for
   * breadcrumb display.
   *
   * @param nodeId the target node
   * @return the path root to target, or an empty list when the node is not in this tree
   */
  public List<WbsNode> findPath(String nodeId) {
    WbsNode current = nodesById.get(nodeId);
    if (current == null) {
      return List.of();
    }
    List<WbsNode> path = new ArrayList<>();
    while (current != null) {
      path.add(current);
      current = current.parentId() != null ? nodesById.get(current.parentId()) : null;
    }
    Collections.reverse(path);
    return List.copyOf(path);
  }

  /** Ids flagged as expanded by the source data. */
  public Set<String> initiallyExpandedIds() {
    return initiallyExpandedIds;
  }

  private void collectLeaves(WbsNode node, List<WbsNode> leaves) {
    if (node.isLeaf()) {
      leaves.add(node);
      return;
    }
    for (WbsNode child : children(node)) {
      collectLeaves(child, leaves);
    }
  }
}
