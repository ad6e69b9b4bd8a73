package io.orion.pms.backend.wbs;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expanded/selected state of a WBS tree view. Immutable: every operation returns a new state and
 * the caller swaps it in whole. Nothing in the rollup path reads or writes this state.
 *
 * @param expandedIds ids of expanded nodes
 * @param selectedId id of the selected node, null when nothing is selected
 */
public record TreeUiState(Set<String> expandedIds, String selectedId) {

  public TreeUiState {
    expandedIds =
        expandedIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(expandedIds));
  }

  public static TreeUiState empty() {
    return new TreeUiState(Set.of(), null);
  }

  /**
   * Initial state for a freshly loaded tree: the caller's ids that exist in the tree plus every
   * node the source flagged as expanded. Nothing is selected.
   */
  public static TreeUiState initial(WbsTree tree, Collection<String> initialExpandedIds) {
    Set<String> expanded = new LinkedHashSet<>();
    for (String id : initialExpandedIds) {
      if (tree.contains(id)) {
        expanded.add(id);
      }
    }
    expanded.addAll(tree.initiallyExpandedIds());
    return new TreeUiState(expanded, null);
  }

  /** Adds {@code nodeId} to the expanded set if absent, removes it if present. */
  public TreeUiState toggleExpanded(String nodeId) {
    Set<String> expanded = new LinkedHashSet<>(expandedIds);
    if (!expanded.remove(nodeId)) {
      expanded.add(nodeId);
    }
    return new TreeUiState(expanded, selectedId);
  }

  public TreeUiState select(String nodeId) {
    return new TreeUiState(expandedIds, nodeId);
  }

  /**
   * Selects the last node of a breadcrumb path and expands every ancestor before it so the node is
   * visible.
   *
   * @param path root-to-target path as returned by {@link WbsTree#findPath(String)}
   */
  public TreeUiState reveal(List<WbsNode> path) {
    if (path.isEmpty()) {
      return this;
    }
    Set<String> expanded = new LinkedHashSet<>(expandedIds);
    for (WbsNode ancestor : path.subList(0, path.size() - 1)) {
      expanded.add(ancestor.id());
    }
    return new TreeUiState(expanded, path.get(path.size() - 1).id());
  }

  public boolean isExpanded(String nodeId) {
    return expandedIds.contains(nodeId);
  }

  public boolean isSelected(String nodeId) {
    return selectedId != null && selectedId.equals(nodeId);
  }
}
