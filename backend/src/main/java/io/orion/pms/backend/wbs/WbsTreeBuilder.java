package io.orion.pms.backend.wbs;

import io.orion.pms.backend.exception.WbsIntegrityException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link WbsTree} from the flat parent-id list the data layer delivers.
 *
 * <p>Two passes: index every record by id, then attach children to parents in source order. Before
 * attaching, each record's ancestor chain is walked with a visited set. A record whose own parent
 * id does not resolve is an orphan; a chain that revisits a node marks the nodes of the loop as
 * cyclic. Descendants of an orphan and records that only lead into a loop are unreachable from a
 * root but are not reported themselves. Orphans are never re-homed under a root. Any orphan, cycle
 * or duplicate id fails the whole project with a {@link WbsIntegrityException}.
 */
public final class WbsTreeBuilder {

  private enum Reach {
    ROOTED,
    ORPHAN,
    CYCLE
  }

  private WbsTreeBuilder() {}

  /**
   * Assembles the tree for one project.
   *
   * @param projectId the owning project, carried into the tree and any integrity error
   * @param records flat WBS rows in source order
   * @return the assembled tree; empty when {@code records} is empty
   * @throws WbsIntegrityException when a parent is missing, a cycle exists or an id repeats
   */
  public static WbsTree build(String projectId, List<WbsRecord> records) {
    Map<String, WbsRecord> byId = new LinkedHashMap<>();
    List<String> duplicateIds = new ArrayList<>();
    for (WbsRecord record : records) {
      if (byId.putIfAbsent(record.id(), record) != null && !duplicateIds.contains(record.id())) {
        duplicateIds.add(record.id());
      }
    }

    Map<String, Reach> reach = new HashMap<>();
    Set<String> onCycle = new HashSet<>();
    for (String id : byId.keySet()) {
      resolveReach(id, byId, reach, onCycle);
    }

    List<String> orphanIds =
        byId.values().stream()
            .filter(r -> r.parentId() != null && !byId.containsKey(r.parentId()))
            .map(WbsRecord::id)
            .toList();
    List<String> cycleIds = byId.keySet().stream().filter(onCycle::contains).toList();
    if (!orphanIds.isEmpty() || !cycleIds.isEmpty() || !duplicateIds.isEmpty()) {
      throw new WbsIntegrityException(projectId, orphanIds, cycleIds, duplicateIds);
    }

    Map<String, List<String>> childIdsByParent = new HashMap<>();
    List<String> rootIds = new ArrayList<>();
    for (WbsRecord record : byId.values()) {
      if (record.parentId() == null) {
        rootIds.add(record.id());
      } else {
        childIdsByParent
            .computeIfAbsent(record.parentId(), key -> new ArrayList<>())
            .add(record.id());
      }
    }

    Map<String, Integer> levels = assignLevels(rootIds, childIdsByParent);

    Map<String, WbsNode> nodes = new LinkedHashMap<>();
    Set<String> expanded = new LinkedHashSet<>();
    for (WbsRecord record : byId.values()) {
      nodes.put(
          record.id(),
          new WbsNode(
              record.id(),
              record.parentId(),
              record.code(),
              record.epcCode(),
              record.name(),
              levels.get(record.id()),
              record.baseSnapshot(),
              childIdsByParent.getOrDefault(record.id(), List.of()),
              record.sapMapping()));
      if (record.expanded()) {
        expanded.add(record.id());
      }
    }
    return new WbsTree(projectId, rootIds, nodes, expanded);
  }

  /**
   * Walks the ancestor chain of {@code startId}, memoising the verdict for every node on it. When
   * the walk revisits a node, the ids from that node onwards form the loop and go into {@code
   * onCycle}.
   */
  private static void resolveReach(
      String startId, Map<String, WbsRecord> byId, Map<String, Reach> reach, Set<String> onCycle) {
    if (reach.containsKey(startId)) {
      return;
    }
    List<String> chain = new ArrayList<>();
    Set<String> visited = new LinkedHashSet<>();
    String current = startId;
    Reach verdict;
    while (true) {
      Reach known = reach.get(current);
      if (known != null) {
        verdict = known;
        break;
      }
      if (!visited.add(current)) {
        onCycle.addAll(chain.subList(chain.indexOf(current), chain.size()));
        verdict = Reach.CYCLE;
        break;
      }
      chain.add(current);
      String parentId = byId.get(current).parentId();
      if (parentId == null) {
        verdict = Reach.ROOTED;
        break;
      }
      if (!byId.containsKey(parentId)) {
        verdict = Reach.ORPHAN;
        break;
      }
      current = parentId;
    }
    for (String id : chain) {
      reach.put(id, verdict);
    }
  }

  private static Map<String, Integer> assignLevels(
      List<String> rootIds, Map<String, List<String>> childIdsByParent) {
    Map<String, Integer> levels = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String rootId : rootIds) {
      levels.put(rootId, 0);
      queue.add(rootId);
    }
    while (!queue.isEmpty()) {
      String id = queue.poll();
      int childLevel = levels.get(id) + 1;
      for (String childId : childIdsByParent.getOrDefault(id, List.of())) {
        levels.put(childId, childLevel);
        queue.add(childId);
      }
    }
    return levels;
  }
}
