package io.orion.pms.backend.dashboard;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.orion.pms.backend.config.OrionProperties;
import io.orion.pms.backend.dashboard.dto.BreadcrumbEntry;
import io.orion.pms.backend.dashboard.dto.DomainResponse;
import io.orion.pms.backend.dashboard.dto.EvmRounding;
import io.orion.pms.backend.dashboard.dto.MetricsResponse;
import io.orion.pms.backend.dashboard.dto.PerformanceResponse;
import io.orion.pms.backend.dashboard.dto.PortfolioFinancialsResponse;
import io.orion.pms.backend.dashboard.dto.PortfolioSummaryResponse;
import io.orion.pms.backend.dashboard.dto.ProjectEvmResponse;
import io.orion.pms.backend.dashboard.dto.ProjectFailure;
import io.orion.pms.backend.dashboard.dto.ProjectHealthResponse;
import io.orion.pms.backend.dashboard.dto.ProjectRollupResponse;
import io.orion.pms.backend.dashboard.dto.WbsNodeResponse;
import io.orion.pms.backend.dashboard.dto.WbsTreeResponse;
import io.orion.pms.backend.evm.BaseSnapshot;
import io.orion.pms.backend.evm.DerivedMetrics;
import io.orion.pms.backend.evm.HealthClassifier;
import io.orion.pms.backend.evm.MetricCalculator;
import io.orion.pms.backend.exception.ResourceNotFoundException;
import io.orion.pms.backend.exception.WbsIntegrityException;
import io.orion.pms.backend.portfolio.PortfolioAggregator;
import io.orion.pms.backend.rollup.HierarchicalAggregator;
import io.orion.pms.backend.rollup.NodeRollup;
import io.orion.pms.backend.rollup.ProjectRollup;
import io.orion.pms.backend.source.DataMode;
import io.orion.pms.backend.source.EvmRecordSource;
import io.orion.pms.backend.source.EvmRecordSources;
import io.orion.pms.backend.source.ProjectRef;
import io.orion.pms.backend.source.ProjectSnapshotRecord;
import io.orion.pms.backend.wbs.TreeUiState;
import io.orion.pms.backend.wbs.WbsNode;
import io.orion.pms.backend.wbs.WbsRecord;
import io.orion.pms.backend.wbs.WbsTree;
import io.orion.pms.backend.wbs.WbsTreeBuilder;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the EVM dashboards from raw records: project snapshot tables, WBS and domain rollups,
 * portfolio health and tree view state. Every figure is derived on read from the records the
 * selected {@link EvmRecordSource} returns.
 *
 * <p>Project rollups are cached in Caffeine keyed by the project id and the full list of WBS
 * records, so a cached entry is only reused for identical input. There is no time-based expiry.
 */
@Service
public class EvmDashboardService {

  private static final Logger log = LoggerFactory.getLogger(EvmDashboardService.class);

  static final int DEFAULT_HEALTH_LIMIT = 6;

  private static final Comparator<BigDecimal> NULLS_LAST =
      Comparator.nullsLast(Comparator.naturalOrder());

  private final EvmRecordSources sources;
  private final Cache<RollupKey, ProjectRollup> rollupCache;

  public EvmDashboardService(EvmRecordSources sources, OrionProperties properties) {
    this.sources = sources;
    this.rollupCache =
        Caffeine.newBuilder().maximumSize(properties.rollupCache().maximumSize()).build();
  }

  // --- Portfolio-level endpoints ---

  /**
   * Returns the latest snapshot of every project (newest {@code snapshotDate} wins) with derived
   * metrics and status.
   */
  public Sourced<List<ProjectEvmResponse>> getProjectSnapshots(String tenantId, DataMode mode) {
    EvmRecordSource source = sources.resolve(mode);
    List<ProjectEvmResponse> projects =
        latestSnapshots(source, tenantId).stream()
            .map(
                snapshot -> {
                  DerivedMetrics metrics = MetricCalculator.computeDerived(snapshot.baseSnapshot());
                  return ProjectEvmResponse.from(
                      snapshot, metrics, HealthClassifier.classify(metrics));
                })
            .toList();
    return Sourced.of(projects, source);
  }

  /**
   * Sums PV, EV, AC and BAC over the latest snapshot of every project. Commitments and revenue
   * come from the finance system and are not part of the EVM records.
   */
  public Sourced<PortfolioFinancialsResponse> getPortfolioFinancials(
      String tenantId, DataMode mode) {
    EvmRecordSource source = sources.resolve(mode);
    List<BaseSnapshot> latest =
        latestSnapshots(source, tenantId).stream()
            .map(ProjectSnapshotRecord::baseSnapshot)
            .toList();
    var financials =
        PortfolioFinancialsResponse.from(latest.size(), PortfolioAggregator.totals(latest));
    return Sourced.of(financials, source);
  }

  /**
   * Rolls every project of the tenant up from its WBS and combines the results. A project whose WBS
   * fails integrity checks is counted as an error and listed in {@code failedProjects}; the rest of
   * the portfolio is still reported.
   */
  public Sourced<PortfolioSummaryResponse> getPortfolioSummary(String tenantId, DataMode mode) {
    EvmRecordSource source = sources.resolve(mode);
    List<ProjectFailure> failures = new ArrayList<>();
    List<ProjectRollup> rollups = new ArrayList<>();
    for (ProjectRef project : source.findProjects(tenantId)) {
      rollups.add(rollupOrFailure(source, tenantId, project, failures));
    }
    var summary = PortfolioAggregator.aggregate(rollups);
    return Sourced.of(PortfolioSummaryResponse.from(summary, failures), source);
  }

  /**
   * Returns project health rows ordered by SPI ascending (worst schedule first), projects
   * without an SPI last.
   *
   * @param limit maximum number of rows, or null for {@value #DEFAULT_HEALTH_LIMIT}
   */
  public Sourced<List<ProjectHealthResponse>> getProjectHealthList(
      String tenantId, DataMode mode, Integer limit) {
    EvmRecordSource source = sources.resolve(mode);
    Map<ProjectRef, ProjectRollup> rollups = new LinkedHashMap<>();
    for (ProjectRef project : source.findProjects(tenantId)) {
      rollups.put(project, rollupOrFailure(source, tenantId, project, new ArrayList<>()));
    }
    List<ProjectHealthResponse> result =
        rollups.entrySet().stream()
            .sorted(
                Comparator.comparing(
                    (Map.Entry<ProjectRef, ProjectRollup> e) -> e.getValue().derived().spi(),
                    NULLS_LAST))
            .limit(limit != null ? limit : DEFAULT_HEALTH_LIMIT)
            .map(e -> toHealthRow(e.getKey(), e.getValue()))
            .toList();
    return Sourced.of(result, source);
  }

  // --- Project-scoped endpoints ---

  public Sourced<ProjectRollupResponse> getProjectRollup(
      String tenantId, DataMode mode, String projectId) {
    EvmRecordSource source = sources.resolve(mode);
    ProjectRef project = requireProject(source, tenantId, projectId);
    ProjectRollup rollup = rollup(projectId, source.findWbsRecords(tenantId, projectId));
    return Sourced.of(ProjectRollupResponse.from(rollup, project.projectName()), source);
  }

  /** Returns the five EPCIC phase buckets of a project in canonical order. */
  public Sourced<List<DomainResponse>> getDomains(
      String tenantId, DataMode mode, String projectId) {
    EvmRecordSource source = sources.resolve(mode);
    requireProject(source, tenantId, projectId);
    ProjectRollup rollup = rollup(projectId, source.findWbsRecords(tenantId, projectId));
    return Sourced.of(rollup.domains().stream().map(DomainResponse::from).toList(), source);
  }

  public Sourced<PerformanceResponse> getPerformance(
      String tenantId, DataMode mode, String projectId) {
    EvmRecordSource source = sources.resolve(mode);
    requireProject(source, tenantId, projectId);
    ProjectRollup rollup = rollup(projectId, source.findWbsRecords(tenantId, projectId));
    DerivedMetrics derived = rollup.derived();
    var performance =
        new PerformanceResponse(
            EvmRounding.index(derived.spi()),
            EvmRounding.index(derived.cpi()),
            HealthClassifier.healthScore(derived.spi(), derived.cpi()),
            EvmRounding.money(derived.sv()),
            EvmRounding.money(derived.cv()),
            EvmRounding.index(derived.tcpi()),
            rollup.status());
    return Sourced.of(performance, source);
  }

  // --- WBS tree endpoints ---

  /**
   * Returns the nested WBS tree with a rollup on every node and the initial view state.
   *
   * @param initialExpandedIds ids the client wants expanded; unknown ids are ignored
   */
  public Sourced<WbsTreeResponse> getWbsTree(
      String tenantId, DataMode mode, String projectId, Collection<String> initialExpandedIds) {
    EvmRecordSource source = sources.resolve(mode);
    WbsTree tree = loadTree(source, tenantId, projectId);
    Map<String, NodeRollup> rollups = HierarchicalAggregator.rollupNodes(tree);
    TreeUiState state = TreeUiState.initial(tree, initialExpandedIds);

    List<WbsNodeResponse> nodes =
        tree.roots().stream().map(root -> toNodeResponse(tree, root, rollups, state)).toList();
    return Sourced.of(new WbsTreeResponse(projectId, tree.size(), state, nodes), source);
  }

  /** Returns the breadcrumb from the root down to {@code nodeId}. */
  public Sourced<List<BreadcrumbEntry>> getWbsPath(
      String tenantId, DataMode mode, String projectId, String nodeId) {
    EvmRecordSource source = sources.resolve(mode);
    WbsTree tree = loadTree(source, tenantId, projectId);
    List<WbsNode> path = requirePath(tree, nodeId);
    return Sourced.of(path.stream().map(BreadcrumbEntry::from).toList(), source);
  }

  public Sourced<TreeUiState> toggleExpanded(
      String tenantId, DataMode mode, String projectId, TreeUiState state, String nodeId) {
    EvmRecordSource source = sources.resolve(mode);
    WbsTree tree = loadTree(source, tenantId, projectId);
    requirePath(tree, nodeId);
    return Sourced.of(state.toggleExpanded(nodeId), source);
  }

  /** Selects a node and expands all of its ancestors. */
  public Sourced<TreeUiState> select(
      String tenantId, DataMode mode, String projectId, TreeUiState state, String nodeId) {
    EvmRecordSource source = sources.resolve(mode);
    WbsTree tree = loadTree(source, tenantId, projectId);
    return Sourced.of(state.reveal(requirePath(tree, nodeId)), source);
  }

  // --- Internals ---

  ProjectRollup rollup(String projectId, List<WbsRecord> records) {
    return rollupCache.get(
        new RollupKey(projectId, List.copyOf(records)),
        key -> HierarchicalAggregator.rollup(WbsTreeBuilder.build(key.projectId(), key.records())));
  }

  private static List<ProjectSnapshotRecord> latestSnapshots(
      EvmRecordSource source, String tenantId) {
    Map<String, ProjectSnapshotRecord> latest = new LinkedHashMap<>();
    for (ProjectSnapshotRecord snapshot : source.findProjectSnapshots(tenantId)) {
      latest.merge(snapshot.projectId(), snapshot, EvmDashboardService::newer);
    }
    return List.copyOf(latest.values());
  }

  private ProjectRollup rollupOrFailure(
      EvmRecordSource source, String tenantId, ProjectRef project, List<ProjectFailure> failures) {
    try {
      return rollup(project.projectId(), source.findWbsRecords(tenantId, project.projectId()));
    } catch (WbsIntegrityException e) {
      log.warn(
          "Excluding project from portfolio: tenant={}, project={}, reason={}",
          tenantId,
          project.projectId(),
          e.getMessage());
      failures.add(
          new ProjectFailure(
              project.projectId(),
              project.projectName(),
              e.getOrphanIds(),
              e.getCycleIds(),
              e.getDuplicateIds()));
      return ProjectRollup.failed(project.projectId());
    }
  }

  private static ProjectHealthResponse toHealthRow(ProjectRef project, ProjectRollup rollup) {
    return new ProjectHealthResponse(
        project.projectId(),
        project.projectName(),
        rollup.derived().percentComplete(),
        EvmRounding.index(rollup.derived().spi()),
        EvmRounding.index(rollup.derived().cpi()),
        rollup.status());
  }

  private WbsTree loadTree(EvmRecordSource source, String tenantId, String projectId) {
    requireProject(source, tenantId, projectId);
    return WbsTreeBuilder.build(projectId, source.findWbsRecords(tenantId, projectId));
  }

  private ProjectRef requireProject(EvmRecordSource source, String tenantId, String projectId) {
    return source.findProjects(tenantId).stream()
        .filter(p -> p.projectId().equals(projectId))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  private static List<WbsNode> requirePath(WbsTree tree, String nodeId) {
    List<WbsNode> path = tree.findPath(nodeId);
    if (path.isEmpty()) {
      throw new ResourceNotFoundException("WBS element", nodeId);
    }
    return path;
  }

  private static WbsNodeResponse toNodeResponse(
      WbsTree tree, WbsNode node, Map<String, NodeRollup> rollups, TreeUiState state) {
    NodeRollup rollup = rollups.get(node.id());
    var base = rollup.baseSnapshot();
    List<WbsNodeResponse> children =
        tree.children(node).stream()
            .map(child -> toNodeResponse(tree, child, rollups, state))
            .toList();
    return new WbsNodeResponse(
        node.id(),
        node.parentId(),
        node.code(),
        node.name(),
        node.level(),
        node.isLeaf(),
        rollup.leafCount(),
        EvmRounding.money(base.plannedValue()),
        EvmRounding.money(base.earnedValue()),
        EvmRounding.money(base.actualCost()),
        EvmRounding.money(base.budgetAtCompletion()),
        MetricsResponse.from(rollup.derived()),
        rollup.status(),
        node.sapMapped(),
        node.sapMapping(),
        state.isExpanded(node.id()),
        state.isSelected(node.id()),
        children);
  }

  private static ProjectSnapshotRecord newer(ProjectSnapshotRecord a, ProjectSnapshotRecord b) {
    LocalDate dateA = a.snapshotDate();
    LocalDate dateB = b.snapshotDate();
    if (dateA == null) {
      return b;
    }
    if (dateB == null) {
      return a;
    }
    return dateB.isAfter(dateA) ? b : a;
  }

  record RollupKey(String projectId, List<WbsRecord> records) {}
}
