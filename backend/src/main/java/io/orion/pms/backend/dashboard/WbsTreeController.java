package io.orion.pms.backend.dashboard;

import io.orion.pms.backend.dashboard.dto.BreadcrumbEntry;
import io.orion.pms.backend.dashboard.dto.TreeUiStateRequest;
import io.orion.pms.backend.dashboard.dto.WbsTreeResponse;
import io.orion.pms.backend.wbs.TreeUiState;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * WBS tree view endpoints. View state is held by the client and sent back with each interaction;
 * the server validates node ids against the project's tree and returns the next state.
 */
@RestController
@RequestMapping("/api/v1/project/{projectId}/wbs")
public class WbsTreeController {

  private final EvmDashboardService dashboardService;

  public WbsTreeController(EvmDashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  /**
   * Returns the nested tree with rollups on every node.
   *
   * @param expanded ids to expand initially, in addition to the ones the source marks expanded
   */
  @GetMapping
  public ResponseEntity<WbsTreeResponse> getWbsTree(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @RequestParam(required = false) List<String> expanded,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    List<String> initialExpanded = expanded != null ? expanded : List.of();
    return dashboardService
        .getWbsTree(tenantId, mode, projectId, initialExpanded)
        .toResponse(tenantId);
  }

  /** Breadcrumb from the root to the node. */
  @GetMapping("/{nodeId}/path")
  public ResponseEntity<List<BreadcrumbEntry>> getWbsPath(
      @PathVariable String projectId,
      @PathVariable String nodeId,
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getWbsPath(tenantId, mode, projectId, nodeId).toResponse(tenantId);
  }

  @PostMapping("/ui-state/toggle")
  public ResponseEntity<TreeUiState> toggle(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @Valid @RequestBody TreeUiStateRequest request,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService
        .toggleExpanded(tenantId, mode, projectId, request.currentState(), request.nodeId())
        .toResponse(tenantId);
  }

  /** Selects the node and expands its ancestors. */
  @PostMapping("/ui-state/select")
  public ResponseEntity<TreeUiState> select(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @Valid @RequestBody TreeUiStateRequest request,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService
        .select(tenantId, mode, projectId, request.currentState(), request.nodeId())
        .toResponse(tenantId);
  }
}
