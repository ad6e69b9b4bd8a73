package io.orion.pms.backend.dashboard;

import io.orion.pms.backend.dashboard.dto.DomainResponse;
import io.orion.pms.backend.dashboard.dto.PerformanceResponse;
import io.orion.pms.backend.dashboard.dto.ProjectRollupResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Project dashboard endpoints, computed from the project's WBS leaves. */
@RestController
@RequestMapping("/api/v1/project/{projectId}")
public class ProjectDashboardController {

  private final EvmDashboardService dashboardService;

  public ProjectDashboardController(EvmDashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  /**
   * Returns the project totals with derived metrics and the EPCIC breakdown. Responds 404 for an
   * unknown project and 422 when the WBS cannot be assembled.
   */
  @GetMapping("/rollup")
  public ResponseEntity<ProjectRollupResponse> getProjectRollup(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getProjectRollup(tenantId, mode, projectId).toResponse(tenantId);
  }

  @GetMapping("/domains")
  public ResponseEntity<List<DomainResponse>> getDomains(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getDomains(tenantId, mode, projectId).toResponse(tenantId);
  }

  @GetMapping("/performance")
  public ResponseEntity<PerformanceResponse> getPerformance(
      @PathVariable String projectId,
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getPerformance(tenantId, mode, projectId).toResponse(tenantId);
  }
}
