package io.orion.pms.backend.dashboard;

import io.orion.pms.backend.dashboard.dto.PortfolioFinancialsResponse;
import io.orion.pms.backend.dashboard.dto.PortfolioSummaryResponse;
import io.orion.pms.backend.dashboard.dto.ProjectEvmResponse;
import io.orion.pms.backend.dashboard.dto.ProjectHealthResponse;
import io.orion.pms.backend.exception.InvalidRequestException;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Portfolio-level EVM endpoints. Every endpoint takes the tenant as a query parameter and the data
 * mode from the {@code X-Data-Mode} header or {@code dataMode} parameter.
 */
@RestController
@RequestMapping("/api/v1")
public class PortfolioDashboardController {

  private final EvmDashboardService dashboardService;

  public PortfolioDashboardController(EvmDashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  /** Latest snapshot per project with derived metrics, for the EVM module table. */
  @GetMapping("/evm/projects")
  public ResponseEntity<List<ProjectEvmResponse>> getProjectSnapshots(
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getProjectSnapshots(tenantId, mode).toResponse(tenantId);
  }

  /** Portfolio health card: status counts, average indices and overall status. */
  @GetMapping("/portfolio/summary")
  public ResponseEntity<PortfolioSummaryResponse> getPortfolioSummary(
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getPortfolioSummary(tenantId, mode).toResponse(tenantId);
  }

  /** Summed PV, EV, AC and BAC over the latest snapshot of every project. */
  @GetMapping("/portfolio/financials")
  public ResponseEntity<PortfolioFinancialsResponse> getPortfolioFinancials(
      @RequestParam String tenant,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getPortfolioFinancials(tenantId, mode).toResponse(tenantId);
  }

  /** Project health rows, worst schedule performance first; six rows unless a limit is given. */
  @GetMapping("/projects/health")
  public ResponseEntity<List<ProjectHealthResponse>> getProjectHealthList(
      @RequestParam String tenant,
      @RequestParam(required = false) Integer limit,
      @RequestHeader(name = RequestedDataMode.HEADER, required = false) String modeHeader,
      @RequestParam(name = RequestedDataMode.PARAM, required = false) String modeParam) {
    if (limit != null && limit < 0) {
      throw new InvalidRequestException("Invalid limit", "'limit' must not be negative");
    }
    String tenantId = RequestedDataMode.requireTenant(tenant);
    var mode = RequestedDataMode.resolve(modeHeader, modeParam);
    return dashboardService.getProjectHealthList(tenantId, mode, limit).toResponse(tenantId);
  }
}
