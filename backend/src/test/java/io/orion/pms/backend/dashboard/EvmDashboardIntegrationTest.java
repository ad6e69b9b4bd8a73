package io.orion.pms.backend.dashboard;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** Runs the dashboard endpoints against the bundled demo portfolio. */
@SpringBootTest
@AutoConfigureMockMvc
class EvmDashboardIntegrationTest {

  private static final String TENANT = "acme";

  @Autowired private MockMvc mockMvc;

  // --- Portfolio ---

  @Test
  void portfolioSummaryCountsDemoProjects() throws Exception {
    mockMvc
        .perform(get("/api/v1/portfolio/summary").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Data-Source", "demo:portfolio"))
        .andExpect(header().string("X-Data-Mode", "mock"))
        .andExpect(header().string("X-Tenant-Id", TENANT))
        .andExpect(jsonPath("$.totalProjects").value(5))
        .andExpect(jsonPath("$.onTrackCount").value(2))
        .andExpect(jsonPath("$.atRiskCount").value(2))
        .andExpect(jsonPath("$.criticalCount").value(1))
        .andExpect(jsonPath("$.errorCount").value(0))
        .andExpect(jsonPath("$.avgSPI").value(0.94))
        .andExpect(jsonPath("$.avgCPI").value(0.97))
        .andExpect(jsonPath("$.status").value("at_risk"))
        .andExpect(jsonPath("$.failedProjects").isEmpty());
  }

  @Test
  void financialsSumLatestDemoSnapshots() throws Exception {
    mockMvc
        .perform(get("/api/v1/portfolio/financials").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Data-Mode", "mock"))
        .andExpect(jsonPath("$.projectCount").value(5))
        .andExpect(jsonPath("$.totalPv").value(1223750000))
        .andExpect(jsonPath("$.totalEv").value(1153608300))
        .andExpect(jsonPath("$.totalAc").value(1197559216))
        .andExpect(jsonPath("$.totalBac").value(1975000000));
  }

  @Test
  void missingTenantIsBadRequest() throws Exception {
    mockMvc.perform(get("/api/v1/portfolio/summary")).andExpect(status().isBadRequest());
  }

  @Test
  void unknownDataModeIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/v1/portfolio/summary").param("tenant", TENANT).param("dataMode", "x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid data mode"));
  }

  @Test
  void liveModeWithoutDatabaseServesDemoData() throws Exception {
    mockMvc
        .perform(
            get("/api/v1/portfolio/summary").param("tenant", TENANT).header("X-Data-Mode", "live"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Data-Mode", "mock"))
        .andExpect(jsonPath("$.totalProjects").value(5));
  }

  @Test
  void healthListIsOrderedBySpi() throws Exception {
    mockMvc
        .perform(get("/api/v1/projects/health").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(5))
        .andExpect(jsonPath("$[0].projectId").value("OSLSDPC"))
        .andExpect(jsonPath("$[0].status").value("critical"))
        .andExpect(jsonPath("$[1].projectId").value("10481"))
        .andExpect(jsonPath("$[2].projectId").value("OSLUBET"))
        .andExpect(jsonPath("$[3].projectId").value("OSLOB3"))
        .andExpect(jsonPath("$[4].projectId").value("OSLNNPC"));
  }

  @Test
  void healthListLimit() throws Exception {
    mockMvc
        .perform(get("/api/v1/projects/health").param("tenant", TENANT).param("limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2));
  }

  @Test
  void negativeLimitIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/v1/projects/health").param("tenant", TENANT).param("limit", "-1"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void evmProjectsShowLatestSnapshot() throws Exception {
    mockMvc
        .perform(get("/api/v1/evm/projects").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(5))
        .andExpect(jsonPath("$[0].projectId").value("10481"))
        .andExpect(jsonPath("$[0].projectName").value("AKK SEG-1 Gas Pipeline"))
        .andExpect(jsonPath("$[0].snapshotDate").value("2026-09-30"))
        .andExpect(jsonPath("$[0].spi").value(0.91))
        .andExpect(jsonPath("$[0].eac").value(260004961))
        .andExpect(jsonPath("$[0].status").value("at_risk"));
  }

  // --- Project ---

  @Test
  void projectRollupSumsLeaves() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/10481/rollup").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.projectName").value("AKK SEG-1 Gas Pipeline"))
        .andExpect(jsonPath("$.leafCount").value(10))
        .andExpect(jsonPath("$.pv").value(158650000))
        .andExpect(jsonPath("$.ev").value(144201500))
        .andExpect(jsonPath("$.metrics.spi").value(0.91))
        .andExpect(jsonPath("$.metrics.cpi").value(0.98))
        .andExpect(jsonPath("$.metrics.vac").value(-5004961))
        .andExpect(jsonPath("$.status").value("at_risk"))
        .andExpect(jsonPath("$.domains.length()").value(5));
  }

  @Test
  void unknownProjectIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/NOPE/rollup").param("tenant", TENANT))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Project not found"));
  }

  @Test
  void domainsAreInCanonicalOrder() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/OSLSDPC/domains").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].domain").value("engineering"))
        .andExpect(jsonPath("$[0].label").value("Engineering"))
        .andExpect(jsonPath("$[0].leafCount").value(2))
        .andExpect(jsonPath("$[1].domain").value("procurement"))
        .andExpect(jsonPath("$[1].spi").value(0.78))
        .andExpect(jsonPath("$[4].domain").value("commissioning"));
  }

  @Test
  void performanceGauges() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/OSLSDPC/performance").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.spi").value(0.81))
        .andExpect(jsonPath("$.cpi").value(0.93))
        .andExpect(jsonPath("$.healthScore").value(44))
        .andExpect(jsonPath("$.tcpi").value(1.07))
        .andExpect(jsonPath("$.status").value("critical"));
  }

  // --- WBS tree ---

  @Test
  void wbsTreeIsNestedWithSourceExpandedRoot() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/10481/wbs").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalCount").value(16))
        .andExpect(jsonPath("$.uiState.expandedIds[0]").value("10481-ROOT"))
        .andExpect(jsonPath("$.nodes.length()").value(1))
        .andExpect(jsonPath("$.nodes[0].expanded").value(true))
        .andExpect(jsonPath("$.nodes[0].leafCount").value(10))
        .andExpect(jsonPath("$.nodes[0].children.length()").value(5))
        .andExpect(jsonPath("$.nodes[0].children[0].wbsCode").value("1.1"))
        .andExpect(jsonPath("$.nodes[0].children[0].children[0].leaf").value(true))
        .andExpect(jsonPath("$.nodes[0].children[0].children[0].sapMapped").value(true))
        .andExpect(
            jsonPath("$.nodes[0].children[0].children[0].sapMapping.posid").value("10481.E.01"));
  }

  @Test
  void breadcrumbPath() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/10481/wbs/10481-E-1/path").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(3))
        .andExpect(jsonPath("$[0].id").value("10481-ROOT"))
        .andExpect(jsonPath("$[2].wbsCode").value("E-1.1"))
        .andExpect(jsonPath("$[2].level").value(2));
  }

  @Test
  void selectRevealsAncestors() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/project/10481/wbs/ui-state/select")
                .param("tenant", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"state": {"expandedIds": [], "selectedId": null}, "nodeId": "10481-E-2"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.selectedId").value("10481-E-2"))
        .andExpect(jsonPath("$.expandedIds", containsInAnyOrder("10481-ROOT", "10481-E")));
  }

  @Test
  void toggleWithoutStateStartsFromEmpty() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/project/10481/wbs/ui-state/toggle")
                .param("tenant", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nodeId": "10481-P"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.expandedIds[0]").value("10481-P"))
        .andExpect(jsonPath("$.selectedId").isEmpty());
  }

  @Test
  void toggleUnknownNodeIsNotFound() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/project/10481/wbs/ui-state/toggle")
                .param("tenant", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nodeId": "OSLOB3-E"}
                    """))
        .andExpect(status().isNotFound());
  }

  @Test
  void toggleWithBlankNodeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/project/10481/wbs/ui-state/toggle")
                .param("tenant", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"nodeId": ""}
                    """))
        .andExpect(status().isBadRequest());
  }
}
