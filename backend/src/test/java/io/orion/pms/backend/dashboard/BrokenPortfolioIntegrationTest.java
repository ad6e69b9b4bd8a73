package io.orion.pms.backend.dashboard;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

/** Projects with a corrupt or empty WBS. */
@SpringBootTest(properties = "orion.demo-fixture=classpath:fixtures/small-portfolio.json")
@AutoConfigureMockMvc
class BrokenPortfolioIntegrationTest {

  private static final String TENANT = "acme";

  @Autowired private MockMvc mockMvc;

  @Test
  void brokenProjectIsUnprocessable() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/BROKEN/rollup").param("tenant", TENANT))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.title").value("WBS integrity error"))
        .andExpect(jsonPath("$.projectId").value("BROKEN"))
        .andExpect(jsonPath("$.orphanIds[0]").value("B-1"));
  }

  @Test
  void brokenProjectTreeIsUnprocessable() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/BROKEN/wbs").param("tenant", TENANT))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  void portfolioReportsBrokenProjectAndKeepsOthers() throws Exception {
    mockMvc
        .perform(get("/api/v1/portfolio/summary").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalProjects").value(3))
        .andExpect(jsonPath("$.onTrackCount").value(1))
        .andExpect(jsonPath("$.noDataCount").value(1))
        .andExpect(jsonPath("$.errorCount").value(1))
        .andExpect(jsonPath("$.avgSPI").value(0.98))
        .andExpect(jsonPath("$.status").value("on_track"))
        .andExpect(jsonPath("$.failedProjects[0].projectId").value("BROKEN"))
        .andExpect(jsonPath("$.failedProjects[0].orphanIds[0]").value("B-1"));
  }

  @Test
  void healthListMarksBrokenProjectAsError() throws Exception {
    mockMvc
        .perform(get("/api/v1/projects/health").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].projectId").value("ALPHA"))
        .andExpect(jsonPath("$[1].status").value("error"))
        .andExpect(jsonPath("$[2].status").value("no_data"));
  }

  @Test
  void projectWithoutWbsRollsUpToNoData() throws Exception {
    mockMvc
        .perform(get("/api/v1/project/EMPTY/rollup").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("no_data"))
        .andExpect(jsonPath("$.leafCount").value(0))
        .andExpect(jsonPath("$.metrics.spi").isEmpty())
        .andExpect(jsonPath("$.metrics.percentComplete").value(0));
  }

  @Test
  void zeroSnapshotHasUndefinedIndices() throws Exception {
    mockMvc
        .perform(get("/api/v1/evm/projects").param("tenant", TENANT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].projectId").value("EMPTY"))
        .andExpect(jsonPath("$[1].projectName").value("Unnamed Project"))
        .andExpect(jsonPath("$[1].spi").isEmpty())
        .andExpect(jsonPath("$[1].status").value("no_data"));
  }
}
