package io.orion.pms.backend.source;

import io.orion.pms.backend.config.OrionProperties;
import io.orion.pms.backend.wbs.WbsRecord;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Serves the bundled demo portfolio (data mode {@code mock}). The fixture is read once at startup
 * from {@code orion.demo-fixture}; every tenant sees the same demo projects.
 */
@Component
public class DemoEvmRecordSource implements EvmRecordSource {

  private static final Logger log = LoggerFactory.getLogger(DemoEvmRecordSource.class);

  private final List<DemoProject> projects;
  private final Map<String, DemoProject> projectsById;

  public DemoEvmRecordSource(
      ResourceLoader resourceLoader, ObjectMapper objectMapper, OrionProperties properties) {
    this.projects = load(resourceLoader.getResource(properties.demoFixture()), objectMapper);
    this.projectsById =
        projects.stream()
            .collect(Collectors.toMap(DemoProject::projectId, Function.identity(), (a, b) -> a));
    log.info(
        "Loaded demo portfolio: fixture={}, projects={}",
        properties.demoFixture(),
        projects.size());
  }

  @Override
  public DataMode mode() {
    return DataMode.MOCK;
  }

  @Override
  public String sourceName() {
    return "demo:portfolio";
  }

  @Override
  public List<ProjectRef> findProjects(String tenantId) {
    return projects.stream().map(p -> new ProjectRef(p.projectId(), p.projectName())).toList();
  }

  @Override
  public List<ProjectSnapshotRecord> findProjectSnapshots(String tenantId) {
    return projects.stream()
        .flatMap(
            p ->
                p.snapshots().stream()
                    .map(
                        s ->
                            new ProjectSnapshotRecord(
                                p.projectId(),
                                p.projectName(),
                                s.snapshotDate(),
                                s.pv(),
                                s.ev(),
                                s.ac(),
                                s.bac())))
        .toList();
  }

  @Override
  public List<WbsRecord> findWbsRecords(String tenantId, String projectId) {
    DemoProject project = projectsById.get(projectId);
    return project != null ? project.wbs() : List.of();
  }

  private static List<DemoProject> load(Resource resource, ObjectMapper objectMapper) {
    try (InputStream in = resource.getInputStream()) {
      DemoPortfolio portfolio = objectMapper.readValue(in, DemoPortfolio.class);
      return portfolio.projects() != null ? List.copyOf(portfolio.projects()) : List.of();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read demo portfolio: " + resource, e);
    }
  }

  record DemoPortfolio(List<DemoProject> projects) {}

  record DemoProject(
      String projectId, String projectName, List<DemoSnapshot> snapshots, List<WbsRecord> wbs) {

    DemoProject {
      snapshots = snapshots != null ? List.copyOf(snapshots) : List.of();
      wbs = wbs != null ? List.copyOf(wbs) : List.of();
    }
  }

  record DemoSnapshot(
      LocalDate snapshotDate, BigDecimal pv, BigDecimal ev, BigDecimal ac, BigDecimal bac) {}
}
