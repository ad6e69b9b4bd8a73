package io.orion.pms.backend.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a project's flat WBS list cannot be assembled into a tree: a parent reference does
 * not resolve, an ancestor chain revisits itself, or an id occurs twice. Results in HTTP 422
 * Unprocessable Entity listing the offending ids. Scoped to a single project; portfolio calls
 * report the project as failed and carry on.
 */
public class WbsIntegrityException extends ErrorResponseException {

  private final String projectId;
  private final List<String> orphanIds;
  private final List<String> cycleIds;
  private final List<String> duplicateIds;

  public WbsIntegrityException(
      String projectId, List<String> orphanIds, List<String> cycleIds, List<String> duplicateIds) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(projectId, orphanIds, cycleIds, duplicateIds),
        null);
    this.projectId = projectId;
    this.orphanIds = List.copyOf(orphanIds);
    this.cycleIds = List.copyOf(cycleIds);
    this.duplicateIds = List.copyOf(duplicateIds);
  }

  public String getProjectId() {
    return projectId;
  }

  public List<String> getOrphanIds() {
    return orphanIds;
  }

  public List<String> getCycleIds() {
    return cycleIds;
  }

  public List<String> getDuplicateIds() {
    return duplicateIds;
  }

  @Override
  public String getMessage() {
    return "WBS integrity failure for project %s: orphans=%s, cycles=%s, duplicates=%s"
        .formatted(projectId, orphanIds, cycleIds, duplicateIds);
  }

  private static ProblemDetail createProblem(
      String projectId, List<String> orphanIds, List<String> cycleIds, List<String> duplicateIds) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("WBS integrity error");
    problem.setDetail(
        "WBS for project %s has %d orphaned, %d cyclic and %d duplicate elements"
            .formatted(projectId, orphanIds.size(), cycleIds.size(), duplicateIds.size()));
    problem.setProperty("projectId", projectId);
    problem.setProperty("orphanIds", orphanIds);
    problem.setProperty("cycleIds", cycleIds);
    problem.setProperty("duplicateIds", duplicateIds);
    return problem;
  }
}
