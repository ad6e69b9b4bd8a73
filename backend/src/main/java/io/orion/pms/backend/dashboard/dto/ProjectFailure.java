package io.orion.pms.backend.dashboard.dto;

import java.util.List;

/**
 * A project left out of portfolio figures because its WBS could not be assembled.
 *
 * @param projectId the failing project
 * @param projectName display name
 * @param orphanIds WBS ids whose parent does not exist
 * @param cycleIds WBS ids whose ancestor chain loops
 * @param duplicateIds WBS ids that occur more than once
 */
public record ProjectFailure(
    String projectId,
    String projectName,
    List<String> orphanIds,
    List<String> cycleIds,
    List<String> duplicateIds) {}
