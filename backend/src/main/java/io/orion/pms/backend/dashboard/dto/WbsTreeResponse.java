package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.wbs.TreeUiState;
import java.util.List;

/**
 * Nested WBS tree for one project.
 *
 * @param projectId the project
 * @param totalCount number of WBS elements in the tree
 * @param uiState initial expanded/selected state for the view
 * @param nodes top-level nodes with their subtrees, in source order
 */
public record WbsTreeResponse(
    String projectId, int totalCount, TreeUiState uiState, List<WbsNodeResponse> nodes) {}
