package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.wbs.TreeUiState;
import jakarta.validation.constraints.NotBlank;

/**
 * Tree view interaction: the client's current state and the node acted on.
 *
 * @param state current state, treated as empty when absent
 * @param nodeId node to toggle or select
 */
public record TreeUiStateRequest(TreeUiState state, @NotBlank String nodeId) {

  public TreeUiState currentState() {
    return state != null ? state : TreeUiState.empty();
  }
}
