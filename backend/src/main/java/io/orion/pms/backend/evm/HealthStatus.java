package io.orion.pms.backend.evm;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health status for a WBS element, domain or project. Serialized in snake case ({@code on_track},
 * {@code at_risk}, ...) to match the dashboard's wire format.
 */
public enum HealthStatus {
  ON_TRACK("on_track"),
  AT_RISK("at_risk"),
  CRITICAL("critical"),
  NO_DATA("no_data"),
  ERROR("error");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Whether this status takes part in on-track / at-risk / critical counts. */
  public boolean isClassified() {
    return this == ON_TRACK || this == AT_RISK || this == CRITICAL;
  }
}
