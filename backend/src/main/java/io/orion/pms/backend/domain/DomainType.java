package io.orion.pms.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** EPCIC project phases, declared in their canonical display order. */
public enum DomainType {
  ENGINEERING("engineering", "Engineering"),
  PROCUREMENT("procurement", "Procurement"),
  CONSTRUCTION("construction", "Construction"),
  INSTALLATION("installation", "Installation"),
  COMMISSIONING("commissioning", "Commissioning");

  private final String value;
  private final String label;

  DomainType(String value, String label) {
    this.value = value;
    this.label = label;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public String label() {
    return label;
  }
}
