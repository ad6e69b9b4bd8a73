package io.orion.pms.backend.source;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Which record store a request reads from: the bundled demo portfolio or the live database. */
public enum DataMode {
  MOCK("mock"),
  LIVE("live");

  private final String value;

  DataMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Parses "mock" or "live" (case-insensitive); anything else is empty. */
  public static Optional<DataMode> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.strip().toLowerCase(Locale.ROOT)) {
      case "mock" -> Optional.of(MOCK);
      case "live" -> Optional.of(LIVE);
      default -> Optional.empty();
    };
  }
}
