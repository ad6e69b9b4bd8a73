package io.orion.pms.backend.dashboard;

import io.orion.pms.backend.exception.InvalidRequestException;
import io.orion.pms.backend.source.DataMode;

/** Reads the data mode a request asks for. The header wins over the query parameter. */
final class RequestedDataMode {

  static final String HEADER = "X-Data-Mode";
  static final String PARAM = "dataMode";

  private RequestedDataMode() {}

  /**
   * @return the requested mode, or null when neither the header nor the parameter is set, in which
   *     case the configured default applies
   * @throws InvalidRequestException when the value is neither {@code mock} nor {@code live}
   */
  static DataMode resolve(String header, String param) {
    String raw = header != null && !header.isBlank() ? header : param;
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return DataMode.parse(raw)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid data mode", "Data mode must be 'mock' or 'live', got '" + raw + "'"));
  }

  static String requireTenant(String tenant) {
    if (tenant.isBlank()) {
      throw new InvalidRequestException("Missing tenant", "Query parameter 'tenant' is required");
    }
    return tenant;
  }
}
