package io.orion.pms.backend.dashboard;

import io.orion.pms.backend.source.DataMode;
import io.orion.pms.backend.source.EvmRecordSource;
import org.springframework.http.ResponseEntity;

/**
 * A response body together with the record store it was computed from.
 *
 * @param body the response payload
 * @param mode data mode actually served (may differ from the requested one after a fallback)
 * @param sourceName identifier of the store
 */
public record Sourced<T>(T body, DataMode mode, String sourceName) {

  static final String DATA_SOURCE_HEADER = "X-Data-Source";
  static final String DATA_MODE_HEADER = "X-Data-Mode";
  static final String TENANT_HEADER = "X-Tenant-Id";

  static <T> Sourced<T> of(T body, EvmRecordSource source) {
    return new Sourced<>(body, source.mode(), source.sourceName());
  }

  ResponseEntity<T> toResponse(String tenantId) {
    return ResponseEntity.ok()
        .header(DATA_SOURCE_HEADER, sourceName)
        .header(DATA_MODE_HEADER, mode.value())
        .header(TENANT_HEADER, tenantId)
        .body(body);
  }
}
