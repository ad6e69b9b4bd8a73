package io.orion.pms.backend.source;

import io.orion.pms.backend.config.OrionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Picks the record store for a request's data mode. A {@code live} request without a configured
 * live database is served from the demo portfolio, and the fallback is logged.
 */
@Component
public class EvmRecordSources {

  private static final Logger log = LoggerFactory.getLogger(EvmRecordSources.class);

  private final DemoEvmRecordSource demoSource;
  private final ObjectProvider<JdbcEvmRecordSource> liveSource;
  private final DataMode defaultMode;

  public EvmRecordSources(
      DemoEvmRecordSource demoSource,
      ObjectProvider<JdbcEvmRecordSource> liveSource,
      OrionProperties properties) {
    this.demoSource = demoSource;
    this.liveSource = liveSource;
    this.defaultMode = properties.defaultDataMode();
  }

  public DataMode defaultMode() {
    return defaultMode;
  }

  /**
   * Resolves the requested mode, falling back to the configured default when none is given.
   *
   * @param requested the mode named by the request, may be null
   * @return the source to read from
   */
  public EvmRecordSource resolve(DataMode requested) {
    DataMode mode = requested != null ? requested : defaultMode;
    if (mode == DataMode.LIVE) {
      JdbcEvmRecordSource live = liveSource.getIfAvailable();
      if (live != null) {
        return live;
      }
      log.warn("Live data requested but not configured, serving demo data: mode={}", mode.value());
    }
    return demoSource;
  }
}
