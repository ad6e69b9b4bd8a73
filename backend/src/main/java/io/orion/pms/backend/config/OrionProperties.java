package io.orion.pms.backend.config;

import io.orion.pms.backend.source.DataMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings under the {@code orion} prefix.
 *
 * @param defaultDataMode data mode used when a request names none
 * @param demoFixture resource location of the demo portfolio JSON
 * @param rollupCache project rollup cache settings
 * @param live live database settings
 */
@ConfigurationProperties(prefix = "orion")
public record OrionProperties(
    DataMode defaultDataMode, String demoFixture, RollupCache rollupCache, Live live) {

  public OrionProperties {
    if (defaultDataMode == null) {
      defaultDataMode = DataMode.MOCK;
    }
    if (demoFixture == null || demoFixture.isBlank()) {
      demoFixture = "classpath:demo/portfolio.json";
    }
    if (rollupCache == null) {
      rollupCache = new RollupCache(1_000);
    }
    if (live == null) {
      live = new Live(false);
    }
  }

  /** Size bound for the project rollup cache. */
  public record RollupCache(long maximumSize) {}

  /** Whether the live database pool is configured. */
  public record Live(boolean enabled) {}
}
