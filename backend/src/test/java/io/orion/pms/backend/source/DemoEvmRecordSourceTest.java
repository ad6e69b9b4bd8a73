package io.orion.pms.backend.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.orion.pms.backend.config.OrionProperties;
import io.orion.pms.backend.wbs.WbsRecord;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import tools.jackson.databind.json.JsonMapper;

class DemoEvmRecordSourceTest {

  private static DemoEvmRecordSource load(String fixture) {
    return new DemoEvmRecordSource(
        new DefaultResourceLoader(),
        JsonMapper.builder().build(),
        new OrionProperties(null, fixture, null, null));
  }

  @Test
  void loadsProjectsInFixtureOrder() {
    var source = load("classpath:fixtures/small-portfolio.json");

    assertThat(source.findProjects("acme"))
        .extracting(ProjectRef::projectId)
        .containsExactly("ALPHA", "BROKEN", "EMPTY");
    assertThat(source.mode()).isEqualTo(DataMode.MOCK);
    assertThat(source.sourceName()).isEqualTo("demo:portfolio");
  }

  @Test
  void flattensSnapshotsWithProjectIdentity() {
    var source = load("classpath:fixtures/small-portfolio.json");

    var snapshots = source.findProjectSnapshots("acme");

    assertThat(snapshots).hasSize(3);
    assertThat(snapshots.get(1).projectId()).isEqualTo("ALPHA");
    assertThat(snapshots.get(1).snapshotDate()).isEqualTo(LocalDate.of(2026, 8, 31));
    assertThat(snapshots.get(1).baseSnapshot().earnedValue()).isEqualByComparingTo("196");
  }

  @Test
  void readsWbsRowsWithSapOverlayAndMissingAmountsAsZero() {
    var source = load("classpath:fixtures/small-portfolio.json");

    var rows = source.findWbsRecords("acme", "ALPHA");

    assertThat(rows).extracting(WbsRecord::id).containsExactly("A", "A-E", "A-C");
    assertThat(rows.get(0).expanded()).isTrue();
    assertThat(rows.get(0).baseSnapshot().plannedValue()).isEqualByComparingTo("0");
    assertThat(rows.get(1).sapMapping().posid()).isEqualTo("ALPHA.E.01");
    assertThat(rows.get(1).sapMapping().verified()).isTrue();
    assertThat(rows.get(2).sapMapping()).isNull();
  }

  @Test
  void unknownProjectHasNoWbs() {
    assertThat(load("classpath:fixtures/small-portfolio.json").findWbsRecords("acme", "NOPE"))
        .isEmpty();
  }

  @Test
  void bundledDemoPortfolioLoads() {
    var source = load("classpath:demo/portfolio.json");

    assertThat(source.findProjects("acme")).hasSize(5);
    assertThat(source.findWbsRecords("acme", "10481")).isNotEmpty();
  }

  @Test
  void missingFixtureFailsFast() {
    assertThatThrownBy(() -> load("classpath:fixtures/does-not-exist.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Failed to read demo portfolio");
  }
}
