package io.orion.pms.backend.config;

import com.zaxxer.hikari.HikariDataSource;
import io.orion.pms.backend.source.JdbcEvmRecordSource;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Connection pool for the live P6/SAP mirror, bound from {@code spring.datasource.live.*}. Only
 * created when {@code orion.live.enabled=true}; without it every request is served from the demo
 * portfolio.
 */
@Configuration
@ConditionalOnProperty(prefix = "orion.live", name = "enabled", havingValue = "true")
public class LiveDataSourceConfig {

  @Bean(name = "liveDataSource")
  @ConfigurationProperties("spring.datasource.live")
  public HikariDataSource liveDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "liveJdbcClient")
  public JdbcClient liveJdbcClient(@Qualifier("liveDataSource") DataSource liveDataSource) {
    return JdbcClient.create(liveDataSource);
  }

  @Bean
  public JdbcEvmRecordSource jdbcEvmRecordSource(@Qualifier("liveJdbcClient") JdbcClient jdbc) {
    return new JdbcEvmRecordSource(jdbc);
  }
}
