package io.orion.pms.backend.source;

import io.orion.pms.backend.wbs.SapMapping;
import io.orion.pms.backend.wbs.WbsRecord;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Reads EVM records from the live mirror of P6 and SAP data (data mode {@code live}). Registered by
 * {@link io.orion.pms.backend.config.LiveDataSourceConfig} only when {@code orion.live.enabled} is
 * set.
 */
public class JdbcEvmRecordSource implements EvmRecordSource {

  private final JdbcClient jdbc;

  public JdbcEvmRecordSource(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public DataMode mode() {
    return DataMode.LIVE;
  }

  @Override
  public String sourceName() {
    return "live:orion_evm";
  }

  @Override
  public List<ProjectRef> findProjects(String tenantId) {
    return jdbc.sql(
            """
            SELECT project_id, project_name
              FROM orion_core.projects
             WHERE tenant_id = :tenantId
             ORDER BY project_id
            """)
        .param("tenantId", tenantId)
        .query(
            (rs, rowNum) ->
                new ProjectRef(rs.getString("project_id"), rs.getString("project_name")))
        .list();
  }

  @Override
  public List<ProjectSnapshotRecord> findProjectSnapshots(String tenantId) {
    return jdbc.sql(
            """
            SELECT project_id, project_name, snapshot_date, pv, ev, ac, bac
              FROM orion_evm.project_snapshots
             WHERE tenant_id = :tenantId
             ORDER BY snapshot_date DESC
            """)
        .param("tenantId", tenantId)
        .query((rs, rowNum) -> mapSnapshot(rs))
        .list();
  }

  @Override
  public List<WbsRecord> findWbsRecords(String tenantId, String projectId) {
    return jdbc.sql(
            """
            SELECT w.wbs_id, w.parent_wbs_id, w.wbs_code, w.epc_code, w.wbs_name,
                   w.pv, w.ev, w.ac, w.bac, w.is_expanded,
                   m.posid, m.confidence_score, m.is_verified
              FROM orion_evm.wbs_metrics w
              LEFT JOIN orion_xconf.wbs_mapping m
                ON m.tenant_id = w.tenant_id AND m.wbs_id = w.wbs_id
             WHERE w.tenant_id = :tenantId
               AND w.project_id = :projectId
             ORDER BY w.seq_num, w.wbs_id
            """)
        .param("tenantId", tenantId)
        .param("projectId", projectId)
        .query((rs, rowNum) -> mapWbs(rs))
        .list();
  }

  private static ProjectSnapshotRecord mapSnapshot(ResultSet rs) throws SQLException {
    Date snapshotDate = rs.getDate("snapshot_date");
    return new ProjectSnapshotRecord(
        rs.getString("project_id"),
        rs.getString("project_name"),
        snapshotDate != null ? snapshotDate.toLocalDate() : null,
        rs.getBigDecimal("pv"),
        rs.getBigDecimal("ev"),
        rs.getBigDecimal("ac"),
        rs.getBigDecimal("bac"));
  }

  private static WbsRecord mapWbs(ResultSet rs) throws SQLException {
    String posid = rs.getString("posid");
    SapMapping sapMapping =
        posid != null
            ? new SapMapping(
                posid, rs.getObject("confidence_score", Double.class), rs.getBoolean("is_verified"))
            : null;
    return new WbsRecord(
        rs.getString("wbs_id"),
        rs.getString("parent_wbs_id"),
        rs.getString("wbs_code"),
        rs.getString("epc_code"),
        rs.getString("wbs_name"),
        rs.getBigDecimal("pv"),
        rs.getBigDecimal("ev"),
        rs.getBigDecimal("ac"),
        rs.getBigDecimal("bac"),
        rs.getBoolean("is_expanded"),
        sapMapping);
  }
}
