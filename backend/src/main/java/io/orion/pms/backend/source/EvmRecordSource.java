package io.orion.pms.backend.source;

import io.orion.pms.backend.wbs.WbsRecord;
import java.util.List;

/**
 * Read-only access to the raw EVM records the analytics are computed from. Implementations do no
 * computation; every derived value is calculated by the caller on each read.
 */
public interface EvmRecordSource {

  DataMode mode();

  /** Short identifier of the backing store, reported to clients in the X-Data-Source header. */
  String sourceName();

  List<ProjectRef> findProjects(String tenantId);

  /** All project snapshots for a tenant, any order, possibly several dates per project. */
  List<ProjectSnapshotRecord> findProjectSnapshots(String tenantId);

  /** Flat WBS rows for one project in source order; empty when the project has none. */
  List<WbsRecord> findWbsRecords(String tenantId, String projectId);
}
