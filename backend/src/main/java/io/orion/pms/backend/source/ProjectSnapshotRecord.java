package io.orion.pms.backend.source;

import io.orion.pms.backend.evm.BaseSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Project-level EVM snapshot as stored by the scheduling sync, one row per project and date.
 *
 * @param projectId the project
 * @param projectName display name, may be null
 * @param snapshotDate as-of date of the values
 * @param pv planned value
 * @param ev earned value
 * @param ac actual cost
 * @param bac budget at completion
 */
public record ProjectSnapshotRecord(
    String projectId,
    String projectName,
    LocalDate snapshotDate,
    BigDecimal pv,
    BigDecimal ev,
    BigDecimal ac,
    BigDecimal bac) {

  public BaseSnapshot baseSnapshot() {
    return BaseSnapshot.of(pv, ev, ac, bac);
  }
}
