package io.orion.pms.backend.wbs;

import io.orion.pms.backend.evm.BaseSnapshot;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Flat WBS row as delivered by the data layer, one per WBS element and project.
 *
 * @param id WBS element id, unique within a project
 * @param parentId parent element id, null for a top-level element
 * @param code WBS code, e.g. "E-1.2"
 * @param epcCode explicit EPC classification code, null to classify by {@code code}
 * @param name display name
 * @param pv planned value
 * @param ev earned value
 * @param ac actual cost
 * @param bac budget at completion
 * @param expanded whether the element starts expanded in the tree view
 * @param sapMapping SAP overlay, null when unmapped
 */
public record WbsRecord(
    String id,
    String parentId,
    String code,
    String epcCode,
    String name,
    BigDecimal pv,
    BigDecimal ev,
    BigDecimal ac,
    BigDecimal bac,
    boolean expanded,
    SapMapping sapMapping) {

  public WbsRecord {
    Objects.requireNonNull(id, "id");
  }

  public BaseSnapshot baseSnapshot() {
    return BaseSnapshot.of(pv, ev, ac, bac);
  }
}
