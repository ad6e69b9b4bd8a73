package io.orion.pms.backend.wbs;

import io.orion.pms.backend.evm.BaseSnapshot;
import java.util.List;

/**
 * Immutable WBS element inside a {@link WbsTree}. Children are referenced by id and resolved
 * through the owning tree.
 *
 * @param id element id
 * @param parentId parent id, null for a root
 * @param code WBS code
 * @param epcCode explicit EPC classification code, may be null
 * @param name display name
 * @param level depth in the tree, 0 for roots
 * @param baseSnapshot the element's own PV/EV/AC/BAC as delivered by the source
 * @param childIds child ids in source order
 * @param sapMapping SAP overlay, null when unmapped
 */
public record WbsNode(
    String id,
    String parentId,
    String code,
    String epcCode,
    String name,
    int level,
    BaseSnapshot baseSnapshot,
    List<String> childIds,
    SapMapping sapMapping) {

  public WbsNode {
    childIds = List.copyOf(childIds);
  }

  public boolean isLeaf() {
    return childIds.isEmpty();
  }

  public boolean sapMapped() {
    return sapMapping != null;
  }

  /** Code used for EPCIC bucketing: the explicit EPC code when present, else the WBS code. */
  public String classificationCode() {
    return epcCode != null && !epcCode.isBlank() ? epcCode : code;
  }
}
