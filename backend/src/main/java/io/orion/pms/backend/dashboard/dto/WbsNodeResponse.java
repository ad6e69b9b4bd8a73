package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.evm.HealthStatus;
import io.orion.pms.backend.wbs.SapMapping;
import java.math.BigDecimal;
import java.util.List;

/**
 * WBS tree node as rendered by the tree view. Values are the node's rollup: its own figures for a
 * leaf, the sum of its leaves otherwise.
 */
public record WbsNodeResponse(
    String id,
    String parentId,
    String wbsCode,
    String name,
    int level,
    boolean leaf,
    int leafCount,
    BigDecimal pv,
    BigDecimal ev,
    BigDecimal ac,
    BigDecimal bac,
    MetricsResponse metrics,
    HealthStatus status,
    boolean sapMapped,
    SapMapping sapMapping,
    boolean expanded,
    boolean selected,
    List<WbsNodeResponse> children) {}
