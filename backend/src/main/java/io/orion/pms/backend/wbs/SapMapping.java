package io.orion.pms.backend.wbs;

/**
 * SAP project structure element a WBS element is mapped to.
 *
 * @param posid SAP WBS element id (PRPS-POSID)
 * @param confidenceScore mapping confidence in [0, 1], null when unscored
 * @param verified whether a user has confirmed the mapping
 */
public record SapMapping(String posid, Double confidenceScore, boolean verified) {}
