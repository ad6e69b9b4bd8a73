package io.orion.pms.backend.source;

/** A project known to the record store for a tenant. */
public record ProjectRef(String projectId, String projectName) {}
