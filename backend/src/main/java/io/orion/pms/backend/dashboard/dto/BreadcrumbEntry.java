package io.orion.pms.backend.dashboard.dto;

import io.orion.pms.backend.wbs.WbsNode;

/** One step of a WBS breadcrumb. */
public record BreadcrumbEntry(String id, String name, String wbsCode, int level) {

  public static BreadcrumbEntry from(WbsNode node) {
    return new BreadcrumbEntry(node.id(), node.name(), node.code(), node.level());
  }
}
