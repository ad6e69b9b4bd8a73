package io.orion.pms.backend.wbs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.orion.pms.backend.exception.WbsIntegrityException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class WbsTreeBuilderTest {

  @Test
  void buildsTreeAndPreservesSourceOrderOfChildren() {
    var tree =
        WbsTreeBuilder.build(
            "P1",
            List.of(
                wbs("root", null, "1"),
                wbs("c", "root", "C-1"),
                wbs("a", "root", "E-1"),
                wbs("b", "root", "P-1"),
                wbs("a1", "a", "E-1.1")));

    assertThat(tree.size()).isEqualTo(5);
    assertThat(tree.roots()).extracting(WbsNode::id).containsExactly("root");
    var root = tree.findNode("root").orElseThrow();
    assertThat(tree.children(root)).extracting(WbsNode::id).containsExactly("c", "a", "b");
    assertThat(tree.leaves()).extracting(WbsNode::id).containsExactly("c", "a1", "b");
  }

  @Test
  void assignsLevelsFromRoots() {
    var tree =
        WbsTreeBuilder.build(
            "P1",
            List.of(wbs("a1", "a", "E-1.1"), wbs("a", "root", "E-1"), wbs("root", null, "1")));

    assertThat(tree.findNode("root").orElseThrow().level()).isZero();
    assertThat(tree.findNode("a").orElseThrow().level()).isEqualTo(1);
    assertThat(tree.findNode("a1").orElseThrow().level()).isEqualTo(2);
  }

  @Test
  void childListedBeforeParentIsNotAnOrphan() {
    var tree =
        WbsTreeBuilder.build("P1", List.of(wbs("child", "root", "E-1"), wbs("root", null, "1")));

    assertThat(tree.isLeaf(tree.findNode("child").orElseThrow())).isTrue();
    assertThat(tree.isLeaf(tree.findNode("root").orElseThrow())).isFalse();
  }

  @Test
  void multipleTopLevelElementsFormAForest() {
    var tree = WbsTreeBuilder.build("P1", List.of(wbs("r1", null, "E"), wbs("r2", null, "P")));

    assertThat(tree.roots()).extracting(WbsNode::id).containsExactly("r1", "r2");
    assertThat(tree.leaves()).hasSize(2);
  }

  @Test
  void emptyInputBuildsEmptyTree() {
    var tree = WbsTreeBuilder.build("P1", List.of());

    assertThat(tree.isEmpty()).isTrue();
    assertThat(tree.leaves()).isEmpty();
  }

  @Test
  void missingParentIsReportedAsOrphan() {
    assertThatThrownBy(
            () ->
                WbsTreeBuilder.build(
                    "P1",
                    List.of(
                        wbs("root", null, "1"),
                        wbs("lost", "ghost", "E-1"),
                        wbs("lost-child", "lost", "E-1.1"),
                        wbs("lost-grandchild", "lost-child", "E-1.1.1"))))
        .isInstanceOfSatisfying(
            WbsIntegrityException.class,
            e -> {
              assertThat(e.getProjectId()).isEqualTo("P1");
              assertThat(e.getOrphanIds()).containsExactly("lost");
              assertThat(e.getCycleIds()).isEmpty();
              assertThat(e.getStatusCode().value()).isEqualTo(422);
            });
  }

  @Test
  void parentCycleIsReported() {
    assertThatThrownBy(
            () ->
                WbsTreeBuilder.build(
                    "P1",
                    List.of(
                        wbs("root", null, "1"),
                        wbs("x", "y", "E-1"),
                        wbs("y", "x", "E-2"),
                        wbs("self", "self", "E-3"))))
        .isInstanceOfSatisfying(
            WbsIntegrityException.class,
            e -> {
              assertThat(e.getCycleIds()).containsExactlyInAnyOrder("x", "y", "self");
              assertThat(e.getOrphanIds()).isEmpty();
            });
  }

  @Test
  void onlyElementsOnTheLoopAreReportedAsCyclic() {
    assertThatThrownBy(
            () ->
                WbsTreeBuilder.build(
                    "P1",
                    List.of(
                        wbs("tail", "b", "E-1"),
                        wbs("b", "c", "E-2"),
                        wbs("c", "b", "E-3"),
                        wbs("tail-child", "tail", "E-4"))))
        .isInstanceOfSatisfying(
            WbsIntegrityException.class,
            e -> {
              assertThat(e.getCycleIds()).containsExactly("b", "c");
              assertThat(e.getOrphanIds()).isEmpty();
            });
  }

  @Test
  void duplicateIdIsReported() {
    assertThatThrownBy(
            () ->
                WbsTreeBuilder.build(
                    "P1",
                    List.of(wbs("root", null, "1"), wbs("a", "root", "E"), wbs("a", "root", "P"))))
        .isInstanceOfSatisfying(
            WbsIntegrityException.class, e -> assertThat(e.getDuplicateIds()).containsExactly("a"));
  }

  @Test
  void findPathReturnsRootToTarget() {
    var tree =
        WbsTreeBuilder.build(
            "P1",
            List.of(
                wbs("root", null, "1"),
                wbs("a", "root", "E-1"),
                wbs("a1", "a", "E-1.1"),
                wbs("b", "root", "P-1")));

    assertThat(tree.findPath("a1")).extracting(WbsNode::id).containsExactly("root", "a", "a1");
    assertThat(tree.findPath("root")).extracting(WbsNode::id).containsExactly("root");
    assertThat(tree.findPath("missing")).isEmpty();
  }

  @Test
  void collectsSourceExpandedFlags() {
    var expandedRoot =
        new WbsRecord("root", null, "1", null, "Root", null, null, null, null, true, null);
    var tree = WbsTreeBuilder.build("P1", List.of(expandedRoot, wbs("a", "root", "E-1")));

    assertThat(tree.initiallyExpandedIds()).containsExactly("root");
  }

  static WbsRecord wbs(String id, String parentId, String code) {
    return new WbsRecord(
        id,
        parentId,
        code,
        null,
        "Element " + id,
        BigDecimal.TEN,
        BigDecimal.TEN,
        BigDecimal.TEN,
        BigDecimal.valueOf(100),
        false,
        null);
  }
}
