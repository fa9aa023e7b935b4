package org.javai.eg.model;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextTreeTest {

	private EntityRegistry registry;
	private ContextTree tree;

	@BeforeEach
	void setUp() {
		registry = new EntityRegistry();
		tree = new ContextTree(registry);
		cut("c1", SheetOfAssertion.ID);
		cut("c2", "c1");
		cut("c3", "c2");
		cut("d1", SheetOfAssertion.ID);
	}

	private void cut(String id, String parent) {
		registry.add(new Cut(id));
		registry.attach(parent, id);
	}

	@Test
	void depthCountsParentHops() {
		assertThat(tree.depth(SheetOfAssertion.ID)).isZero();
		assertThat(tree.depth("c1")).isEqualTo(1);
		assertThat(tree.depth("c3")).isEqualTo(3);
	}

	@Test
	void polarityFollowsDepthParity() {
		assertThat(tree.isPositive(SheetOfAssertion.ID)).isTrue();
		assertThat(tree.isNegative("c1")).isTrue();
		assertThat(tree.isPositive("c2")).isTrue();
		assertThat(tree.isNegative("c3")).isTrue();
		for (String id : List.of(SheetOfAssertion.ID, "c1", "c2", "c3", "d1")) {
			assertThat(tree.isPositive(id)).isEqualTo(tree.depth(id) % 2 == 0);
		}
	}

	@Test
	void ancestorsStartAtContextAndEndAtSheet() {
		assertThat(tree.ancestors("c3")).containsExactly("c3", "c2", "c1", SheetOfAssertion.ID);
	}

	@Test
	void lowestCommonAncestorOfSiblingBranchesIsSheet() {
		assertThat(tree.lowestCommonAncestor(List.of("c3", "d1"))).contains(SheetOfAssertion.ID);
	}

	@Test
	void lowestCommonAncestorOnOneBranchIsShallowest() {
		assertThat(tree.lowestCommonAncestor(List.of("c3", "c2"))).contains("c2");
		assertThat(tree.lowestCommonAncestor(List.of("c3"))).contains("c3");
		assertThat(tree.lowestCommonAncestor(List.of())).isEmpty();
	}

	@Test
	void cutsBetweenExcludesStopContext() {
		assertThat(tree.cutsBetween("c3", "c1")).containsExactly("c3", "c2");
		assertThat(tree.cutsBetween("c3", SheetOfAssertion.ID)).containsExactly("c3", "c2", "c1");
	}

	@Test
	void isWithinIncludesSelf() {
		assertThat(tree.isWithin("c3", "c1")).isTrue();
		assertThat(tree.isWithin("c1", "c1")).isTrue();
		assertThat(tree.isWithin("d1", "c1")).isFalse();
	}
}
