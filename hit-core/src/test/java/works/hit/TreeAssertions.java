package works.hit;

import java.util.List;
import works.hit.tree.Comment;
import works.hit.tree.Field;
import works.hit.tree.Node;
import works.hit.tree.NodeType;
import works.hit.tree.Paths;
import works.hit.tree.Section;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Structural comparison of trees: node types, paths, values, kinds, comments and child order.
 * Tokens and line numbers are ignored.
 */
public final class TreeAssertions {
	private TreeAssertions() {}

	public static void assertStructurallyEqual(Node expected, Node actual) {
		assertStructurallyEqual(expected, actual, "/");
	}

	private static void assertStructurallyEqual(Node expected, Node actual, String where) {
		assertEquals(expected.type(), actual.type(), "type at " + where);
		assertEquals(expected.path(), actual.path(), "path at " + where);
		assertEquals(expected.fullpath(), actual.fullpath(), "fullpath at " + where);
		switch (expected.type()) {
			case FIELD -> {
				Field e = (Field) expected;
				Field a = (Field) actual;
				assertEquals(e.val(), a.val(), "value at " + where);
				assertEquals(e.kind(), a.kind(), "kind at " + where);
			}
			case COMMENT -> {
				Comment e = (Comment) expected;
				Comment a = (Comment) actual;
				assertEquals(e.text(), a.text(), "comment at " + where);
				assertEquals(e.isInline(), a.isInline(), "comment placement at " + where);
			}
			case SECTION -> assertEquals(((Section) expected).path(), ((Section) actual).path());
			default -> { }
		}
		List<Node> expectedChildren = expected.children();
		List<Node> actualChildren = actual.children();
		assertEquals(expectedChildren.size(), actualChildren.size(), "number of children at " + where);
		for (int i = 0; i < expectedChildren.size(); i++) {
			assertStructurallyEqual(expectedChildren.get(i), actualChildren.get(i), where + i + "/");
		}
	}

	/**
	 * Checks that every node's fullpath is its parent's fullpath joined with its own path.
	 */
	public static void assertPathInvariant(Node root) {
		root.walk((fullpath, nodepath, node) -> {
			Node parent = node.parent();
			if (parent != null) {
				assertEquals(Paths.join(parent.fullpath(), node.path()), fullpath,
					"fullpath of " + node);
			}
		}, NodeType.ALL);
	}
}
