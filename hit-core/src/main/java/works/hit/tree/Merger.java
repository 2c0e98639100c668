package works.hit.tree;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deep union of two trees, keyed by path.
 */
public final class Merger {
	private Merger() {}

	/**
	 * Merges the tree under {@code from} into the tree under {@code into}.
	 * <p>
	 * Each node under {@code from} is identified by its path relative to {@code from},
	 * and the node at the same path relative to {@code into} is located with {@link Node#find}.
	 * Paths are compared after joining, so {@code [a/b]} and {@code [a] [b]} name the same section
	 * whichever tree each spelling appears in.
	 * <ul>
	 *     <li>
	 *         if there is no node at that path, a {@link Node#clone clone} of the node is appended
	 *         to the deepest existing section on its path, or to {@code into} if there is none,
	 *         inside new sections for whatever segments are missing in between;
	 *     </li>
	 *     <li>
	 *         if both are sections, their children are merged recursively, so the section in {@code into}
	 *         keeps its position and the order of its existing children; and
	 *     </li>
	 *     <li>
	 *         otherwise, the node in {@code into} is replaced, in the same position,
	 *         by a clone of the node from {@code from}.
	 *     </li>
	 * </ul>
	 * Comments in {@code from} have no path and are only carried along inside cloned subtrees.
	 * <p>
	 * {@code from} is not modified. Cloned nodes keep their tokens, so their line numbers
	 * refer to the input that {@code from} was parsed from.
	 *
	 * @param from a {@link Root} or {@link Section}
	 * @param into a {@link Root} or {@link Section}
	 */
	public static void merge(Node from, Node into) {
		requireContainer(from, "from");
		requireContainer(into, "into");
		if (from == into) {
			return;
		}
		LOGGER.debug("Merging {} into {}", from, into);
		mergeChildren(from, "", into);
	}

	/**
	 * @param prefix the path of {@code from} relative to the node originally passed as {@code from}
	 * @param into the node originally passed as {@code into}; all lookups are relative to it
	 */
	private static void mergeChildren(Node from, String prefix, Node into) {
		// Snapshot: from could be a subtree of into
		List<Node> children = from.children();
		for (Node child: children) {
			if (child.type() == NodeType.COMMENT) {
				continue;
			}
			String path = Paths.join(prefix, child.path());
			Node target = into.find(path);
			if (target == null) {
				if (child.type() == NodeType.SECTION && hasSectionBelow(into, "", path)) {
					mergeChildren(child, path, into);
				} else {
					LOGGER.trace("Adding {}", child);
					append(child, path, into);
				}
			} else if (child.type() == NodeType.SECTION && target.type() == NodeType.SECTION) {
				mergeChildren(child, path, into);
			} else {
				LOGGER.trace("Overwriting {}", target);
				Node parent = target.parent();
				assert parent != null: "find never returns the receiver for a non-empty path";
				parent.replaceChild(target, copyAs(child, Paths.norm(target.path())));
			}
		}
	}

	/**
	 * @return true if some section under {@code container} lies strictly below {@code path}
	 */
	private static boolean hasSectionBelow(Node container, String prefix, String path) {
		for (Node child: container.children(NodeType.SECTION)) {
			String joined = Paths.join(prefix, child.path());
			if (Paths.isPrefix(path, joined) && !joined.equals(path)) {
				return true;
			} else if (Paths.isPrefix(joined, path) && hasSectionBelow(child, joined, path)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Adds a copy of {@code node} so that it's found at {@code path} relative to {@code into}.
	 * New sections created for missing segments get the tokens of {@code node}.
	 */
	private static void append(Node node, String path, Node into) {
		List<String> segments = Paths.split(path);
		Node container = into;
		int found = 0;
		for (int depth = segments.size() - 1; depth > 0; depth--) {
			Node candidate = into.find(String.join("/", segments.subList(0, depth)));
			if (candidate != null && candidate.type() == NodeType.SECTION) {
				container = candidate;
				found = depth;
				break;
			}
		}
		List<String> remainder = segments.subList(found, segments.size());
		int ownSegments = Math.min(Paths.split(node.path()).size(), remainder.size());
		for (String segment: remainder.subList(0, remainder.size() - ownSegments)) {
			Section section = new Section(segment, node.tokens());
			container.addChild(section);
			container = section;
		}
		container.addChild(copyAs(node, String.join("/", remainder.subList(remainder.size() - ownSegments, remainder.size()))));
	}

	/**
	 * @return a deep copy of {@code node} whose own path is {@code path}
	 */
	private static Node copyAs(Node node, String path) {
		if (Paths.norm(node.path()).equals(path)) {
			return node.clone();
		} else if (node instanceof Field field) {
			return new Field(path, field.kind(), field.val(), field.tokens());
		} else if (node instanceof Section) {
			Section result = new Section(path, node.tokens());
			for (Node child: node.children) {
				result.addChild(child.clone());
			}
			return result;
		} else {
			throw new IllegalArgumentException("Can't rename " + node.type().displayName() + " node " + Node.describe(node));
		}
	}

	private static void requireContainer(Node node, String role) {
		switch (node.type()) {
			case ROOT, SECTION -> { }
			default -> throw new IllegalArgumentException(
				"Can only merge sections and roots; \"" + role + "\" is a " + node.type().displayName());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Merger.class);
}
