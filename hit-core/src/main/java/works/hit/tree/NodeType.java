package works.hit.tree;

import java.util.Locale;

/**
 * Every kind of element in a parsed HIT tree.
 */
public enum NodeType {
	/**
	 * Matches every node when used as a filter for {@link Node#walk} or {@link Node#children(NodeType)}.
	 * No node has this type.
	 */
	ALL,
	ROOT,
	SECTION,
	COMMENT,
	FIELD,
	;

	public boolean matches(NodeType actual) {
		return this == ALL || this == actual;
	}

	/**
	 * @return a lowercase name suitable for messages
	 */
	public String displayName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
