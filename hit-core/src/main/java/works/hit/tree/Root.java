package works.hit.tree;

import java.util.List;

/**
 * The anchor of a HIT tree. Holds no value and contributes nothing to paths.
 */
public final class Root extends Node {
	public Root() {
		super(NodeType.ROOT, List.of());
	}

	@Override
	Node shallowCopy() {
		return new Root();
	}

	@Override
	public String render(int indentLevel, String indentText) {
		StringBuilder sb = new StringBuilder();
		for (Node child: children) {
			sb.append(child.render(indentLevel, indentText));
		}
		if (sb.length() > 0 && sb.charAt(0) == '\n') {
			sb.deleteCharAt(0);
		}
		return sb.toString();
	}
}
