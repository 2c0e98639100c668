package works.hit.tree;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites fields with multi-segment names into nested sections.
 */
public final class Exploder {
	private Exploder() {}

	/**
	 * Converts every field under {@code node} whose name has several segments into
	 * sections containing a field named by the last segment.
	 * For example, {@code foo/bar=42} becomes {@code [foo] bar=42 [../]}.
	 * <p>
	 * If a section of the right name already exists, the field is moved into it (at the end)
	 * rather than creating a new section.
	 * A new section created directly under the field's container takes the field's position.
	 * New sections get the tokens of the field that caused them, so they report its line.
	 * <p>
	 * Exploding an exploded tree changes nothing.
	 *
	 * @throws IllegalArgumentException if a field name contains a {@code ..} segment;
	 * that text closes sections and can't become part of a path
	 */
	public static void explode(Node node) {
		for (Node child: node.children()) {
			switch (child.type()) {
				case SECTION -> explode(child);
				case FIELD -> explodeField(node, (Field) child);
				default -> { }
			}
		}
	}

	private static void explodeField(Node container, Field field) {
		String name = field.path();
		if (Paths.hasParentSegment(name)) {
			throw new IllegalArgumentException("Field name can't contain '..': " + Node.describe(field));
		}
		List<String> segments = Paths.split(name);
		if (segments.size() <= 1) {
			return;
		}
		LOGGER.trace("Exploding {}", field);
		int index = container.indexOf(field);
		container.removeChild(field);

		Node current = container;
		for (int i = 0; i < segments.size() - 1; i++) {
			String segment = segments.get(i);
			Node section = childSection(current, segment);
			if (section == null) {
				section = new Section(segment, field.tokens());
				if (current == container) {
					current.insertChild(index, section);
				} else {
					current.addChild(section);
				}
			}
			current = section;
		}
		current.addChild(new Field(segments.get(segments.size() - 1), field.kind(), field.val(), field.tokens()));
	}

	private static @Nullable Node childSection(Node parent, String name) {
		for (Node child: parent.children) {
			if (child.type() == NodeType.SECTION && child.path().equals(name)) {
				return child;
			}
		}
		return null;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Exploder.class);
}
