package works.hit;

import works.hit.exceptions.ParseException;
import works.hit.tree.Exploder;
import works.hit.tree.Merger;
import works.hit.tree.Node;
import works.hit.tree.Root;

/**
 * Entry points for reading and reshaping HIT input.
 * <p>
 * HIT is a bracket-delimited format of sections and fields:
 *
 * <pre>
 * [Mesh]
 *   dim = 2
 *   nx = 10
 * [../]
 * </pre>
 *
 * The usual sequence is to {@link #parse} each input, {@link #explode} the resulting trees,
 * {@link #merge} them if there are several, and then read values with
 * {@link Node#param(String, works.hit.tree.ParamType) param}:
 *
 * <pre>
 * Root root = Hit.parse("input.i", "[hello] world=42 []");
 * int world = root.param("hello/world", ParamType.INT); // 42
 * </pre>
 */
public final class Hit {
	private Hit() {}

	/**
	 * @param label names the input in error messages; usually a file name, but can be any string
	 * @return the root of the tree described by {@code input}
	 * @throws ParseException if {@code input} contains any invalid syntax
	 */
	public static Root parse(String label, String input) {
		return parse(label, input, HitConfig.simple());
	}

	/**
	 * @see #parse(String, String)
	 */
	public static Root parse(String label, String input, HitConfig config) {
		return HitParser.parse(label, input, config);
	}

	/**
	 * Validates {@code input} without keeping the tree.
	 *
	 * @throws ParseException if {@code input} contains any invalid syntax
	 */
	public static void check(String label, String input) {
		parse(label, input);
	}

	/**
	 * @see Merger#merge
	 */
	public static void merge(Node from, Node into) {
		Merger.merge(from, into);
	}

	/**
	 * @see Exploder#explode
	 */
	public static void explode(Node node) {
		Exploder.explode(node);
	}

	/**
	 * @return HIT text for {@code node}, indented according to {@code config}
	 */
	public static String render(Node node, HitConfig config) {
		return node.render(0, config.indent());
	}
}
