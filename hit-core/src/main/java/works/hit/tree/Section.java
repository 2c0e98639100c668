package works.hit.tree;

import java.util.List;
import works.hit.lex.Grammar;
import works.hit.lex.Token;

import static java.util.Objects.requireNonNull;

/**
 * A named container, written as {@code [name] ... [../]}.
 * <p>
 * The name can have several segments, as in {@code [a/b]},
 * in which case the section is found by {@link Node#find find("a/b")} just as if it were nested.
 */
public final class Section extends Node {
	private final String header;
	private final String path;

	public Section(String header) {
		this(header, List.of());
	}

	/**
	 * @param header the section name as written between the brackets
	 * @param tokens the tokens of both the header and the terminator
	 */
	public Section(String header, List<Token> tokens) {
		super(NodeType.SECTION, tokens);
		this.header = requireNonNull(header);
		this.path = Paths.norm(header);
		if (path.isEmpty()) {
			throw new IllegalArgumentException("Section name can't be empty: \"" + header + "\"");
		}
	}

	/**
	 * @return the normalized section name
	 */
	@Override
	public String path() {
		return path;
	}

	/**
	 * @return the section name exactly as written
	 */
	public String header() {
		return header;
	}

	@Override
	Node shallowCopy() {
		return new Section(header, tokens());
	}

	@Override
	public String render(int indentLevel, String indentText) {
		StringBuilder sb = new StringBuilder();
		sb.append(newline(indentLevel, indentText)).append('[').append(header).append(']');
		for (Node child: children) {
			sb.append(child.render(indentLevel + 1, indentText));
		}
		sb.append(newline(indentLevel, indentText)).append('[').append(Grammar.CLOSING_PATH).append(']');
		return sb.toString();
	}
}
