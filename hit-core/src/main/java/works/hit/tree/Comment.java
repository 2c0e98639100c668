package works.hit.tree;

import java.util.List;
import works.hit.lex.Token;

import static java.util.Objects.requireNonNull;

/**
 * A comment like {@code # some text}. Not addressable by path and holds no value.
 */
public final class Comment extends Node {
	public static final boolean INLINE = true;
	public static final boolean BLOCK = false;

	private final String text;
	private final boolean isInline;

	/**
	 * @param text including the leading {@code #}
	 * @param isInline true if the comment shares a line with the preceding text
	 */
	public Comment(String text, boolean isInline) {
		this(text, isInline, List.of());
	}

	public Comment(String text, boolean isInline, List<Token> tokens) {
		super(NodeType.COMMENT, tokens);
		this.text = requireNonNull(text);
		this.isInline = isInline;
		if (!text.startsWith("#") || text.indexOf('\n') >= 0) {
			throw new IllegalArgumentException("Comment must be a single line starting with '#': \"" + text + "\"");
		}
	}

	public String text() {
		return text;
	}

	public boolean isInline() {
		return isInline;
	}

	@Override
	Node shallowCopy() {
		return new Comment(text, isInline, tokens());
	}

	@Override
	public String render(int indentLevel, String indentText) {
		if (isInline) {
			return " " + text;
		} else {
			return newline(indentLevel, indentText) + text;
		}
	}
}
