package works.hit;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hit.exceptions.ParseException;
import works.hit.lex.Grammar;
import works.hit.lex.Lexer;
import works.hit.lex.Token;
import works.hit.lex.TokenType;
import works.hit.tree.Comment;
import works.hit.tree.Field;
import works.hit.tree.Field.Kind;
import works.hit.tree.Node;
import works.hit.tree.Paths;
import works.hit.tree.Root;
import works.hit.tree.Section;

import static works.hit.lex.TokenType.END_TEXT;
import static works.hit.lex.TokenType.EQUALS;
import static works.hit.lex.TokenType.PATH;
import static works.hit.lex.TokenType.RIGHT_BRACKET;

/**
 * Recursive descent parser for HIT text.
 *
 * <p>Grammar:
 *
 * <pre>
 * root       := body END_TEXT
 * body       := (field | section | comment)*
 * section    := '[' PATH ']' body '[' CLOSING_PATH? ']'
 * field      := PATH '=' value
 * value      := NUMBER | BOOL | STRING | QUOTED_STRING
 * </pre>
 *
 * where {@code CLOSING_PATH} is {@code ../}.
 */
final class HitParser {
	private final String label;
	private final HitConfig config;
	private final List<Token> tokens;
	private int pos;

	private HitParser(String label, HitConfig config, List<Token> tokens) {
		this.label = label;
		this.config = config;
		this.tokens = tokens;
		this.pos = 0;
	}

	/**
	 * @throws ParseException if {@code input} is not valid HIT
	 */
	static Root parse(String label, String input, HitConfig config) {
		List<Token> tokens = Lexer.tokenize(label, input);
		LOGGER.debug("Parsing {} ({} tokens)", label, tokens.size());
		HitParser parser = new HitParser(label, config, tokens);
		Root root = new Root();
		for (Node child: parser.parseBody(null, 0)) {
			root.addChild(child);
		}
		parser.expect(END_TEXT, "end of input");
		return root;
	}

	/**
	 * Parses entries until the end of the enclosing section, or the end of input at the top level.
	 * Leaves the terminator unconsumed.
	 *
	 * @param header the name token of the enclosing section, or null at the top level
	 */
	private List<Node> parseBody(@Nullable Token header, int depth) {
		List<Node> result = new ArrayList<>();
		while (true) {
			Token token = peek();
			switch (token.type()) {
				case END_TEXT -> {
					if (header != null) {
						throw error(header, "missing terminator for section '" + header.text() + "'");
					}
					return result;
				}
				case COMMENT, INLINE_COMMENT -> {
					advance();
					if (config.retainComments()) {
						result.add(new Comment(token.text(), token.type() == TokenType.INLINE_COMMENT, List.of(token)));
					}
				}
				case PATH -> result.add(parseField());
				case LEFT_BRACKET -> {
					if (isTerminatorAhead()) {
						if (header == null) {
							throw error(token, "section terminator without a matching section header");
						}
						return result;
					}
					result.add(parseSection(depth + 1));
				}
				case EQUALS -> throw error(token, "missing field name before '='");
				case RIGHT_BRACKET -> throw error(token, "unexpected ']'");
				default -> throw error(token, "unexpected " + token.type() + " '" + token.text() + "'");
			}
		}
	}

	private Section parseSection(int depth) {
		List<Token> sectionTokens = new ArrayList<>();
		Token opening = advance();
		sectionTokens.add(opening);
		Token header = expect(PATH, "section name");
		sectionTokens.add(header);
		sectionTokens.add(expect(RIGHT_BRACKET, "']'"));

		if (Paths.norm(header.text()).isEmpty() || Paths.hasParentSegment(header.text())) {
			throw error(header, "invalid section name '" + header.text() + "'");
		}
		if (config.maxNestingDepth() > 0 && depth > config.maxNestingDepth()) {
			throw error(opening, "section '" + header.text() + "' is nested more than " + config.maxNestingDepth() + " levels deep");
		}

		List<Node> children = parseBody(header, depth);

		// parseBody only returns at a terminator
		sectionTokens.add(advance());
		if (peek().type() == PATH) {
			sectionTokens.add(advance());
		}
		sectionTokens.add(expect(RIGHT_BRACKET, "']'"));

		Section section = new Section(header.text(), sectionTokens);
		for (Node child: children) {
			section.addChild(child);
		}
		return section;
	}

	private Field parseField() {
		Token name = advance();
		Token equals = peek();
		if (equals.type() != EQUALS) {
			throw error(name, "missing '=' after field name '" + name.text() + "'");
		}
		advance();
		Token value = advance();
		if (!value.type().isValue()) {
			throw error(value, "missing value for field '" + name.text() + "'");
		}
		return new Field(name.text(), kindOf(value), valueText(value), List.of(name, equals, value));
	}

	/**
	 * @return true if the next tokens are {@code []} or {@code [../]}
	 */
	private boolean isTerminatorAhead() {
		Token next = peek(1);
		if (next.type() == RIGHT_BRACKET) {
			return true;
		}
		return next.type() == PATH
			&& next.text().equals(Grammar.CLOSING_PATH)
			&& peek(2).type() == RIGHT_BRACKET;
	}

	static Kind kindOf(Token value) {
		return switch (value.type()) {
			case BOOL -> Kind.BOOL;
			case NUMBER -> Grammar.isInt(value.text()) ? Kind.INT : Kind.FLOAT;
			case STRING, QUOTED_STRING -> Kind.STRING;
			default -> throw new IllegalArgumentException("Not a value token: " + value);
		};
	}

	/**
	 * Quoted strings lose their quotes, and escaped quotes lose their backslash.
	 */
	static String valueText(Token value) {
		if (value.type() != TokenType.QUOTED_STRING) {
			return value.text();
		}
		String text = value.text();
		String quote = text.substring(0, 1);
		return text.substring(1, text.length() - 1).replace("\\" + quote, quote);
	}

	private Token peek() {
		return peek(0);
	}

	/**
	 * The token list always ends with {@link TokenType#END_TEXT END_TEXT},
	 * which is returned for any position past the end.
	 */
	private Token peek(int lookahead) {
		int index = pos + lookahead;
		if (index < 0 || index >= tokens.size()) {
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(index);
	}

	private Token advance() {
		Token result = peek();
		if (pos < tokens.size() - 1) {
			pos++;
		}
		return result;
	}

	private Token expect(TokenType type, String description) {
		Token token = peek();
		if (token.type() != type) {
			throw error(token, "expecting " + description + " but found " + describe(token));
		}
		return advance();
	}

	private static String describe(Token token) {
		if (token.type() == END_TEXT) {
			return "end of input";
		} else {
			return "'" + token.text() + "'";
		}
	}

	private ParseException error(Token token, String message) {
		return new ParseException(label, token.line(), message);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HitParser.class);
}
