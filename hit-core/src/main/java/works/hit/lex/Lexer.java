package works.hit.lex;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hit.exceptions.ParseException;

import static works.hit.lex.TokenType.END_TEXT;
import static works.hit.lex.TokenType.EQUALS;
import static works.hit.lex.TokenType.LEFT_BRACKET;
import static works.hit.lex.TokenType.PATH;
import static works.hit.lex.TokenType.QUOTED_STRING;
import static works.hit.lex.TokenType.RIGHT_BRACKET;

/**
 * Converts HIT text into a list of {@link Token}s.
 * <p>
 * The grammar is context-sensitive at the lexical level:
 * the characters allowed in a value differ from those allowed in a path,
 * so the lexer tracks whether it is inside brackets, after an {@code =}, or neither.
 * <p>
 * Whitespace is not emitted; comments are, so that they can be retained in the tree.
 */
public final class Lexer {
	private final String label;
	final char[] chars;
	int pos = 0;
	int line = 1;

	/**
	 * The line on which the most recent non-comment token ended,
	 * used to tell inline comments from block comments.
	 */
	private int lastTokenLine = 0;

	private final List<Token> tokens = new ArrayList<>();

	private Lexer(String label, char[] chars) {
		this.label = label;
		this.chars = chars;
	}

	/**
	 * @param label names the input in error messages; can be any string
	 * @return all tokens in {@code input}, always ending with {@link TokenType#END_TEXT}
	 * @throws ParseException if {@code input} contains a character or construct that is not valid HIT
	 */
	public static List<Token> tokenize(String label, String input) {
		Lexer lexer = new Lexer(label, input.toCharArray());
		lexer.lexAll();
		LOGGER.trace("{}: {} tokens", label, lexer.tokens.size());
		return lexer.tokens;
	}

	private void lexAll() {
		while (true) {
			skipWhitespace();
			int c = peekRawChar();
			if (c == -1) {
				emit(END_TEXT, pos, pos);
				return;
			} else if (c == '#') {
				lexComment();
			} else if (c == '[') {
				emitFixed(LEFT_BRACKET);
				lexBracketContents();
			} else if (c == ']') {
				// Parser reports this with better context
				emitFixed(RIGHT_BRACKET);
			} else if (c == '=') {
				emitFixed(EQUALS);
				lexValue();
			} else if (Grammar.isPathChar(c)) {
				lexPath();
			} else {
				throw error(line, "invalid character '" + describe(c) + "'");
			}
		}
	}

	/**
	 * After a {@code [}: an optional path, then {@code ]}.
	 */
	private void lexBracketContents() {
		int headerLine = line;
		skipWhitespace();
		if (Grammar.isPathChar(peekRawChar())) {
			lexPath();
			skipWhitespace();
		}
		int c = peekRawChar();
		if (c == ']') {
			emitFixed(RIGHT_BRACKET);
		} else if (c == -1) {
			throw error(headerLine, "unterminated section header; expecting ']'");
		} else {
			throw error(line, "invalid character '" + describe(c) + "' in section header");
		}
	}

	private void lexPath() {
		int start = pos;
		while (Grammar.isPathChar(peekRawChar())) {
			pos++;
		}
		emit(PATH, start, pos);
	}

	/**
	 * After an {@code =}: exactly one value.
	 */
	private void lexValue() {
		skipWhitespace();
		int c = peekRawChar();
		if (c == -1 || c == '[' || c == '#') {
			throw error(line, "missing value after '='");
		} else if (Grammar.isQuote(c)) {
			lexQuotedString((char) c);
		} else {
			int start = pos;
			while (Grammar.isUnquotedValueChar(peekRawChar())) {
				pos++;
			}
			String text = new String(chars, start, pos - start);
			emit(Grammar.classifyUnquoted(text), start, pos);
		}
	}

	private void lexQuotedString(char quote) {
		int start = pos;
		int startLine = line;
		pos++; // Skip opening quote
		while (true) {
			if (pos >= chars.length) {
				throw error(startLine, "unterminated string; expecting " + quote);
			}
			char c = chars[pos++];
			if (c == quote) {
				break;
			} else if (c == '\\' && pos < chars.length && chars[pos] == quote) {
				pos++;
			} else if (endsLine(pos - 1)) {
				line++;
			}
		}
		tokens.add(new Token(QUOTED_STRING, new String(chars, start, pos - start), start, startLine));
		lastTokenLine = line;
	}

	private void lexComment() {
		int start = pos;
		while (pos < chars.length && chars[pos] != '\n' && chars[pos] != '\r') {
			pos++;
		}
		TokenType type = (lastTokenLine == line) ? TokenType.INLINE_COMMENT : TokenType.COMMENT;
		tokens.add(new Token(type, new String(chars, start, pos - start), start, line));
	}

	private void skipWhitespace() {
		while (Grammar.isWhitespace(peekRawChar())) {
			if (endsLine(pos)) {
				line++;
			}
			pos++;
		}
	}

	/**
	 * Line breaks are {@code \n}, {@code \r\n} or a lone {@code \r}.
	 *
	 * @return true if the char at {@code index} is the last char of a line break
	 */
	private boolean endsLine(int index) {
		char c = chars[index];
		if (c == '\n') {
			return true;
		}
		return c == '\r' && (index + 1 >= chars.length || chars[index + 1] != '\n');
	}

	/**
	 * @return the next char, or -1 at end of input
	 */
	private int peekRawChar() {
		if (pos >= chars.length) {
			return -1;
		} else {
			return chars[pos];
		}
	}

	private void emitFixed(TokenType type) {
		int start = pos;
		pos += type.fixedRepresentation().length();
		emit(type, start, pos);
	}

	private void emit(TokenType type, int start, int end) {
		tokens.add(new Token(type, new String(chars, start, end - start), start, line));
		lastTokenLine = line;
	}

	private ParseException error(int atLine, String message) {
		return new ParseException(label, atLine, message);
	}

	private static String describe(int c) {
		if (Character.isISOControl(c)) {
			return "\\u" + String.format("%04x", c);
		} else {
			return String.valueOf((char) c);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);
}
