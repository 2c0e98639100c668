package works.hit.lex;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.hit.exceptions.ParseException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.hit.lex.TokenType.BOOL;
import static works.hit.lex.TokenType.COMMENT;
import static works.hit.lex.TokenType.END_TEXT;
import static works.hit.lex.TokenType.EQUALS;
import static works.hit.lex.TokenType.INLINE_COMMENT;
import static works.hit.lex.TokenType.LEFT_BRACKET;
import static works.hit.lex.TokenType.NUMBER;
import static works.hit.lex.TokenType.PATH;
import static works.hit.lex.TokenType.QUOTED_STRING;
import static works.hit.lex.TokenType.RIGHT_BRACKET;
import static works.hit.lex.TokenType.STRING;

class LexerTest {

	@Test
	void simpleField() {
		List<Token> tokens = Lexer.tokenize("test", "x = 42");
		assertEquals(List.of(PATH, EQUALS, NUMBER, END_TEXT), types(tokens));
		assertEquals("x", tokens.get(0).text());
		assertEquals("42", tokens.get(2).text());
	}

	@Test
	void sectionWithLineNumbers() {
		List<Token> tokens = Lexer.tokenize("test", "[a]\n  b = 'hi there'\n[../]");
		assertEquals(List.of(
			LEFT_BRACKET, PATH, RIGHT_BRACKET,
			PATH, EQUALS, QUOTED_STRING,
			LEFT_BRACKET, PATH, RIGHT_BRACKET,
			END_TEXT
		), types(tokens));
		assertEquals(List.of(1, 1, 1, 2, 2, 2, 3, 3, 3, 3), tokens.stream().map(Token::line).toList());
		assertEquals("'hi there'", tokens.get(5).text());
		assertEquals("../", tokens.get(7).text());
	}

	@Test
	void noWhitespaceNeeded() {
		List<Token> tokens = Lexer.tokenize("test", "[x][y]z=5[../][]");
		assertEquals(List.of(
			LEFT_BRACKET, PATH, RIGHT_BRACKET,
			LEFT_BRACKET, PATH, RIGHT_BRACKET,
			PATH, EQUALS, NUMBER,
			LEFT_BRACKET, PATH, RIGHT_BRACKET,
			LEFT_BRACKET, RIGHT_BRACKET,
			END_TEXT
		), types(tokens));
	}

	@Test
	void offsets() {
		List<Token> tokens = Lexer.tokenize("test", "ab = cd");
		assertEquals(0, tokens.get(0).offset());
		assertEquals(3, tokens.get(1).offset());
		assertEquals(5, tokens.get(2).offset());
		assertEquals(7, tokens.get(3).offset());
	}

	@ParameterizedTest
	@ValueSource(strings = {"true", "TRUE", "yes", "On", "false", "No", "OFF"})
	void booleans(String value) {
		assertEquals(BOOL, valueTokenType(value));
	}

	@ParameterizedTest
	@ValueSource(strings = {"1", "-2", "+3.5", ".5", "7.", "1e5", "1.5E-3", "-0.25e+2"})
	void numbers(String value) {
		assertEquals(NUMBER, valueTokenType(value));
	}

	@ParameterizedTest
	@ValueSource(strings = {"abc", "1.2.3", "1e", "--", "a#b", "12abc", "a]", "truthy", "path/to/file.e"})
	void unquotedStrings(String value) {
		assertEquals(STRING, valueTokenType(value));
	}

	@Test
	void blockAndInlineComments() {
		List<Token> tokens = Lexer.tokenize("test", "# top\nx = 1 # trailing\n  # indented");
		assertEquals(List.of(COMMENT, PATH, EQUALS, NUMBER, INLINE_COMMENT, COMMENT, END_TEXT), types(tokens));
		assertEquals("# top", tokens.get(0).text());
		assertEquals("# trailing", tokens.get(4).text());
		assertEquals(2, tokens.get(4).line());
		assertEquals(3, tokens.get(5).line());
	}

	@Test
	void commentAfterSectionHeaderIsInline() {
		List<Token> tokens = Lexer.tokenize("test", "[a] # about a\n[]");
		assertEquals(INLINE_COMMENT, tokens.get(3).type());
	}

	@Test
	void escapedQuoteDoesNotTerminate() {
		List<Token> tokens = Lexer.tokenize("test", "x = 'it\\'s'");
		assertEquals(QUOTED_STRING, tokens.get(2).type());
		assertEquals("'it\\'s'", tokens.get(2).text());
	}

	@Test
	void doubleQuotes() {
		List<Token> tokens = Lexer.tokenize("test", "x = \"a 'b' c\" y = 1");
		assertEquals("\"a 'b' c\"", tokens.get(2).text());
		assertEquals("y", tokens.get(3).text());
	}

	@Test
	void multilineStringAdvancesLines() {
		List<Token> tokens = Lexer.tokenize("test", "x = 'a\nb'\ny = 2");
		assertEquals(1, tokens.get(2).line(), "A quoted string is located where it starts");
		assertEquals("y", tokens.get(3).text());
		assertEquals(3, tokens.get(3).line());
	}

	@ParameterizedTest
	@ValueSource(strings = {"\n", "\r\n", "\r"})
	void lineBreakStyles(String lineBreak) {
		String input = "a = 1" + lineBreak + "b = 'x" + lineBreak + "y'" + lineBreak + lineBreak + "c = 3";
		List<Token> tokens = Lexer.tokenize("test", input);
		assertEquals(List.of(1, 1, 1, 2, 2, 2, 5, 5, 5, 5), tokens.stream().map(Token::line).toList());

		ParseException e = assertThrows(ParseException.class,
			() -> Lexer.tokenize("test", "a = 1" + lineBreak + lineBreak + "x ! 3"));
		assertEquals(3, e.line());
	}

	@Test
	void emptyInput() {
		assertEquals(List.of(END_TEXT), types(Lexer.tokenize("test", "")));
		assertEquals(List.of(END_TEXT), types(Lexer.tokenize("test", " \n\t\r\n")));
	}

	@Test
	void unterminatedString_reportsOpeningLine() {
		ParseException e = assertThrows(ParseException.class, () -> Lexer.tokenize("test.i", "\nx = 'abc\n\n"));
		assertEquals(2, e.line());
		assertEquals("test.i", e.label());
		assertTrue(e.getMessage().startsWith("test.i:2: unterminated string"), e.getMessage());
	}

	@Test
	void invalidCharacter() {
		ParseException e = assertThrows(ParseException.class, () -> Lexer.tokenize("test.i", "\n\nx ! 3"));
		assertEquals(3, e.line());
		assertTrue(e.getMessage().contains("'!'"), e.getMessage());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"[a",         // unterminated header
		"[a b]",      // two paths in a header
		"[a=1]",      // field in a header
		"x =",        // no value at end of input
		"x = [a] []", // no value before a section
		"x = # c",    // no value before a comment
		"x = \"abc",  // unterminated double-quoted string
		"x = 'abc\\'" // escaped closing quote
	})
	void invalidInput(String input) {
		assertThrows(ParseException.class, () -> Lexer.tokenize("test", input));
	}

	private static TokenType valueTokenType(String value) {
		List<Token> tokens = Lexer.tokenize("test", "x = " + value);
		assertEquals(4, tokens.size(), "Value should be a single token: " + tokens);
		assertEquals(value, tokens.get(2).text());
		return tokens.get(2).type();
	}

	private static List<TokenType> types(List<Token> tokens) {
		return tokens.stream().map(Token::type).toList();
	}
}
