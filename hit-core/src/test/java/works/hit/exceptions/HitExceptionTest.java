package works.hit.exceptions;

import org.junit.jupiter.api.Test;
import works.hit.Hit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HitExceptionTest {

	@Test
	void parseExceptionMessage() {
		ParseException e = new ParseException("input.i", 7, "something's wrong");
		assertEquals("input.i:7: something's wrong", e.getMessage());
		assertEquals("input.i", e.label());
		assertEquals(7, e.line());
	}

	@Test
	void wrap_parseException() {
		ParseException original = assertThrows(ParseException.class, () -> Hit.parse("in.i", "\n[a]"));
		ParseException wrapped = HitException.wrap(original, "Reading overrides");

		assertEquals("Reading overrides: " + original.getMessage(), wrapped.getMessage());
		assertEquals("in.i", wrapped.label());
		assertEquals(2, wrapped.line());
		assertSame(original, wrapped.getCause());
	}

	@Test
	void wrap_valueException() {
		ValueException original = new ValueException("no parameter named 'x'");
		ValueException wrapped = HitException.wrap(original, "Mesh");

		assertEquals("Mesh: no parameter named 'x'", wrapped.getMessage());
		assertSame(original, wrapped.getCause());
	}
}
