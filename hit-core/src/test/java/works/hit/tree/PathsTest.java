package works.hit.tree;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class PathsTest {

	static Stream<Arguments> normCases() {
		return Stream.of(
			arguments("a/b", "a/b"),
			arguments("a//b/", "a/b"),
			arguments("./a/b", "a/b"),
			arguments("/a", "a"),
			arguments("a/./b", "a/b"),
			arguments(".", ""),
			arguments("", ""),
			arguments("///", ""),
			arguments("a/../b", "a/../b")
		);
	}

	@ParameterizedTest
	@MethodSource("normCases")
	void norm(String input, String expected) {
		assertEquals(expected, Paths.norm(input));
		assertEquals(expected, Paths.norm(expected), "Normalization is idempotent");
	}

	@Test
	void join() {
		assertEquals("a/b/c", Paths.join("a", "b/c"));
		assertEquals("b", Paths.join("", "b"));
		assertEquals("a", Paths.join("a", ""));
		assertEquals("a/b", Paths.join("a/", "/b/"));
		assertEquals("", Paths.join());
	}

	@Test
	void split() {
		assertEquals(List.of("a", "b", "c"), Paths.split("./a//b/c/"));
		assertEquals(List.of(), Paths.split(""));
	}

	@Test
	void isPrefix() {
		assertTrue(Paths.isPrefix("", "a/b"));
		assertTrue(Paths.isPrefix("a", "a/b"));
		assertTrue(Paths.isPrefix("a/b", "a/b"));
		assertFalse(Paths.isPrefix("a", "ab/c"));
		assertFalse(Paths.isPrefix("a/b", "a"));
		assertFalse(Paths.isPrefix("b", "a/b"));
	}

	@Test
	void hasParentSegment() {
		assertTrue(Paths.hasParentSegment("../"));
		assertTrue(Paths.hasParentSegment("a/../b"));
		assertFalse(Paths.hasParentSegment("a..b/c"));
		assertFalse(Paths.hasParentSegment("a/b"));
	}
}
