package works.hit.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Operations on slash-separated HIT paths.
 */
public final class Paths {
	private Paths() {}

	public static final char SEPARATOR = '/';

	/**
	 * @return the canonical form of {@code path}: no repeated or trailing separators,
	 * no leading separator or {@code ./}, and no {@code .} segments.
	 * {@code ..} segments are left alone.
	 */
	public static String norm(String path) {
		return String.join("/", split(path));
	}

	/**
	 * @return {@code parts} joined with separators, then {@link #norm normalized}.
	 * Empty parts contribute nothing.
	 */
	public static String join(String... parts) {
		return norm(String.join("/", parts));
	}

	/**
	 * @return the segments of the normalized form of {@code path}; empty for an empty path
	 */
	public static List<String> split(String path) {
		List<String> result = new ArrayList<>();
		for (String segment: path.split("/")) {
			if (!segment.isEmpty() && !segment.equals(".")) {
				result.add(segment);
			}
		}
		return result;
	}

	/**
	 * @return true if {@code prefix} names {@code path} itself or one of its ancestors.
	 * Both arguments must be normalized. The empty path is a prefix of everything.
	 */
	public static boolean isPrefix(String prefix, String path) {
		if (prefix.isEmpty() || prefix.equals(path)) {
			return true;
		}
		return path.startsWith(prefix) && path.charAt(prefix.length()) == SEPARATOR;
	}

	/**
	 * @return true if any segment of {@code path} is {@code ..}
	 */
	public static boolean hasParentSegment(String path) {
		return Arrays.asList(path.split("/")).contains("..");
	}
}
