package works.hit;

import works.hit.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * Options for parsing and rendering HIT text.
 */
public final class HitConfig {
	private final String indent;
	private final int maxNestingDepth;
	private final boolean retainComments;

	private HitConfig(String indent, int maxNestingDepth, boolean retainComments) {
		this.indent = indent;
		this.maxNestingDepth = maxNestingDepth;
		this.retainComments = retainComments;
	}

	/**
	 * @return the defaults: two-space indentation, unbounded nesting, comments retained
	 */
	public static HitConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the text repeated once per nesting level when rendering
	 */
	public String indent() {
		return indent;
	}

	/**
	 * @return the deepest section nesting the parser accepts, or zero for no limit
	 */
	public int maxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * @return whether the parser keeps comments as {@link works.hit.tree.Comment} nodes
	 */
	public boolean retainComments() {
		return retainComments;
	}

	public Builder toBuilder() {
		return new Builder()
			.indent(indent)
			.maxNestingDepth(maxNestingDepth)
			.retainComments(retainComments);
	}

	public static class Builder {
		private String indent;
		private int maxNestingDepth;
		private boolean retainComments;

		Builder() {
			indent = Node.DEFAULT_INDENT;
			maxNestingDepth = 0;
			retainComments = true;
		}

		public Builder indent(String indent) {
			if (!requireNonNull(indent).isBlank()) {
				throw new IllegalArgumentException("Indent must be whitespace: \"" + indent + "\"");
			}
			if (indent.indexOf('\n') >= 0 || indent.indexOf('\r') >= 0) {
				throw new IllegalArgumentException("Indent can't contain line breaks");
			}
			this.indent = indent;
			return this;
		}

		public Builder maxNestingDepth(int maxNestingDepth) {
			if (maxNestingDepth < 0) {
				throw new IllegalArgumentException("maxNestingDepth can't be negative: " + maxNestingDepth);
			}
			this.maxNestingDepth = maxNestingDepth;
			return this;
		}

		public Builder retainComments(boolean retainComments) {
			this.retainComments = retainComments;
			return this;
		}

		public HitConfig build() {
			return new HitConfig(indent, maxNestingDepth, retainComments);
		}

		@Override
		public String toString() {
			return "HitConfig.Builder(indent=\"" + indent + "\", maxNestingDepth=" + maxNestingDepth + ", retainComments=" + retainComments + ")";
		}
	}

	@Override
	public String toString() {
		return "HitConfig(indent=\"" + indent + "\", maxNestingDepth=" + maxNestingDepth + ", retainComments=" + retainComments + ")";
	}

	private static final HitConfig SIMPLE_CONFIG = new HitConfig(Node.DEFAULT_INDENT, 0, true);
}
