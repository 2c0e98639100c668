/**
 * Parser and tree model for HIT, a hierarchical input text format of bracketed sections and fields.
 * <p>
 * Start with {@link works.hit.Hit}.
 * The tree itself lives in {@link works.hit.tree}, tokens and terminal rules in {@link works.hit.lex},
 * and errors in {@link works.hit.exceptions}.
 */
module works.hit.core {
	requires static org.jetbrains.annotations;
	requires org.slf4j;

	exports works.hit;
	exports works.hit.exceptions;
	exports works.hit.lex;
	exports works.hit.tree;
}
