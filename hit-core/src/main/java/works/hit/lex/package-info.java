/**
 * Turns HIT text into tokens.
 * Not usually used directly; {@link works.hit.Hit#parse} calls this layer.
 */
package works.hit.lex;
