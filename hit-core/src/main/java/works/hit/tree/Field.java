package works.hit.tree;

import java.util.List;
import java.util.function.Function;
import works.hit.exceptions.ValueException;
import works.hit.lex.Grammar;
import works.hit.lex.Token;
import works.hit.lex.TokenType;

import static java.util.Objects.requireNonNull;

/**
 * A name/value pair, written as {@code name = value}.
 * <p>
 * The value is always kept as the raw text from the input (minus any quotes),
 * or as last passed to {@link #setVal}.
 * The {@link #kind() kind} records how that text was classified, but it's only a hint:
 * every accessor parses the raw text, so a {@link Kind#STRING STRING} field holding {@code "42"}
 * can be read with {@link #intVal()}, and {@link #strVal()} works for every kind.
 */
public final class Field extends Node {
	public enum Kind {
		NONE,
		INT,
		FLOAT,
		BOOL,
		STRING,
	}

	private final String name;
	private Kind kind;
	private String val;

	public Field(String name, Kind kind, String val) {
		this(name, kind, val, List.of());
	}

	public Field(String name, Kind kind, String val, List<Token> tokens) {
		super(NodeType.FIELD, tokens);
		this.name = requireNonNull(name);
		this.kind = requireNonNull(kind);
		this.val = requireNonNull(val);
		if (Paths.norm(name).isEmpty()) {
			throw new IllegalArgumentException("Field name can't be empty: \"" + name + "\"");
		}
		checkWritable(val, kind);
	}

	/**
	 * @return the field name, exactly as written before the {@code =}
	 */
	@Override
	public String path() {
		return name;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * @return the raw text of the value
	 */
	public String val() {
		return val;
	}

	/**
	 * Overwrites the value. The kind becomes {@link Kind#NONE NONE}.
	 */
	public void setVal(String val) {
		setVal(val, Kind.NONE);
	}

	/**
	 * Overwrites the value and kind. The kind is not checked against the value:
	 * a {@link Kind#BOOL BOOL} field set to {@code "42"} will fail {@link #boolVal()}.
	 *
	 * @throws IllegalArgumentException if {@code val} can't be {@link #renderValue() rendered}
	 */
	public void setVal(String val, Kind kind) {
		checkWritable(requireNonNull(val), requireNonNull(kind));
		this.val = val;
		this.kind = kind;
	}

	/**
	 * HIT has no escape for a backslash, so a quoted value can't end with one:
	 * the closing quote would read as escaped.
	 */
	private static void checkWritable(String val, Kind kind) {
		if (val.endsWith("\\") && needsQuotes(val, kind)) {
			throw new IllegalArgumentException("A value that must be quoted can't end with a backslash: \"" + val + "\"");
		}
	}

	@Override
	public boolean boolVal() {
		return convert("bool", Coercions::toBool);
	}

	@Override
	public int intVal() {
		return convert("int", Coercions::toInt);
	}

	@Override
	public long longVal() {
		return convert("long", Coercions::toLong);
	}

	@Override
	public double floatVal() {
		return convert("float", Coercions::toFloat);
	}

	@Override
	public String strVal() {
		return val;
	}

	@Override
	public List<Integer> vecIntVal() {
		return convert("int vector", s -> Coercions.toVector(s, Coercions::toInt));
	}

	@Override
	public List<Double> vecFloatVal() {
		return convert("float vector", s -> Coercions.toVector(s, Coercions::toFloat));
	}

	@Override
	public List<Boolean> vecBoolVal() {
		return convert("bool vector", s -> Coercions.toVector(s, Coercions::toBool));
	}

	@Override
	public List<String> vecStrVal() {
		return Coercions.split(val);
	}

	private <T> T convert(String typeName, Function<String, T> conversion) {
		try {
			return conversion.apply(val);
		} catch (IllegalArgumentException e) {
			throw new ValueException("field " + describe(this) + " holds non-" + typeName + " value '" + val + "'", e);
		}
	}

	@Override
	Node shallowCopy() {
		return new Field(name, kind, val, tokens());
	}

	@Override
	public String render(int indentLevel, String indentText) {
		return newline(indentLevel, indentText) + name + " = " + renderValue();
	}

	/**
	 * Values are written unquoted when the lexer would read them back unchanged,
	 * with the same kind; otherwise they're quoted.
	 * Only the chosen quote is escaped. A backslash before any other char is literal,
	 * and a value that needs quotes never ends with a backslash, since the constructor
	 * and {@link #setVal} reject it.
	 */
	String renderValue() {
		if (!needsQuotes(val, kind)) {
			return val;
		}
		char quote = (val.indexOf('\'') >= 0 && val.indexOf('"') < 0) ? '"' : '\'';
		String escaped = val.replace(String.valueOf(quote), "\\" + quote);
		return quote + escaped + quote;
	}

	private static boolean needsQuotes(String val, Kind kind) {
		if (val.isEmpty() || Grammar.isQuote(val.charAt(0)) || val.charAt(0) == '#') {
			return true;
		}
		for (int i = 0; i < val.length(); i++) {
			if (!Grammar.isUnquotedValueChar(val.charAt(i))) {
				return true;
			}
		}
		return kind == Kind.STRING && Grammar.classifyUnquoted(val) != TokenType.STRING;
	}
}
