package works.hit.tree;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Names a Java type that a value can be extracted as, along with how to extract it.
 * Passed to {@link Node#param(String, ParamType) param} and
 * {@link Node#paramOptional(String, ParamType, Object) paramOptional}.
 */
public final class ParamType<T> {
	public static final ParamType<Boolean> BOOL = new ParamType<>("bool", Node::boolVal);
	public static final ParamType<Integer> INT = new ParamType<>("int", Node::intVal);
	public static final ParamType<Long> LONG = new ParamType<>("long", Node::longVal);
	public static final ParamType<Double> FLOAT = new ParamType<>("float", Node::floatVal);
	public static final ParamType<String> STRING = new ParamType<>("string", Node::strVal);
	public static final ParamType<List<Integer>> INT_VECTOR = new ParamType<>("int vector", Node::vecIntVal);
	public static final ParamType<List<Double>> FLOAT_VECTOR = new ParamType<>("float vector", Node::vecFloatVal);
	public static final ParamType<List<Boolean>> BOOL_VECTOR = new ParamType<>("bool vector", Node::vecBoolVal);
	public static final ParamType<List<String>> STRING_VECTOR = new ParamType<>("string vector", Node::vecStrVal);

	private final String name;
	private final Function<Node, T> extractor;

	private ParamType(String name, Function<Node, T> extractor) {
		this.name = name;
		this.extractor = extractor;
	}

	/**
	 * @throws works.hit.exceptions.ValueException if {@code node} holds no value
	 * or its value can't be represented as this type
	 */
	public T extract(Node node) {
		return extractor.apply(requireNonNull(node));
	}

	public String name() {
		return name;
	}

	@Override
	public String toString() {
		return "ParamType(" + name + ")";
	}
}
