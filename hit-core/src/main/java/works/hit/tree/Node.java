package works.hit.tree;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.hit.exceptions.ValueException;
import works.hit.lex.Token;

import static java.util.Objects.requireNonNull;

/**
 * An element of a parsed HIT tree.
 * <p>
 * Each node has at most one {@link #parent() parent} and an ordered list of
 * {@link #children() children}, which it owns: a node can't be the child of two parents,
 * and {@link #addChild adding} a node that already has a parent detaches it from that parent first.
 * Child order is significant; it's preserved when rendering,
 * and determines which of several same-named nodes {@link #find} returns.
 * <p>
 * Nodes also remember the {@link #tokens() tokens} they were built from,
 * which survive {@link #clone() cloning}, so that the location of any node in its original
 * input can be reported even after the tree has been rearranged by
 * {@link Merger#merge merge} or {@link Exploder#explode explode}.
 * <p>
 * The value accessors like {@link #intVal()} are declared here so they can be called on the result of
 * {@link #find} without a cast. Only {@link Field} holds a value; the others throw {@link ValueException}.
 * <p>
 * Not thread-safe. A tree that is no longer being modified can be read from any number of threads.
 */
public sealed abstract class Node permits Root, Section, Comment, Field {
	private final NodeType type;
	private final List<Token> tokens;
	private @Nullable Node parent = null;
	final List<Node> children = new ArrayList<>();

	Node(NodeType type, List<Token> tokens) {
		this.type = requireNonNull(type);
		this.tokens = List.copyOf(tokens);
	}

	public NodeType type() {
		return type;
	}

	/**
	 * @return this node's own contribution to its {@link #fullpath()}:
	 * the name of a section or field, and empty for other nodes.
	 */
	public String path() {
		return "";
	}

	/**
	 * @return the normalized path from the tree's root to this node,
	 * or empty if this node has no parent
	 */
	public String fullpath() {
		if (parent == null) {
			return "";
		}
		return Paths.join(parent.fullpath(), path());
	}

	/**
	 * @return the tokens this node was parsed from; empty for nodes built programmatically
	 */
	public List<Token> tokens() {
		return tokens;
	}

	/**
	 * @return the line on which this node's text begins in the input it was parsed from,
	 * or zero if it wasn't parsed
	 */
	public int line() {
		if (tokens.isEmpty()) {
			return 0;
		} else {
			return tokens.get(0).line();
		}
	}

	//
	// Structure
	//

	public @Nullable Node parent() {
		return parent;
	}

	/**
	 * @return the topmost ancestor of this node, which is this node itself if it has no parent
	 */
	public Node root() {
		Node result = this;
		while (result.parent != null) {
			result = result.parent;
		}
		return result;
	}

	/**
	 * @return a snapshot of this node's children, in order
	 */
	public List<Node> children() {
		return List.copyOf(children);
	}

	/**
	 * @return a snapshot of those children whose type {@link NodeType#matches matches} {@code filter}
	 */
	public List<Node> children(NodeType filter) {
		List<Node> result = new ArrayList<>();
		for (Node child: children) {
			if (filter.matches(child.type)) {
				result.add(child);
			}
		}
		return result;
	}

	/**
	 * Appends {@code child} to this node's children, taking ownership of it.
	 */
	public void addChild(Node child) {
		insertChild(children.size(), child);
	}

	/**
	 * Inserts {@code child} so that it ends up at position {@code index} among this node's children.
	 * If {@code child} already has a parent, it is detached from it first,
	 * and {@code index} refers to positions after that removal.
	 */
	public void insertChild(int index, Node child) {
		requireNonNull(child);
		if (child.type == NodeType.ROOT) {
			throw new IllegalArgumentException("A root can't be a child");
		}
		for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor == child) {
				throw new IllegalArgumentException("Node " + describe(child) + " can't be a descendant of itself");
			}
		}
		if (child.parent != null) {
			child.parent.removeChild(child);
		}
		children.add(index, child);
		child.parent = this;
	}

	/**
	 * Detaches {@code child}, which then has no parent.
	 *
	 * @throws IllegalArgumentException if {@code child} is not a child of this node
	 */
	public void removeChild(Node child) {
		int index = indexOf(child);
		children.remove(index);
		child.parent = null;
	}

	/**
	 * Puts {@code replacement} in the position occupied by {@code existing}, which is detached.
	 */
	public void replaceChild(Node existing, Node replacement) {
		int index = indexOf(existing);
		if (existing == replacement) {
			return;
		}
		removeChild(existing);
		insertChild(index, replacement);
	}

	/**
	 * @return the position of {@code child} among this node's children
	 * @throws IllegalArgumentException if {@code child} is not a child of this node
	 */
	public int indexOf(Node child) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		throw new IllegalArgumentException("Node " + describe(child) + " is not a child of " + describe(this));
	}

	/**
	 * @return a deep copy of this node and its descendants.
	 * The copy has no parent, and retains the original {@link #tokens() tokens}.
	 */
	@Override
	public final Node clone() {
		Node result = shallowCopy();
		for (Node child: children) {
			result.addChild(child.clone());
		}
		return result;
	}

	/**
	 * @return a node just like this one, with no parent and no children
	 */
	abstract Node shallowCopy();

	//
	// Traversal
	//

	/**
	 * Equivalent to {@code walk(walker, NodeType.FIELD)}.
	 */
	public void walk(Walker walker) {
		walk(walker, NodeType.FIELD);
	}

	/**
	 * Depth-first, pre-order traversal of this node and its descendants,
	 * calling {@code walker} for each node whose type {@link NodeType#matches matches} {@code filter}.
	 * Non-matching nodes are still traversed.
	 * <p>
	 * The walker may modify the children of the node it's given;
	 * the traversal visits the children as they were when the node was visited.
	 */
	public void walk(Walker walker, NodeType filter) {
		if (filter.matches(type)) {
			walker.walk(fullpath(), path(), this);
		}
		for (Node child: children()) {
			child.walk(walker, filter);
		}
	}

	/**
	 * Follows {@code path} downward from this node, never upward.
	 * <p>
	 * A section's name can itself contain several segments, so it's the joined paths
	 * that are compared, not individual segments.
	 * When several nodes have the requested path, the first in depth-first order wins.
	 *
	 * @return the node at {@code path} relative to this node, this node itself if {@code path} is empty,
	 * or null if there is no such node
	 */
	public @Nullable Node find(String path) {
		String target = Paths.norm(path);
		if (target.isEmpty()) {
			return this;
		}
		return findInner(target, "");
	}

	private @Nullable Node findInner(String target, String prefix) {
		for (Node child: children) {
			String childPath = child.path();
			if (childPath.isEmpty()) {
				continue;
			}
			String joined = Paths.join(prefix, childPath);
			if (joined.equals(target)) {
				return child;
			} else if (child.type == NodeType.SECTION && Paths.isPrefix(joined, target)) {
				Node result = child.findInner(target, joined);
				if (result != null) {
					return result;
				}
			}
		}
		return null;
	}

	//
	// Values
	//

	/**
	 * @param path relative to this node; empty means this node itself
	 * @return the value of the node at {@code path}, as {@code type}
	 * @throws ValueException if there is no node at {@code path},
	 * or its value can't be represented as {@code type}
	 */
	public <T> T param(String path, ParamType<T> type) {
		Node node = find(path);
		if (node == null) {
			throw new ValueException("no parameter named '" + path + "'");
		}
		return type.extract(node);
	}

	/**
	 * @return the value of this node, as {@code type}
	 */
	public <T> T param(ParamType<T> type) {
		return param("", type);
	}

	/**
	 * Like {@link #param(String, ParamType) param}, except returns {@code defaultValue}
	 * if there is no node at {@code path}.
	 *
	 * @throws ValueException if the node exists but its value can't be represented as {@code type}
	 */
	public <T> T paramOptional(String path, ParamType<T> type, T defaultValue) {
		Node node = find(path);
		if (node == null) {
			return defaultValue;
		}
		return type.extract(node);
	}

	public boolean boolVal() {
		throw noValue();
	}

	public int intVal() {
		throw noValue();
	}

	public long longVal() {
		throw noValue();
	}

	public double floatVal() {
		throw noValue();
	}

	/**
	 * Fields can always return their value as a string,
	 * since all values are strings in the input text.
	 *
	 * @throws ValueException only if this node holds no value at all
	 */
	public String strVal() {
		throw noValue();
	}

	/**
	 * The {@code vec} accessors split the value at whitespace,
	 * and convert each element separately.
	 */
	public List<Integer> vecIntVal() {
		throw noValue();
	}

	public List<Double> vecFloatVal() {
		throw noValue();
	}

	public List<Boolean> vecBoolVal() {
		throw noValue();
	}

	public List<String> vecStrVal() {
		throw noValue();
	}

	private ValueException noValue() {
		return new ValueException(type.displayName() + " node " + describe(this) + " holds no value");
	}

	//
	// Rendering
	//

	public static final String DEFAULT_INDENT = "  ";

	/**
	 * @return HIT text that would parse to a tree equivalent to this node and its descendants
	 */
	public String render() {
		return render(0);
	}

	public String render(int indentLevel) {
		return render(indentLevel, DEFAULT_INDENT);
	}

	/**
	 * @param indentLevel how deeply to indent this node's text
	 * @param indentText the text repeated once per indent level; must be whitespace
	 */
	public abstract String render(int indentLevel, String indentText);

	static String newline(int indentLevel, String indentText) {
		return "\n" + indentText.repeat(Math.max(0, indentLevel));
	}

	static String describe(@NotNull Node node) {
		String fullpath = node.fullpath();
		if (fullpath.isEmpty()) {
			return "'" + node.path() + "'";
		} else {
			return "'" + fullpath + "'";
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + fullpath() + ")";
	}
}
