package works.hit.tree;

/**
 * Called by {@link Node#walk} for each node visited.
 */
@FunctionalInterface
public interface Walker {
	/**
	 * @param fullpath the path of {@code node} from the tree's root
	 * @param nodepath the node's own contribution to that path:
	 *                 the section name for sections, and the field name for fields
	 * @param node the node being visited
	 */
	void walk(String fullpath, String nodepath, Node node);
}
