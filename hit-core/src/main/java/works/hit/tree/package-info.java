/**
 * The syntax tree produced by parsing HIT text, and the operations on it.
 * <p>
 * A tree is made of {@link works.hit.tree.Node}s: one {@link works.hit.tree.Root},
 * with {@link works.hit.tree.Section}s, {@link works.hit.tree.Field}s and {@link works.hit.tree.Comment}s below it.
 * Nodes are addressed by slash-separated paths built from section and field names
 * (see {@link works.hit.tree.Paths}); comments have no path.
 * <p>
 * Values are stored as raw text and converted on request,
 * either by the accessors on {@link works.hit.tree.Node} or through a {@link works.hit.tree.ParamType}.
 * <p>
 * {@link works.hit.tree.Merger} and {@link works.hit.tree.Exploder} reshape whole trees.
 */
package works.hit.tree;
