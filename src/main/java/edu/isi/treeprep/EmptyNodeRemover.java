package edu.isi.treeprep;

import java.util.Vector;

/** Drops empty elements (traces, null complementizers) from treebank trees:
    every leaf tagged -NONE-, and every constituent left without children.
 */
public class EmptyNodeRemover implements TreeVisitor<TreeNode, RuntimeException> {

	/** treebank tag of empty elements */
	public static final String EMPTY_TAG = "-NONE-";

	/** Remove empty elements. The input isn't changed.

	@param tree the tree
	@return the tree without empty elements, or null if nothing is left
	 */
	public TreeNode remove(TreeNode tree) {
		return tree.accept(this);
	}

	public TreeNode visitLeaf(LeafNode leaf) {
		if (leaf.getLabel().equals(EMPTY_TAG))
			return null;
		return leaf;
	}

	public TreeNode visitInternal(InternalNode node) {
		Vector<TreeNode> kids = new Vector<TreeNode>();
		boolean changed = false;
		for (TreeNode kid : node.getChildren()) {
			TreeNode k = kid.accept(this);
			if (k != kid)
				changed = true;
			if (k != null)
				kids.add(k);
		}
		if (kids.size() == 0)
			return null;
		if (!changed)
			return node;
		return new InternalNode(node.getLabel(), kids);
	}
}
