package edu.isi.treeprep;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Constituent: a label over one or more ordered subtrees.
 */
public class InternalNode extends TreeNode {

	private final TreeNode children[];
	private final List<TreeNode> childList;

	// memoized
	private int numNodes = -1;
	private int hsh = 0;

	/** Creates a constituent from subtrees and a parent label.

	@param label the parent label
	@param kids child trees, in order. There must be at least one
	 */
	public InternalNode(String label, List<? extends TreeNode> kids) {
		this(label, kids.toArray(new TreeNode[kids.size()]));
	}

	/** Creates a constituent from subtrees and a parent label.

	@param label the parent label
	@param kids child trees, in order. There must be at least one
	 */
	public InternalNode(String label, TreeNode... kids) {
		super(label);
		if (kids.length == 0)
			throw new IllegalArgumentException("Internal node "+label+" needs at least one child");
		children = new TreeNode[kids.length];
		for (int i = 0; i < kids.length; i++) {
			if (kids[i] == null)
				throw new IllegalArgumentException("Null child "+i+" under "+label);
			children[i] = kids[i];
		}
		childList = Collections.unmodifiableList(Arrays.asList(children));
	}

	public boolean isLeaf() { return false; }
	public int getNumChildren() { return children.length; }
	public List<TreeNode> getChildren() { return childList; }
	public TreeNode getChild(int i) { return children[i]; }

	public int numNodes() {
		if (numNodes < 0) {
			int n = 1;
			for (TreeNode kid : children)
				n += kid.numNodes();
			numNodes = n;
		}
		return numNodes;
	}

	public <R, E extends Exception> R accept(TreeVisitor<R, E> v) throws E {
		return v.visitInternal(this);
	}

	void collectLeaves(List<LeafNode> list) {
		for (TreeNode kid : children)
			kid.collectLeaves(list);
	}

	void appendTo(StringBuffer sb) {
		sb.append("(").append(label);
		for (TreeNode kid : children) {
			sb.append(" ");
			kid.appendTo(sb);
		}
		sb.append(")");
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof InternalNode))
			return false;
		InternalNode n = (InternalNode)o;
		if (hashCode() != n.hashCode())
			return false;
		return label.equals(n.label) && Arrays.equals(children, n.children);
	}

	public int hashCode() {
		if (hsh == 0)
			hsh = 31*label.hashCode() + Arrays.hashCode(children);
		return hsh;
	}
}
