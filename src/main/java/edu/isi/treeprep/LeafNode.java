package edu.isi.treeprep;

import java.util.Collections;
import java.util.List;

/** Part-of-speech tag over a single word. Leaves never have children.
 */
public class LeafNode extends TreeNode {

	private final String terminal;

	/** Creates a leaf

	@param tag the part-of-speech tag
	@param terminal the surface word. May not be empty
	 */
	public LeafNode(String tag, String terminal) {
		super(tag);
		checkToken(terminal, "terminal");
		this.terminal = terminal;
	}

	/** @return the surface word */
	public String getTerminal() { return terminal; }

	/** Copy this leaf with a different word in the same place

	@param word the new word
	@return a leaf with this tag over word
	 */
	public LeafNode withTerminal(String word) {
		if (word.equals(terminal))
			return this;
		return new LeafNode(label, word);
	}

	public boolean isLeaf() { return true; }
	public int getNumChildren() { return 0; }
	public List<TreeNode> getChildren() { return Collections.emptyList(); }
	public int numNodes() { return 1; }

	public <R, E extends Exception> R accept(TreeVisitor<R, E> v) throws E {
		return v.visitLeaf(this);
	}

	void collectLeaves(List<LeafNode> list) {
		list.add(this);
	}

	void appendTo(StringBuffer sb) {
		sb.append("(").append(label).append(" ").append(terminal).append(")");
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof LeafNode))
			return false;
		LeafNode l = (LeafNode)o;
		return label.equals(l.label) && terminal.equals(l.terminal);
	}

	public int hashCode() {
		return 31*label.hashCode() + terminal.hashCode();
	}
}
