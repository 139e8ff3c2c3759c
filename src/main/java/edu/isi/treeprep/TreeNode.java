package edu.isi.treeprep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Vector;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Immutable labeled bracketed tree. A node is either a {@link LeafNode}
    (part-of-speech tag over a word) or an {@link InternalNode} (label over
    one or more subtrees). Transforms never change a tree; they build a new one.

    The text form is Penn Treebank style: an internal node with label A and
    children B and C is written (A B C), a leaf with tag DT and word the is
    written (DT the). Children are separated by single spaces.
 */
public abstract class TreeNode {

	/** the node label: tag for leaves, constituent label otherwise */
	protected final String label;

	// memoized leaves, left to right
	private List<LeafNode> leaves = null;

	protected TreeNode(String label) {
		checkToken(label, "label");
		this.label = label;
	}

	// labels and words can't be empty or hold characters the bracket format uses
	static void checkToken(String s, String what) {
		if (s == null || s.length() == 0)
			throw new IllegalArgumentException("Empty "+what);
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '(' || c == ')' || Character.isWhitespace(c))
				throw new IllegalArgumentException("Illegal character '"+c+"' in "+what+" "+s);
		}
	}

	/**
	Get the node label

	@return the label (the tag, for a leaf)
	 */
	public String getLabel() { return label; }

	/** @return true for a tag-over-word node */
	abstract public boolean isLeaf();

	/** @return the number of children; 0 for leaves */
	abstract public int getNumChildren();

	/** @return the children in left-to-right order; empty for leaves. The list can't be modified */
	abstract public List<TreeNode> getChildren();

	/** @return the i-th child */
	public TreeNode getChild(int i) {
		return getChildren().get(i);
	}

	/** @return the number of nodes in the tree, leaves included */
	abstract public int numNodes();

	/** Dispatch to the visitor method for this kind of node */
	abstract public <R, E extends Exception> R accept(TreeVisitor<R, E> v) throws E;

	// add leaves to list in order
	abstract void collectLeaves(List<LeafNode> list);

	// add bracketed form to the buffer
	abstract void appendTo(StringBuffer sb);

	/** Get all leaves of the tree, left to right. Memoized.

	@return the leaves. The list can't be modified
	 */
	public List<LeafNode> getLeaves() {
		if (leaves == null) {
			ArrayList<LeafNode> list = new ArrayList<LeafNode>();
			collectLeaves(list);
			leaves = Collections.unmodifiableList(list);
		}
		return leaves;
	}

	/** Represent the sentence covered by the tree.

	@return terminals separated by single spaces
	 */
	public String toYield() {
		StringBuffer sb = new StringBuffer();
		for (LeafNode leaf : getLeaves()) {
			if (sb.length() > 0)
				sb.append(" ");
			sb.append(leaf.getTerminal());
		}
		return sb.toString();
	}

	/** Represent the tree in bracketed notation. This is the exact inverse of {@link #parse}

	@return the bracketed form, with no trailing whitespace
	 */
	public String toString() {
		StringBuffer sb = new StringBuffer();
		appendTo(sb);
		return sb.toString();
	}

	// reading

	// node pattern = open paren followed by a (possibly missing) label
	private static Pattern nodePat = Pattern.compile("\\s*\\(\\s*([^\\s\\(\\)]*)");
	// word pattern = symbol with no parens
	private static Pattern wordPat = Pattern.compile("\\s*([^\\s\\(\\)]+)");
	// end-of-node pattern = spaces and right paren
	private static Pattern endPat = Pattern.compile("\\s*\\)");
	// nothing but spaces left
	private static Pattern restPat = Pattern.compile("\\s*");

	/** Creates a tree from its bracketed representation

	@param text a single tree, as produced by {@link #toString}. Whitespace between tokens is free
	@return the tree
	@throws TreeSyntaxException on unbalanced parentheses, empty labels, nodes with no children,
	leaves without a word, words next to other children, or text after the tree
	 */
	public static TreeNode parse(String text) throws TreeSyntaxException {
		boolean debug = false;
		if (text == null || restPat.matcher(text).matches())
			throw new TreeSyntaxException("No tree in empty text");
		Matcher nodeMatch = nodePat.matcher(text);
		if (!nodeMatch.lookingAt())
			throw new TreeSyntaxException("Tree must begin with '(': "+text);
		int[] pos = new int[] { 0 };
		TreeNode tree = readNode(text, pos, 0);
		Matcher restMatch = restPat.matcher(text);
		restMatch.region(pos[0], text.length());
		if (!restMatch.matches())
			throw new TreeSyntaxException("Unexpected text after tree at position "+pos[0]+": "+text.substring(pos[0]).trim());
		if (debug) Debug.debug(debug, "Read "+tree);
		return tree;
	}

	// read one parenthesized node starting at pos[0], leaving pos[0] just past its close paren
	private static TreeNode readNode(String text, int[] pos, int level) throws TreeSyntaxException {
		boolean debug = false;
		Matcher nodeMatch = nodePat.matcher(text);
		nodeMatch.region(pos[0], text.length());
		if (!nodeMatch.lookingAt())
			throw new TreeSyntaxException("Expected '(' at position "+pos[0]);
		String lab = nodeMatch.group(1);
		if (lab.length() == 0)
			throw new TreeSyntaxException("Empty label at position "+pos[0]);
		if (debug) Debug.debug(debug, level, "label set to "+lab);
		pos[0] = nodeMatch.end();
		// children are either nodes or bare words; only a lone word makes a leaf
		Vector<TreeNode> kids = new Vector<TreeNode>();
		String word = null;
		int numWords = 0;
		Matcher endMatch = endPat.matcher(text);
		while (true) {
			endMatch.region(pos[0], text.length());
			if (endMatch.lookingAt())
				break;
			nodeMatch.region(pos[0], text.length());
			if (nodeMatch.lookingAt()) {
				kids.add(readNode(text, pos, level+1));
				continue;
			}
			Matcher wordMatch = wordPat.matcher(text);
			wordMatch.region(pos[0], text.length());
			if (wordMatch.lookingAt()) {
				word = wordMatch.group(1);
				numWords++;
				if (debug) Debug.debug(debug, level, "word "+word);
				pos[0] = wordMatch.end();
				continue;
			}
			throw new TreeSyntaxException("Unbalanced parentheses: node "+lab+" is never closed");
		}
		pos[0] = endMatch.end();
		if (numWords == 0 && kids.size() == 0)
			throw new TreeSyntaxException("Node "+lab+" has no children or word");
		if (numWords > 1)
			throw new TreeSyntaxException("Leaf "+lab+" has more than one word");
		if (numWords == 1) {
			if (kids.size() > 0)
				throw new TreeSyntaxException("Word "+word+" appears next to subtrees under "+lab);
			return new LeafNode(lab, word);
		}
		return new InternalNode(lab, kids);
	}
}
