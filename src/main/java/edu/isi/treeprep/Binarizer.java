package edu.isi.treeprep;

import java.util.List;
import java.util.Vector;

/** Makes a tree strictly binary so a CKY parser can be trained on it.

    Working bottom-up, a unary chain of constituents is fused into a single
    node whose label joins the chain's labels with '_' (S over VP becomes S_VP),
    and a node L with more than two children is split into a cascade of
    binary nodes, each new node labeled L*. A preterminal (tag over word) is
    never fused, and a root carrying the top label keeps its unary wrapper.
    {@link Debinarizer} undoes all of this exactly.
 */
public class Binarizer implements TreeVisitor<TreeNode, StructuralInvariantException> {

	/** suffix marking a node introduced by binarization */
	public static final char SYNTHETIC_MARK = '*';
	/** separator between the labels of a fused unary chain */
	public static final char FUSION_MARK = '_';
	/** the usual root label of a treebank tree */
	public static final String DEFAULT_TOP = "TOP";

	// which way the cascade of L* nodes leans
	public enum Branching { RIGHT, LEFT ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (Branching x: Branching.values()) {
			sb.append(x.toString().toLowerCase()+" ");
		}
		list = sb.toString();
	}
	public static Branching get(String s) throws ConfigureException{
		for (Branching x : Branching.values()) {
			if (x.toString().equalsIgnoreCase(s))
				return x;
		}
		throw new ConfigureException("Invalid branching ("+s+"); valid values are "+list);
	}
	}

	private final String topLabel;
	private final Branching branching;

	/** Right-branching binarizer for trees rooted in TOP */
	public Binarizer() {
		this(DEFAULT_TOP, Branching.RIGHT);
	}

	/** Creates a binarizer

	@param topLabel root label that is exempt from unary fusion. If null, no root is exempt
	@param branching direction of the synthetic cascade
	 */
	public Binarizer(String topLabel, Branching branching) {
		this.topLabel = topLabel;
		this.branching = branching;
	}

	public String getTopLabel() { return topLabel; }

	/** Binarize a tree. The input isn't changed.

	@param tree tree in original form
	@return the binary form
	@throws StructuralInvariantException if a constituent label already contains '*' or '_'
	 */
	public TreeNode binarize(TreeNode tree) throws StructuralInvariantException {
		if (tree.isLeaf())
			return tree;
		InternalNode root = (InternalNode)tree;
		return transform(root, !root.getLabel().equals(topLabel));
	}

	public TreeNode visitLeaf(LeafNode leaf) {
		return leaf;
	}

	public TreeNode visitInternal(InternalNode node) throws StructuralInvariantException {
		return transform(node, true);
	}

	// children first, then fuse, then split
	private TreeNode transform(InternalNode node, boolean fuse) throws StructuralInvariantException {
		boolean debug = false;
		String label = node.getLabel();
		checkLabel(label);
		List<TreeNode> kids = new Vector<TreeNode>();
		for (TreeNode kid : node.getChildren())
			kids.add(kid.accept(this));
		if (fuse) {
			while (kids.size() == 1 && !kids.get(0).isLeaf()) {
				TreeNode only = kids.get(0);
				label = label+FUSION_MARK+only.getLabel();
				kids = only.getChildren();
				if (debug) Debug.debug(debug, "fused into "+label);
			}
		}
		if (kids.size() <= 2)
			return new InternalNode(label, kids);
		String synth = label+SYNTHETIC_MARK;
		int n = kids.size();
		if (branching == Branching.RIGHT) {
			TreeNode prev = new InternalNode(synth, kids.get(n-2), kids.get(n-1));
			for (int i = n-3; i > 0; i--)
				prev = new InternalNode(synth, kids.get(i), prev);
			return new InternalNode(label, kids.get(0), prev);
		}
		else {
			TreeNode prev = new InternalNode(synth, kids.get(0), kids.get(1));
			for (int i = 2; i < n-1; i++)
				prev = new InternalNode(synth, prev, kids.get(i));
			return new InternalNode(label, prev, kids.get(n-1));
		}
	}

	// markers in an input label would make debinarization ambiguous
	private static void checkLabel(String label) throws StructuralInvariantException {
		if (label.indexOf(SYNTHETIC_MARK) >= 0 || label.indexOf(FUSION_MARK) >= 0)
			throw new StructuralInvariantException("Label "+label+" contains reserved character '"+
					SYNTHETIC_MARK+"' or '"+FUSION_MARK+"'");
	}

	/** Check that every constituent has one or two children, as binarization leaves it

	@param tree a binarized tree
	@return true if the tree is in binary form
	 */
	public static boolean isBinary(TreeNode tree) {
		if (tree.isLeaf())
			return true;
		if (tree.getNumChildren() > 2)
			return false;
		for (TreeNode kid : tree.getChildren())
			if (!isBinary(kid))
				return false;
		return true;
	}
}
