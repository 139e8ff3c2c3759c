package edu.isi.treeprep;

import java.util.List;
import java.util.Vector;

/** Replaces rare terminals with the unknown-word token so the parser learns
    how to tag words it has never seen. Only words change; tags and tree shape
    are kept, so masking can come before or after binarization.
 */
public class RareWordMasker {

	/** stands in for a rare word */
	public static final String UNKNOWN = "<unk>";

	/** by default a word must be seen twice to be kept */
	public static final int DEFAULT_THRESHOLD = 2;

	private final int threshold;

	public RareWordMasker() {
		this(DEFAULT_THRESHOLD);
	}

	/** Creates a masker

	@param threshold words seen fewer times than this are replaced. Must be at least 1
	 */
	public RareWordMasker(int threshold) {
		if (threshold < 1)
			throw new IllegalArgumentException("Threshold must be positive: "+threshold);
		this.threshold = threshold;
	}

	public int getThreshold() { return threshold; }

	/** Replace the rare words of one tree

	@param tree the tree. It isn't changed
	@param counts word counts for the whole corpus the tree belongs to
	@return a tree with each rare word replaced by {@link #UNKNOWN}
	 */
	public TreeNode mask(TreeNode tree, final WordCounts counts) {
		return tree.accept(new TreeVisitor<TreeNode, RuntimeException>() {
			public TreeNode visitLeaf(LeafNode leaf) {
				if (counts.get(leaf.getTerminal()) < threshold)
					return leaf.withTerminal(UNKNOWN);
				return leaf;
			}
			public TreeNode visitInternal(InternalNode node) {
				Vector<TreeNode> kids = new Vector<TreeNode>();
				for (TreeNode kid : node.getChildren())
					kids.add(kid.accept(this));
				return new InternalNode(node.getLabel(), kids);
			}
		});
	}

	/** Count, then mask, a whole corpus. Null entries stay null

	@param trees the corpus
	@return masked trees, in the same order
	 */
	public List<TreeNode> maskCorpus(List<? extends TreeNode> trees) {
		WordCounts counts = WordCounts.count(trees);
		Vector<TreeNode> ret = new Vector<TreeNode>();
		for (TreeNode t : trees)
			ret.add(t == null ? null : mask(t, counts));
		return ret;
	}
}
