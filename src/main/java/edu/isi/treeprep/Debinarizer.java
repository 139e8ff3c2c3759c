package edu.isi.treeprep;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

/** Restores the original form of a binarized tree (typically parser output).
    Nodes labeled L* are removed and their children spliced into the parent;
    fused labels like S_VP are split back into a chain of unary nodes.

    A visit returns the list of nodes that take the visited node's place:
    one node normally, the spliced children for a synthetic node.
 */
public class Debinarizer implements TreeVisitor<List<TreeNode>, StructuralInvariantException> {

	/** Undo binarization. The input isn't changed.

	@param tree tree in binary form
	@return the tree in original form
	@throws StructuralInvariantException if the root is synthetic, a synthetic node has
	fewer than two children, or a label has a misplaced '*' or an empty fused component
	 */
	public TreeNode debinarize(TreeNode tree) throws StructuralInvariantException {
		if (isSynthetic(tree.getLabel()) && !tree.isLeaf())
			throw new StructuralInvariantException("Root "+tree.getLabel()+" is a synthetic node");
		List<TreeNode> ret = tree.accept(this);
		return ret.get(0);
	}

	public List<TreeNode> visitLeaf(LeafNode leaf) {
		return Collections.singletonList((TreeNode)leaf);
	}

	public List<TreeNode> visitInternal(InternalNode node) throws StructuralInvariantException {
		boolean debug = false;
		String label = node.getLabel();
		int star = label.indexOf(Binarizer.SYNTHETIC_MARK);
		if (star >= 0 && star != label.length()-1)
			throw new StructuralInvariantException("Label "+label+" has '"+Binarizer.SYNTHETIC_MARK+"' before its end");
		boolean synthetic = star >= 0;
		if (synthetic && star == 0)
			throw new StructuralInvariantException("Synthetic node has no base label");
		if (synthetic && node.getNumChildren() < 2)
			throw new StructuralInvariantException("Synthetic node "+label+" has "+node.getNumChildren()+" child; expected 2");
		Vector<TreeNode> kids = new Vector<TreeNode>();
		for (TreeNode kid : node.getChildren())
			kids.addAll(kid.accept(this));
		if (synthetic) {
			if (debug) Debug.debug(debug, "splicing "+kids.size()+" children of "+label);
			return kids;
		}
		String[] parts = label.split(String.valueOf(Binarizer.FUSION_MARK), -1);
		for (String part : parts)
			if (part.length() == 0)
				throw new StructuralInvariantException("Fused label "+label+" has an empty component");
		// innermost label takes the children, each outer label wraps the last
		TreeNode ret = new InternalNode(parts[parts.length-1], kids);
		for (int i = parts.length-2; i >= 0; i--)
			ret = new InternalNode(parts[i], ret);
		return Collections.singletonList(ret);
	}

	private static boolean isSynthetic(String label) {
		return label.charAt(label.length()-1) == Binarizer.SYNTHETIC_MARK;
	}
}
