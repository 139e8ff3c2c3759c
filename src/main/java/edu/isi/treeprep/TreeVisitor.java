package edu.isi.treeprep;

/** Case analysis over the two kinds of tree node. Each transform that
    rebuilds a tree is written as one of these, so leaves and internal nodes
    are always both handled.

    @param <R> what a visit returns
    @param <E> the checked exception a visit may throw, or RuntimeException if none
 */
public interface TreeVisitor<R, E extends Exception> {
	public R visitLeaf(LeafNode leaf) throws E;
	public R visitInternal(InternalNode node) throws E;
}
