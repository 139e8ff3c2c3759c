package edu.isi.treeprep;

/** One line of a tree file: the tree read from it, or why there isn't one.
    Blank lines (a parser's way of saying it found no parse) have neither.
 */
public class TreebankLine {
	private final int line;
	private final String text;
	private final TreeNode tree;
	private final TreeSyntaxException error;

	TreebankLine(int line, String text, TreeNode tree, TreeSyntaxException error) {
		this.line = line;
		this.text = text;
		this.tree = tree;
		this.error = error;
	}

	/** @return one-based line number */
	public int getLine() { return line; }
	/** @return the raw text of the line */
	public String getText() { return text; }
	/** @return the tree, or null if the line was blank or bad */
	public TreeNode getTree() { return tree; }
	/** @return the problem with the line, or null */
	public TreeSyntaxException getError() { return error; }
	public boolean isBlank() { return tree == null && error == null; }
	public boolean hasTree() { return tree != null; }
}
