package edu.isi.treeprep;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/** A file of trees, one per line. Every line is read on its own, so a
    malformed line is reported and skipped without losing the rest.
 */
public class Treebank {

	private final String name;
	private final Vector<TreebankLine> lines;
	private int numErrors = 0;
	private int numBlank = 0;

	private Treebank(String name) {
		this.name = name;
		lines = new Vector<TreebankLine>();
	}

	/** Open a file for reading. The name '-' means stdin

	@param f the file
	@param encoding character set of the file
	@return a reader on the file
	 */
	public static BufferedReader open(File f, String encoding) throws FileNotFoundException, IOException {
		if (f.getName().equals("-"))
			return new BufferedReader(new InputStreamReader(System.in, encoding));
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	/** Read all trees from a reader. Bad lines are reported on stderr with their
	line number; blank lines are kept as empty entries.

	@param br the reader. It is read to the end but not closed
	@param name what to call the source in messages
	@return the treebank
	 */
	public static Treebank read(BufferedReader br, String name) throws IOException {
		boolean debug = false;
		Treebank tb = new Treebank(name);
		String text;
		int num = 0;
		while ((text = br.readLine()) != null) {
			num++;
			if (text.trim().length() == 0) {
				tb.lines.add(new TreebankLine(num, text, null, null));
				tb.numBlank++;
				continue;
			}
			try {
				TreeNode t = TreeNode.parse(text);
				if (debug) Debug.debug(debug, "line "+num+": "+t);
				tb.lines.add(new TreebankLine(num, text, t, null));
			}
			catch (TreeSyntaxException e) {
				TreeSyntaxException located = new TreeSyntaxException(e.getMessage(), num);
				Debug.lineWarning(name, num, e.getMessage());
				tb.lines.add(new TreebankLine(num, text, null, located));
				tb.numErrors++;
			}
			if (num % 10000 == 0)
				Debug.prettyDebug("Read "+num+" lines of "+name);
		}
		return tb;
	}

	/** Read all trees from a file.

	@param f the file, or '-' for stdin
	@param encoding character set of the file
	@return the treebank
	 */
	public static Treebank read(File f, String encoding) throws FileNotFoundException, IOException {
		BufferedReader br = open(f, encoding);
		try {
			return read(br, f.getName());
		}
		finally {
			if (!f.getName().equals("-"))
				br.close();
		}
	}

	/** Write trees one per line; a null entry is written as a blank line

	@param w where to write. It is flushed but not closed
	@param trees the trees
	 */
	public static void write(Writer w, List<? extends TreeNode> trees) throws IOException {
		for (TreeNode t : trees) {
			if (t != null)
				w.write(t.toString());
			w.write("\n");
		}
		w.flush();
	}

	public String getName() { return name; }
	public int size() { return lines.size(); }
	public int getNumErrors() { return numErrors; }
	public int getNumBlank() { return numBlank; }
	public List<TreebankLine> getLines() { return Collections.unmodifiableList(lines); }

	/** @return one entry per line: the tree, or null for blank and bad lines */
	public List<TreeNode> getTrees() {
		Vector<TreeNode> ret = new Vector<TreeNode>();
		for (TreebankLine l : lines)
			ret.add(l.getTree());
		return ret;
	}
}
