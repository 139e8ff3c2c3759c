package edu.isi.treeprep;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/** How often each terminal occurs across a corpus. Built in one full pass
    before any word is replaced, and read-only afterward.
 */
public class WordCounts {

	private final TObjectIntHashMap<String> counts;
	private final int tokens;

	private WordCounts(TObjectIntHashMap<String> counts, int tokens) {
		this.counts = counts;
		this.tokens = tokens;
	}

	/** Count every leaf terminal of every tree. Null entries (lines that failed to parse) are skipped

	@param trees the corpus
	@return the frequency table
	 */
	public static WordCounts count(Iterable<? extends TreeNode> trees) {
		boolean debug = false;
		TObjectIntHashMap<String> map = new TObjectIntHashMap<String>();
		int tokens = 0;
		for (TreeNode t : trees) {
			if (t == null)
				continue;
			for (LeafNode leaf : t.getLeaves()) {
				map.adjustOrPutValue(leaf.getTerminal(), 1, 1);
				tokens++;
			}
		}
		if (debug) Debug.debug(debug, "Counted "+tokens+" tokens of "+map.size()+" types");
		return new WordCounts(map, tokens);
	}

	/** @return how many times word was seen; 0 if never */
	public int get(String word) {
		return counts.get(word);
	}

	/** @return number of distinct words */
	public int getNumTypes() {
		return counts.size();
	}

	/** @return number of word occurrences */
	public int getNumTokens() {
		return tokens;
	}

	/** The words seen fewer than threshold times

	@param threshold minimum count a word needs to be kept
	@return the rare words
	 */
	public Set<String> rareWords(int threshold) {
		Set<String> ret = new HashSet<String>();
		for (String w : counts.keySet())
			if (counts.get(w) < threshold)
				ret.add(w);
		return Collections.unmodifiableSet(ret);
	}
}
