package edu.isi.treeprep;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

/** Labeled bracket scoring of parser output against gold trees.

    Each constituent is a (label, start, end) span over the leaves. Leaves
    (tags) don't count, nor does the top wrapper at the root, nor a unary
    node spanning the whole sentence over a constituent with the same label
    (it adds no bracket), nor any label on the ignore list. Constituents are matched as multisets, so
    duplicates match at most once each.
 */
public class BracketScorer {

	private final String topLabel;
	private final Set<String> ignoredLabels;

	/** Scorer for trees rooted in TOP, ignoring no labels */
	public BracketScorer() {
		this(Binarizer.DEFAULT_TOP, Collections.<String>emptySet());
	}

	/** Creates a scorer

	@param topLabel root label that is not counted. If null, the root is counted like any node
	@param ignoredLabels constituent labels that are never counted
	 */
	public BracketScorer(String topLabel, Set<String> ignoredLabels) {
		this.topLabel = topLabel;
		this.ignoredLabels = Collections.unmodifiableSet(new HashSet<String>(ignoredLabels));
	}

	/** The countable constituents of a tree, in preorder

	@param tree the tree
	@return its constituents
	 */
	public List<Constituent> constituents(TreeNode tree) {
		Vector<Constituent> ret = new Vector<Constituent>();
		collect(tree, 0, tree.getLeaves().size(), true, ret);
		return ret;
	}

	// add constituents under node, which starts at leaf start. returns its end
	private int collect(TreeNode node, int start, int length, boolean isRoot, List<Constituent> list) {
		if (node.isLeaf())
			return start+1;
		int pos = start;
		int here = list.size();
		for (TreeNode kid : node.getChildren())
			pos = collect(kid, pos, length, false, list);
		String label = node.getLabel();
		if (isRoot && label.equals(topLabel))
			return pos;
		if (ignoredLabels.contains(label))
			return pos;
		// only a whole-sentence duplicate is vacuous
		if (node.getNumChildren() == 1 && start == 0 && pos == length) {
			TreeNode only = node.getChild(0);
			if (!only.isLeaf() && only.getLabel().equals(label))
				return pos;
		}
		list.add(here, new Constituent(label, start, pos));
		return pos;
	}

	/** Size of the multiset intersection of two constituent lists: each
	constituent matches at most one identical constituent on the other side.

	@param hyp proposed constituents
	@param gold reference constituents
	@return the number of matches
	 */
	public static int countMatches(List<Constituent> hyp, List<Constituent> gold) {
		TObjectIntHashMap<Constituent> goldBag = new TObjectIntHashMap<Constituent>();
		for (Constituent c : gold)
			goldBag.adjustOrPutValue(c, 1, 1);
		int matched = 0;
		for (Constituent c : hyp) {
			if (goldBag.get(c) > 0) {
				matched++;
				goldBag.adjustValue(c, -1);
			}
		}
		return matched;
	}

	/** Score one pair of trees

	@param sentence one-based position of the pair, for reporting
	@param hyp parser output, or null if the parser produced nothing
	@param gold the reference tree
	@return the counts for the pair
	@throws ScoringAlignmentException if gold is missing, or the trees' words differ
	 */
	public SentenceScore score(int sentence, TreeNode hyp, TreeNode gold) throws ScoringAlignmentException {
		boolean debug = false;
		if (gold == null)
			throw new ScoringAlignmentException("No gold tree");
		List<LeafNode> goldLeaves = gold.getLeaves();
		List<Constituent> goldCons = constituents(gold);
		if (hyp == null) {
			if (debug) Debug.debug(debug, "no parse for sentence "+sentence);
			return new SentenceScore(sentence, goldLeaves.size(), 0, 0, goldCons.size(), 0, 0, true);
		}
		List<LeafNode> hypLeaves = hyp.getLeaves();
		if (hypLeaves.size() != goldLeaves.size())
			throw new ScoringAlignmentException("Length mismatch: hypothesis has "+hypLeaves.size()+
					" words, gold has "+goldLeaves.size());
		int tagsCorrect = 0;
		for (int i = 0; i < hypLeaves.size(); i++) {
			LeafNode h = hypLeaves.get(i);
			LeafNode g = goldLeaves.get(i);
			if (!h.getTerminal().equals(g.getTerminal()))
				throw new ScoringAlignmentException("Word mismatch at "+i+": hypothesis has "+h.getTerminal()+
						", gold has "+g.getTerminal());
			if (h.getLabel().equals(g.getLabel()))
				tagsCorrect++;
		}
		List<Constituent> hypCons = constituents(hyp);
		int matched = countMatches(hypCons, goldCons);
		if (debug) Debug.debug(debug, "sentence "+sentence+": "+matched+" of "+hypCons.size()+" / "+goldCons.size());
		return new SentenceScore(sentence, goldLeaves.size(), matched, hypCons.size(), goldCons.size(),
				tagsCorrect, goldLeaves.size(), false);
	}

	/** Score two aligned corpora. Pairs that can't be aligned are flagged
	in the result and left out of the totals.

	@param hyps parser output, one entry per sentence; null where there was no parse
	@param golds reference trees; null where the gold line was unreadable
	@return the totals
	@throws ScoringAlignmentException if the corpora have different numbers of sentences
	 */
	public Evaluation scoreCorpus(List<? extends TreeNode> hyps, List<? extends TreeNode> golds) throws ScoringAlignmentException {
		return scoreCorpus(hyps, golds, null);
	}

	/** Score two aligned corpora, also collecting each sentence's score.

	@param hyps parser output, one entry per sentence; null where there was no parse
	@param golds reference trees; null where the gold line was unreadable
	@param perSentence gets each scored sentence, in order. May be null
	@return the totals
	@throws ScoringAlignmentException if the corpora have different numbers of sentences
	 */
	public Evaluation scoreCorpus(List<? extends TreeNode> hyps, List<? extends TreeNode> golds,
			List<SentenceScore> perSentence) throws ScoringAlignmentException {
		if (hyps.size() != golds.size())
			throw new ScoringAlignmentException("Hypothesis corpus has "+hyps.size()+
					" sentences but gold corpus has "+golds.size());
		Evaluation eval = new Evaluation();
		for (int i = 0; i < hyps.size(); i++) {
			try {
				SentenceScore s = score(i+1, hyps.get(i), golds.get(i));
				eval.add(s);
				if (perSentence != null)
					perSentence.add(s);
			}
			catch (ScoringAlignmentException e) {
				eval.flag(i+1, e);
			}
		}
		return eval;
	}
}
