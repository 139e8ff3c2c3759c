package edu.isi.treeprep;

/** Bracket counts for one hypothesis/gold pair.
 */
public class SentenceScore {
	private final int sentence;
	private final int length;
	private final int matched;
	private final int proposed;
	private final int gold;
	private final int tagsCorrect;
	private final int tagsTotal;
	private final boolean missingParse;

	/** Creates a score

	@param sentence one-based position of the pair in the corpus
	@param length number of words
	@param matched constituents found in both trees
	@param proposed constituents in the hypothesis
	@param gold constituents in the gold tree
	@param tagsCorrect leaves with the gold tag
	@param tagsTotal leaves compared for tagging
	@param missingParse true if there was no hypothesis tree
	 */
	public SentenceScore(int sentence, int length, int matched, int proposed, int gold,
			int tagsCorrect, int tagsTotal, boolean missingParse) {
		this.sentence = sentence;
		this.length = length;
		this.matched = matched;
		this.proposed = proposed;
		this.gold = gold;
		this.tagsCorrect = tagsCorrect;
		this.tagsTotal = tagsTotal;
		this.missingParse = missingParse;
	}

	public int getMatched() { return matched; }
	public int getProposed() { return proposed; }
	public int getGold() { return gold; }
	public int getTagsCorrect() { return tagsCorrect; }
	public int getTagsTotal() { return tagsTotal; }
	public boolean isMissingParse() { return missingParse; }

	public double getPrecision() { return Evaluation.ratio(matched, proposed); }
	public double getRecall() { return Evaluation.ratio(matched, gold); }
	public double getF1() { return Evaluation.fScore(getPrecision(), getRecall()); }

	/** @return true if the hypothesis has exactly the gold brackets */
	public boolean isCompleteMatch() {
		return !missingParse && matched == proposed && matched == gold;
	}

	// one line, in the spirit of evalb's per-sentence table
	public String toString() {
		return String.format("%4d %4d %6.2f %6.2f %4d %4d %4d %4d %4d%s",
				sentence, length, 100*getRecall(), 100*getPrecision(),
				matched, gold, proposed, tagsTotal, tagsCorrect,
				missingParse ? " (no parse)" : "");
	}
}
