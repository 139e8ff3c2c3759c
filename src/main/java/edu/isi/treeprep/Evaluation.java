package edu.isi.treeprep;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

/** Corpus totals for bracket scoring. Counts are summed over all scored
    sentences before dividing (micro-averaging). Sentences that could not be
    aligned are kept aside with their reason and don't count.
 */
public class Evaluation {
	private int sentences = 0;
	private int matched = 0;
	private int proposed = 0;
	private int gold = 0;
	private int tagsCorrect = 0;
	private int tagsTotal = 0;
	private int completeMatches = 0;
	private int missingParses = 0;
	private final Vector<String> flagged = new Vector<String>();

	/** Add the counts of one sentence */
	public void add(SentenceScore s) {
		sentences++;
		matched += s.getMatched();
		proposed += s.getProposed();
		gold += s.getGold();
		tagsCorrect += s.getTagsCorrect();
		tagsTotal += s.getTagsTotal();
		if (s.isCompleteMatch())
			completeMatches++;
		if (s.isMissingParse())
			missingParses++;
	}

	/** Record a sentence excluded from the totals

	@param sentence one-based position of the pair
	@param e why it couldn't be scored
	 */
	public void flag(int sentence, ScoringAlignmentException e) {
		flagged.add("sentence "+sentence+": "+e.getMessage());
	}

	public int getNumSentences() { return sentences; }
	public int getMatched() { return matched; }
	public int getProposed() { return proposed; }
	public int getGold() { return gold; }
	public int getCompleteMatches() { return completeMatches; }
	public int getMissingParses() { return missingParses; }
	public int getNumFlagged() { return flagged.size(); }
	/** @return one message per excluded sentence, in corpus order */
	public List<String> getFlagged() { return Collections.unmodifiableList(flagged); }

	public double getPrecision() { return ratio(matched, proposed); }
	public double getRecall() { return ratio(matched, gold); }
	public double getF1() { return fScore(getPrecision(), getRecall()); }
	public double getTaggingAccuracy() { return ratio(tagsCorrect, tagsTotal); }
	public double getCompleteMatchRate() { return ratio(completeMatches, sentences); }

	// 0 if nothing to divide by
	static double ratio(int num, int denom) {
		if (denom == 0)
			return 0;
		return ((double)num)/denom;
	}

	/** Harmonic mean of precision and recall; 0 when both are 0 */
	public static double fScore(double p, double r) {
		if (p + r == 0)
			return 0;
		return 2*p*r/(p + r);
	}

	/** Summary block, in the spirit of evalb's */
	public String summary() {
		StringBuffer sb = new StringBuffer();
		sb.append("Number of sentences        = "+(sentences+flagged.size())+"\n");
		sb.append("Number of error sentences  = "+flagged.size()+"\n");
		sb.append("Number of missing parses   = "+missingParses+"\n");
		sb.append("Number of valid sentences  = "+sentences+"\n");
		sb.append(String.format("Bracketing Recall          = %6.2f", 100*getRecall())+"\n");
		sb.append(String.format("Bracketing Precision       = %6.2f", 100*getPrecision())+"\n");
		sb.append(String.format("Bracketing FMeasure        = %6.2f", 100*getF1())+"\n");
		sb.append(String.format("Complete match             = %6.2f", 100*getCompleteMatchRate())+"\n");
		sb.append(String.format("Tagging accuracy           = %6.2f", 100*getTaggingAccuracy())+"\n");
		sb.append("Matched brackets           = "+matched+"\n");
		sb.append("Proposed brackets          = "+proposed+"\n");
		sb.append("Gold brackets              = "+gold);
		return sb.toString();
	}
}
