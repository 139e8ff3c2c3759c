package edu.isi.treeprep;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Vector;

import org.junit.Test;

public class BracketScorerTest {

	private static final double EPS = 1e-9;

	private final BracketScorer scorer = new BracketScorer();

	static String gold1 = "(TOP (S (NP (DT the) (NN flight)) (VP (VBD left) (PP (IN from) (NP (NNP Denver))))) (PUNC .))";

	@Test
	public void testConstituents() throws Exception {
		List<Constituent> cons = scorer.constituents(TreeNode.parse(gold1));
		assertEquals(Arrays.asList(
				new Constituent("S", 0, 5),
				new Constituent("NP", 0, 2),
				new Constituent("VP", 2, 5),
				new Constituent("PP", 3, 5),
				new Constituent("NP", 4, 5)), cons);
	}

	@Test
	public void testVacuousBracketsNotCounted() throws Exception {
		// the top wrapper and an NP directly over an identical NP
		List<Constituent> cons = scorer.constituents(TreeNode.parse("(TOP (NP (NP (DT a) (NN flight))))"));
		assertEquals(Collections.singletonList(new Constituent("NP", 0, 2)), cons);
		// TOP below the root is an ordinary label
		assertEquals(2, scorer.constituents(TreeNode.parse("(TOP (TOP (NP (NN a))))")).size());
		// a scorer with no top label counts the root
		BracketScorer all = new BracketScorer(null, Collections.<String>emptySet());
		assertEquals(2, all.constituents(TreeNode.parse("(TOP (NP (DT a) (NN flight)))")).size());
	}

	@Test
	public void testDuplicateInsideSentenceCounted() throws Exception {
		// an NP over an NP short of the whole sentence is two brackets
		List<Constituent> cons = scorer.constituents(TreeNode.parse("(TOP (S (NP (NP (DT a) (NN b))) (VP (VB c))))"));
		assertEquals(Arrays.asList(
				new Constituent("S", 0, 3),
				new Constituent("NP", 0, 2),
				new Constituent("NP", 0, 2),
				new Constituent("VP", 2, 3)), cons);
		// and a duplicate NP in the hypothesis only matches one of them
		TreeNode gold = TreeNode.parse("(TOP (S (NP (DT a) (NN b)) (VP (VB c))))");
		SentenceScore s = scorer.score(1, TreeNode.parse("(TOP (S (NP (NP (DT a) (NN b))) (VP (VB c))))"), gold);
		assertEquals(3, s.getMatched());
		assertEquals(4, s.getProposed());
		assertEquals(3, s.getGold());
	}

	@Test
	public void testIgnoredLabels() throws Exception {
		BracketScorer noPP = new BracketScorer("TOP", new HashSet<String>(Arrays.asList("PP")));
		assertEquals(4, noPP.constituents(TreeNode.parse(gold1)).size());
	}

	@Test
	public void testOverlapExample() {
		List<Constituent> hyp = Arrays.asList(new Constituent("NP", 0, 2), new Constituent("VP", 1, 4));
		List<Constituent> gold = Arrays.asList(new Constituent("NP", 0, 2), new Constituent("VP", 1, 3));
		int matched = BracketScorer.countMatches(hyp, gold);
		assertEquals(1, matched);
		SentenceScore s = new SentenceScore(1, 4, matched, hyp.size(), gold.size(), 0, 0, false);
		assertEquals(0.5, s.getPrecision(), EPS);
		assertEquals(0.5, s.getRecall(), EPS);
		assertEquals(0.5, s.getF1(), EPS);
	}

	@Test
	public void testMatchingRespectsMultiplicity() {
		Constituent np = new Constituent("NP", 0, 2);
		List<Constituent> two = Arrays.asList(np, np);
		List<Constituent> one = Collections.singletonList(np);
		assertEquals(1, BracketScorer.countMatches(two, one));
		assertEquals(1, BracketScorer.countMatches(one, two));
		assertEquals(2, BracketScorer.countMatches(two, two));
	}

	@Test
	public void testSelfScoreIsPerfect() throws Exception {
		TreeNode t = TreeNode.parse(gold1);
		SentenceScore s = scorer.score(1, t, t);
		assertEquals(5, s.getMatched());
		assertEquals(1.0, s.getPrecision(), EPS);
		assertEquals(1.0, s.getRecall(), EPS);
		assertEquals(1.0, s.getF1(), EPS);
		assertTrue(s.isCompleteMatch());
		assertEquals(6, s.getTagsCorrect());
	}

	@Test
	public void testDisjointScoresZero() throws Exception {
		TreeNode gold = TreeNode.parse("(TOP (S (NP (DT the) (NN flight)) (VP (VBD left))))");
		TreeNode hyp = TreeNode.parse("(TOP (X (DT the) (Y (NN flight) (VBD left))))");
		SentenceScore s = scorer.score(1, hyp, gold);
		assertEquals(0, s.getMatched());
		assertEquals(0.0, s.getF1(), EPS);
		assertFalse(s.isCompleteMatch());
	}

	@Test
	public void testWrongTagsStillMatchBrackets() throws Exception {
		TreeNode gold = TreeNode.parse("(TOP (S (NP (DT the) (NN flight)) (VP (VBD left))))");
		TreeNode hyp = TreeNode.parse("(TOP (S (NP (DT the) (VB flight)) (VP (NN left))))");
		SentenceScore s = scorer.score(1, hyp, gold);
		assertEquals(1.0, s.getF1(), EPS);
		assertEquals(1, s.getTagsCorrect());
		assertEquals(3, s.getTagsTotal());
	}

	@Test(expected = ScoringAlignmentException.class)
	public void testLengthMismatch() throws Exception {
		scorer.score(1, TreeNode.parse("(TOP (NP (DT the) (NN flight)))"), TreeNode.parse("(TOP (NP (NN flight)))"));
	}

	@Test(expected = ScoringAlignmentException.class)
	public void testWordMismatch() throws Exception {
		scorer.score(1, TreeNode.parse("(TOP (NP (DT the) (NN flight)))"), TreeNode.parse("(TOP (NP (DT a) (NN flight)))"));
	}

	@Test
	public void testMissingParse() throws Exception {
		SentenceScore s = scorer.score(3, null, TreeNode.parse(gold1));
		assertTrue(s.isMissingParse());
		assertEquals(0, s.getProposed());
		assertEquals(5, s.getGold());
		assertEquals(0.0, s.getRecall(), EPS);
	}

	@Test
	public void testCorpusIsMicroAveraged() throws Exception {
		// sentence 1: 1 of 1 matched. sentence 2: 0 of 3 matched
		Vector<TreeNode> hyps = new Vector<TreeNode>();
		Vector<TreeNode> golds = new Vector<TreeNode>();
		hyps.add(TreeNode.parse("(TOP (NP (DT a) (NN b)))"));
		golds.add(TreeNode.parse("(TOP (NP (DT a) (NN b)))"));
		hyps.add(TreeNode.parse("(TOP (X (Y (DT a) (NN b)) (Z (VB c) (RB d))))"));
		golds.add(TreeNode.parse("(TOP (S (DT a) (Q (NN b) (R (VB c) (RB d)))))"));
		Evaluation eval = scorer.scoreCorpus(hyps, golds);
		assertEquals(2, eval.getNumSentences());
		assertEquals(1, eval.getMatched());
		assertEquals(4, eval.getProposed());
		assertEquals(4, eval.getGold());
		assertEquals(0.25, eval.getPrecision(), EPS);
		assertEquals(0.25, eval.getRecall(), EPS);
		// averaging per-sentence F1 would give 0.5
		assertEquals(0.25, eval.getF1(), EPS);
		assertEquals(1, eval.getCompleteMatches());
	}

	@Test
	public void testMisalignedSentencesFlaggedNotCounted() throws Exception {
		Vector<TreeNode> hyps = new Vector<TreeNode>();
		Vector<TreeNode> golds = new Vector<TreeNode>();
		hyps.add(TreeNode.parse(gold1));
		golds.add(TreeNode.parse(gold1));
		hyps.add(TreeNode.parse("(TOP (NP (DT the) (NN plane)))"));
		golds.add(TreeNode.parse("(TOP (NP (DT the) (NN flight)))"));
		hyps.add(TreeNode.parse("(TOP (NP (NN dinner)))"));
		golds.add(null);
		Vector<SentenceScore> sents = new Vector<SentenceScore>();
		Evaluation eval = scorer.scoreCorpus(hyps, golds, sents);
		assertEquals(1, eval.getNumSentences());
		assertEquals(0, eval.getMissingParses());
		assertEquals(1, sents.size());
		assertEquals(2, eval.getNumFlagged());
		assertTrue(eval.getFlagged().get(0).startsWith("sentence 2"));
		assertTrue(eval.getFlagged().get(1).startsWith("sentence 3"));
		assertEquals(1.0, eval.getF1(), EPS);
	}

	@Test
	public void testMissingParsesCountedInCorpus() throws Exception {
		Vector<TreeNode> hyps = new Vector<TreeNode>();
		Vector<TreeNode> golds = new Vector<TreeNode>();
		hyps.add(TreeNode.parse(gold1));
		golds.add(TreeNode.parse(gold1));
		hyps.add(null);
		golds.add(TreeNode.parse(gold1));
		Evaluation eval = scorer.scoreCorpus(hyps, golds);
		assertEquals(2, eval.getNumSentences());
		assertEquals(1, eval.getMissingParses());
		assertEquals(1.0, eval.getPrecision(), EPS);
		assertEquals(0.5, eval.getRecall(), EPS);
	}

	@Test(expected = ScoringAlignmentException.class)
	public void testCorpusSizeMismatch() throws Exception {
		Vector<TreeNode> hyps = new Vector<TreeNode>();
		hyps.add(TreeNode.parse(gold1));
		scorer.scoreCorpus(hyps, new Vector<TreeNode>());
	}

	@Test
	public void testFScore() {
		assertEquals(0.0, Evaluation.fScore(0, 0), EPS);
		assertEquals(0.0, Evaluation.fScore(1, 0), EPS);
		assertEquals(2*0.8*0.5/1.3, Evaluation.fScore(0.8, 0.5), EPS);
	}

	@Test
	public void testEmptyEvaluation() {
		Evaluation eval = new Evaluation();
		assertEquals(0.0, eval.getPrecision(), EPS);
		assertEquals(0.0, eval.getRecall(), EPS);
		assertEquals(0.0, eval.getF1(), EPS);
		assertTrue(eval.summary().contains("Number of sentences        = 0"));
	}
}
