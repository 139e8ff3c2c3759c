package edu.isi.treeprep;

import static org.junit.Assert.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Vector;

import org.junit.Test;

public class TreebankTest {

	static BufferedReader resource(String name) throws Exception {
		return new BufferedReader(new InputStreamReader(TreebankTest.class.getResourceAsStream(name), "utf-8"));
	}

	@Test
	public void testBadLinesAreIsolated() throws Exception {
		Treebank tb = Treebank.read(resource("bad.trees"), "bad.trees");
		assertEquals(5, tb.size());
		assertEquals(2, tb.getNumErrors());
		assertEquals(1, tb.getNumBlank());
		List<TreebankLine> lines = tb.getLines();
		assertTrue(lines.get(0).hasTree());
		assertFalse(lines.get(1).hasTree());
		assertEquals(2, lines.get(1).getError().getLine());
		assertTrue(lines.get(1).getError().getMessage().startsWith("line 2:"));
		assertTrue(lines.get(2).isBlank());
		assertTrue(lines.get(3).hasTree());
		assertEquals("(TOP (NP (NN dinner)))", lines.get(3).getTree().toString());
		assertEquals(5, lines.get(4).getError().getLine());
		assertEquals("(TOP (S (NP (PRP We)) (VP (VBD left))) extra", lines.get(4).getText());
	}

	@Test
	public void testTreesKeepLinePositions() throws Exception {
		Treebank tb = Treebank.read(resource("bad.trees"), "bad.trees");
		List<TreeNode> trees = tb.getTrees();
		assertEquals(5, trees.size());
		assertNotNull(trees.get(0));
		assertNull(trees.get(1));
		assertNull(trees.get(2));
		assertNotNull(trees.get(3));
		assertNull(trees.get(4));
	}

	@Test
	public void testWriteBlankForMissing() throws Exception {
		Vector<TreeNode> trees = new Vector<TreeNode>();
		trees.add(TreeNode.parse("(TOP (NP (NN dinner)))"));
		trees.add(null);
		trees.add(TreeNode.parse("(TOP (NP (NN lunch)))"));
		StringWriter w = new StringWriter();
		Treebank.write(w, trees);
		assertEquals("(TOP (NP (NN dinner)))\n\n(TOP (NP (NN lunch)))\n", w.toString());
	}

	@Test
	public void testReadFromString() throws Exception {
		Treebank tb = Treebank.read(new BufferedReader(new StringReader("(TOP (NP (NN a)))\n(TOP (NP (NN b)))")), "inline");
		assertEquals(2, tb.size());
		assertEquals(0, tb.getNumErrors());
		assertEquals("inline", tb.getName());
	}

	@Test
	public void testReadFile() throws Exception {
		File f = new File(TreebankTest.class.getResource("train.trees").toURI());
		Treebank tb = Treebank.read(f, "utf-8");
		assertEquals(4, tb.size());
		assertEquals("train.trees", tb.getName());
	}
}
