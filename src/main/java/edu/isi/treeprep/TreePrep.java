package edu.isi.treeprep;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class TreePrep {
	// version number. change this when updating treeprep!
	static final String VERSION = "1.0";

	// what a run does
	public enum MODE { BINARIZE, UNK, DEBINARIZE, SCORE, CHECK }

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA INPUT

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// label of the root wrapper every treebank tree has
		FlaggedOption topopt = new FlaggedOption("top",
				StringStringParser.getParser(),
				Binarizer.DEFAULT_TOP,
				true,
				JSAP.NO_SHORTFLAG,
				"top",
				"label of the root of every tree. The root keeps its unary wrapper when binarizing "+
		"and is not counted as a bracket when scoring. Default is TOP");
		jsap.registerParameter(topopt);

		// OPTIONS REGARDING THE OPERATIONS TO PERFORM:

		// forward transform: original trees to binary trees for training
		Switch binsw = new Switch("binarize",
				'b',
				"binarize",
				"binarize the trees in the input file: fuse unary chains with '_' and split nodes with more than "+
		"two children using synthetic '*' nodes. Lines that can't be read or binarized are reported and left out");
		jsap.registerParameter(binsw);

		FlaggedOption branchopt = new FlaggedOption("branching",
				EnumeratedStringParser.getParser("right; left"),
				"right",
				true,
				JSAP.NO_SHORTFLAG,
				"branching",
				"direction of the synthetic nodes made by -b: right or left. Default is right");
		jsap.registerParameter(branchopt);

		Switch emptysw = new Switch("removeempty",
				JSAP.NO_SHORTFLAG,
				"remove-empty",
				"with -b, first remove "+EmptyNodeRemover.EMPTY_TAG+" leaves and the constituents they leave empty");
		jsap.registerParameter(emptysw);

		// rare word masking. alone or after binarizing
		Switch unksw = new Switch("unk",
				'u',
				"unk",
				"replace words seen fewer than --unk-threshold times in the input with "+RareWordMasker.UNKNOWN+
		". May be used alone or with -b, in which case masking follows binarization");
		jsap.registerParameter(unksw);

		FlaggedOption unkthreshopt = new FlaggedOption("unkthreshold",
				IntegerStringParser.getParser(),
				""+RareWordMasker.DEFAULT_THRESHOLD,
				true,
				JSAP.NO_SHORTFLAG,
				"unk-threshold",
				"with -u, words seen fewer than <unkthreshold> times are replaced. Default is 2, i.e. words seen once");
		jsap.registerParameter(unkthreshopt);

		// reverse transform: parser output back to original form
		Switch debinsw = new Switch("debinarize",
				'd',
				"debinarize",
				"undo binarization of the trees in the input file (typically parser output). Blank or bad lines are "+
		"written as blank lines so the output stays aligned with the input");
		jsap.registerParameter(debinsw);

		// bracket scoring
		Switch scoresw = new Switch("score",
				's',
				"score",
				"score the first input file (parser output) against the second (gold trees) and print "+
		"labeled bracket precision, recall and F1");
		jsap.registerParameter(scoresw);

		FlaggedOption ignoreopt = new FlaggedOption("ignore",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"ignore-labels",
				"with -s, comma-separated constituent labels that are never counted");
		ignoreopt.setList(true);
		ignoreopt.setListSeparator(',');
		jsap.registerParameter(ignoreopt);

		Switch verbosesw = new Switch("verbose",
				'v',
				"verbose",
				"with -s, also print a line of counts for every sentence");
		jsap.registerParameter(verbosesw);

		// return information about the input files
		Switch csw = new Switch("check",
				'c',
				"check",
				"check the input files: number of trees, bad lines, nodes, and words");
		jsap.registerParameter(csw);

		// OPTIONS REGARDING THE DATA THAT IS OUTPUT

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"Print timing information to stderr at a variety of levels: 0+ for "+
		"total operation, 1+ for each processing stage");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write output trees or scores or summary. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		// set of input files.
		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"list of input files, one tree per line. With -s, exactly two: parser output, then gold trees. "+
				"With -c, any number. Otherwise exactly one. The special symbol '-' "+
		"(no quote) may be specified once to indicate reading from STDIN.");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.getBoolean("help") || !config.success())
			return config;

		// make sure there aren't too many switches on
		int numActive = 0;
		if (config.getBoolean("binarize"))
			numActive++;
		if (config.getBoolean("debinarize"))
			numActive++;
		if (config.getBoolean("score"))
			numActive++;
		if (config.getBoolean("check"))
			numActive++;
		if (numActive > 1)
			throw new ConfigureException("Can have at most one of -b, -d, -s, -c arguments!");
		if (numActive == 0 && !config.getBoolean("unk"))
			throw new ConfigureException("Nothing to do: specify one of -b, -u, -d, -s, -c");
		if (config.getBoolean("unk") && numActive == 1 && !config.getBoolean("binarize"))
			throw new ConfigureException("-u can only be used alone or with -b");
		if (config.getBoolean("removeempty") && !config.getBoolean("binarize"))
			throw new ConfigureException("--remove-empty is only meaningful with -b");
		if (config.getInt("unkthreshold") < 1)
			throw new ConfigureException("--unk-threshold must be at least 1, not "+config.getInt("unkthreshold"));

		// right number of files
		File[] infiles = config.getFileArray("infiles");
		if (config.getBoolean("score") && infiles.length != 2)
			throw new ConfigureException("Scoring needs exactly two files (parser output, gold); got "+infiles.length);
		if (!config.getBoolean("score") && !config.getBoolean("check") && infiles.length != 1)
			throw new ConfigureException("Expected exactly one input file; got "+infiles.length);
		int numStdin = 0;
		for (File f : infiles)
			if (f.getName().equals("-"))
				numStdin++;
		if (numStdin > 1)
			throw new ConfigureException("Can only reference stdin (-) once in the list of files");
		return config;
	}

	// which mode the (valid) configuration asks for
	static MODE getMode(JSAPResult config) {
		if (config.getBoolean("binarize"))
			return MODE.BINARIZE;
		if (config.getBoolean("debinarize"))
			return MODE.DEBINARIZE;
		if (config.getBoolean("score"))
			return MODE.SCORE;
		if (config.getBoolean("check"))
			return MODE.CHECK;
		return MODE.UNK;
	}

	// forward transform. bad trees are reported and dropped
	static List<TreeNode> binarizeAll(Treebank tb, Binarizer bin, boolean removeEmpty) {
		Vector<TreeNode> ret = new Vector<TreeNode>();
		EmptyNodeRemover remover = new EmptyNodeRemover();
		for (TreebankLine line : tb.getLines()) {
			TreeNode t = line.getTree();
			if (t == null)
				continue;
			if (removeEmpty) {
				t = remover.remove(t);
				if (t == null) {
					Debug.lineWarning(tb.getName(), line.getLine(), "nothing left after removing empty elements");
					continue;
				}
			}
			if (bin.getTopLabel() != null && !t.getLabel().equals(bin.getTopLabel())) {
				Debug.lineWarning(tb.getName(), line.getLine(), "root is "+t.getLabel()+", not "+bin.getTopLabel());
				continue;
			}
			try {
				ret.add(bin.binarize(t));
			}
			catch (StructuralInvariantException e) {
				Debug.lineWarning(tb.getName(), line.getLine(), e.getMessage());
			}
		}
		return ret;
	}

	// reverse transform. bad trees become blank lines
	static List<TreeNode> debinarizeAll(Treebank tb) {
		Vector<TreeNode> ret = new Vector<TreeNode>();
		Debinarizer debin = new Debinarizer();
		for (TreebankLine line : tb.getLines()) {
			TreeNode t = line.getTree();
			if (t != null) {
				try {
					t = debin.debinarize(t);
				}
				catch (StructuralInvariantException e) {
					Debug.lineWarning(tb.getName(), line.getLine(), e.getMessage());
					t = null;
				}
			}
			ret.add(t);
		}
		return ret;
	}

	// count, warn about the reserved token, then mask
	static List<TreeNode> maskAll(List<TreeNode> trees, int threshold) {
		Vector<TreeNode> kept = new Vector<TreeNode>();
		for (TreeNode t : trees)
			if (t != null)
				kept.add(t);
		WordCounts counts = WordCounts.count(kept);
		if (counts.get(RareWordMasker.UNKNOWN) > 0)
			Debug.prettyDebug("Warning: input already contains "+counts.get(RareWordMasker.UNKNOWN)+
					" occurrences of "+RareWordMasker.UNKNOWN+"; they are treated as ordinary words");
		RareWordMasker masker = new RareWordMasker(threshold);
		Set<String> rare = counts.rareWords(threshold);
		Debug.prettyDebug("Replacing "+rare.size()+" of "+counts.getNumTypes()+" word types with "+RareWordMasker.UNKNOWN);
		Vector<TreeNode> ret = new Vector<TreeNode>();
		for (TreeNode t : kept)
			ret.add(masker.mask(t, counts));
		return ret;
	}

	// create a summary of a treebank and add it to a buffer
	static void getTreebankCheck(StringBuffer buffer, Treebank tb) {
		int trees = 0;
		int nodes = 0;
		int words = 0;
		int nonBinary = 0;
		for (TreeNode t : tb.getTrees()) {
			if (t == null)
				continue;
			trees++;
			nodes += t.numNodes();
			words += t.getLeaves().size();
			if (!Binarizer.isBinary(t))
				nonBinary++;
		}
		buffer.append("Treebank info for "+tb.getName()+":\n");
		buffer.append("\t"+tb.size()+" lines\n");
		buffer.append("\t"+trees+" trees\n");
		buffer.append("\t"+tb.getNumErrors()+" bad lines\n");
		buffer.append("\t"+tb.getNumBlank()+" blank lines\n");
		buffer.append("\t"+nodes+" nodes\n");
		buffer.append("\t"+words+" words\n");
		buffer.append("\t"+nonBinary+" trees with a node of more than two children\n");
	}

	/** Do everything main does, but return the exit status instead of exiting

	@param argv command line
	@return 0 on success, 1 on a configuration, input, or alignment error
	 */
	public static int run(String argv[]) throws IOException {
		Date startTime = new Date();
		// parameter processor and configuration settings
		JSAP jsap = new JSAP();
		JSAPResult config = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("TreePrep options improperly configured: "+e.getMessage());
			System.err.println("Try 'treeprep -h` for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("TreePrep options improperly configured: "+e.getMessage());
			System.err.println("Try 'treeprep -h` for a detailed help message");
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: treeprep ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator();
			errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: treeprep ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));
		String top = config.getString("top");
		File[] infiles = config.getFileArray("infiles");
		File outfile = config.getFile("outfile");
		MODE mode = getMode(config);

		// 2) Read input.
		Date readTime = new Date();
		Treebank[] banks = new Treebank[infiles.length];
		for (int i = 0; i < infiles.length; i++) {
			try {
				banks[i] = Treebank.read(infiles[i], encoding);
			}
			catch (IOException e) {
				System.err.println("Couldn't read "+infiles[i].getName()+": "+e.getMessage());
				return 1;
			}
			if (banks[i].getNumErrors() > 0)
				Debug.prettyDebug(banks[i].getNumErrors()+" of "+banks[i].size()+" lines of "+
						banks[i].getName()+" could not be read");
		}
		Debug.dbtime(1, readTime, "read input");

		// 3) Do the work. Write to the output.
		Date workTime = new Date();
		OutputStreamWriter w = null;
		if (outfile != null)
			w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
		else
			w = new OutputStreamWriter(System.out, encoding);
		int status = 0;
		try {
			switch (mode) {
			case BINARIZE:
				Binarizer bin = new Binarizer(top, Binarizer.Branching.get(config.getString("branching")));
				List<TreeNode> binTrees = binarizeAll(banks[0], bin, config.getBoolean("removeempty"));
				Debug.dbtime(1, workTime, "binarize");
				if (config.getBoolean("unk"))
					binTrees = maskAll(binTrees, config.getInt("unkthreshold"));
				Treebank.write(w, binTrees);
				Debug.prettyDebug("Wrote "+binTrees.size()+" of "+banks[0].size()+" trees");
				break;
			case UNK:
				Treebank.write(w, maskAll(banks[0].getTrees(), config.getInt("unkthreshold")));
				break;
			case DEBINARIZE:
				Treebank.write(w, debinarizeAll(banks[0]));
				break;
			case SCORE:
				Set<String> ignored = new HashSet<String>();
				if (config.contains("ignore"))
					ignored.addAll(Arrays.asList(config.getStringArray("ignore")));
				BracketScorer scorer = new BracketScorer(top, ignored);
				Vector<SentenceScore> sents = new Vector<SentenceScore>();
				Evaluation eval = scorer.scoreCorpus(banks[0].getTrees(), banks[1].getTrees(), sents);
				if (config.getBoolean("verbose")) {
					w.write("Sent.  Len.  Recal  Prec. Match Gold Test Words CorrTags\n");
					for (SentenceScore s : sents)
						w.write(s.toString()+"\n");
					w.write("\n");
				}
				for (String msg : eval.getFlagged())
					Debug.prettyDebug("Skipped "+msg);
				w.write(eval.summary()+"\n");
				w.flush();
				break;
			case CHECK:
				StringBuffer buffer = new StringBuffer();
				for (Treebank tb : banks)
					getTreebankCheck(buffer, tb);
				w.write(buffer.toString());
				w.flush();
				break;
			}
		}
		catch (ConfigureException e) {
			System.err.println("TreePrep options improperly configured: "+e.getMessage());
			status = 1;
		}
		catch (ScoringAlignmentException e) {
			System.err.println("Can't score: "+e.getMessage());
			status = 1;
		}
		finally {
			if (outfile != null)
				w.close();
			else
				w.flush();
		}
		Debug.dbtime(1, workTime, "process "+mode.toString().toLowerCase());
		Debug.dbtime(0, startTime, "total operation");
		return status;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is TreePrep, version "+VERSION);
		System.exit(run(argv));
	}
}
