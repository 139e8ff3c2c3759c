package edu.isi.treeprep;

/** A labeled span: the label of a constituent and the leaves it covers,
    as a zero-based start and an exclusive end.
 */
public class Constituent {
	private final String label;
	private final int start;
	private final int end;

	public Constituent(String label, int start, int end) {
		this.label = label;
		this.start = start;
		this.end = end;
	}

	public String getLabel() { return label; }
	public int getStart() { return start; }
	public int getEnd() { return end; }

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Constituent))
			return false;
		Constituent c = (Constituent)o;
		return start == c.start && end == c.end && label.equals(c.label);
	}

	public int hashCode() {
		return (label.hashCode()*31 + start)*31 + end;
	}

	public String toString() { return "("+label+", "+start+", "+end+")"; }
}
