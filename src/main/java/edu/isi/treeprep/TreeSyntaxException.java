package edu.isi.treeprep;
/** for malformed bracketed tree text. When raised while reading a
    corpus, carries the (one-based) line the text came from. */

public class TreeSyntaxException extends Exception {
    // 0 when the text did not come from a numbered line
    private int line = 0;

    /**          Constructs a new exception with null as its detail message. */
    public TreeSyntaxException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public TreeSyntaxException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and the line it was found on. */
    public TreeSyntaxException(String message, int line) { 
	super("line "+line+": "+message); 
	this.line = line;
    }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public TreeSyntaxException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public TreeSyntaxException(Throwable cause) { super(cause); } 

    /** the line the bad text was read from, or 0 if unknown */
    public int getLine() { return line; }
}
