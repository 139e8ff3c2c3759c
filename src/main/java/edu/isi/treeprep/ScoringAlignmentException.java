package edu.isi.treeprep;
/** for hypothesis and gold trees (or corpora) that don't cover the same words */

public class ScoringAlignmentException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ScoringAlignmentException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ScoringAlignmentException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ScoringAlignmentException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public ScoringAlignmentException(Throwable cause) { super(cause); } 
}
