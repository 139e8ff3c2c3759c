package edu.isi.treeprep;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// messages to stderr: progress, per-line problems, timing, and developer debugging
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static OutputStreamWriter w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    private static void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // stuff we always print to stderr
    public static void prettyDebug(String s) {
	write(s);
    }

    // a problem with one input line that doesn't stop the run
    public static void lineWarning(String file, int line, String s) {
	write("Warning: "+file+":"+line+": "+s);
    }

    // true debugging stuff. caller is looked up from the stack
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	debug(0, caller.getClassName()+":"+caller.getMethodName(), s);
    }
    public static void debug(boolean d, int i, String s) {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	debug(i, caller.getClassName()+":"+caller.getMethodName(), s);
    }
    private static void debug(int i, String caller, String s) {
	StringBuffer sb = new StringBuffer();
	for (int x = 0; x < i; x++)
	    sb.append(" ");
	sb.append(caller+" : "+s);
	write(sb.toString());
    }

    private static int dblevel=-1;
    public static void setDbLevel(int i) {
	dblevel = i;
    }
    // print time debug info if the global level is at least needlevel
    public static void dbtime(int needlevel, Date pta, String msg) {
	if (dblevel < needlevel)
	    return;
	Date ptb = new Date();
	write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
    }

}
