package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ustore.cloudcli.utils.Errors;

/**
 * Implements a line diff based on the longest common subsequence, rendered as unified-diff hunks.
 * <p><p>
 * The common prefix and suffix are stripped before the quadratic table is built over what remains.
 */
public class LineDiff 
{
	public static final long MAX_TABLE_CELLS = 64L * 1024 * 1024;
	
	/** Represents one hunk: ranges in both files and the prefixed lines ({@code ' '}, {@code '-'}, {@code '+'}). */
	public static class Hunk
	{
		protected final int leftStart;
		protected final int leftCount;
		protected final int rightStart;
		protected final int rightCount;
		protected final List<String> lines;
		
		protected Hunk(int ls, int lc, int rs, int rc, List<String> l)
		{
			leftStart = ls; leftCount = lc; rightStart = rs; rightCount = rc; lines = Collections.unmodifiableList(l);
		}
		
		public int getLeftStart() { return leftStart; }
		public int getLeftCount() { return leftCount; }
		public int getRightStart() { return rightStart; }
		public int getRightCount() { return rightCount; }
		public List<String> getLines() { return lines; }
		
		public String header() { return "@@ -" + leftStart + "," + leftCount + " +" + rightStart + "," + rightCount + " @@"; }
	}
	
	private static final char EQUAL = ' ';
	private static final char DELETE = '-';
	private static final char INSERT = '+';
	
	private LineDiff() {}
	
	public static List<Hunk> diff(List<String> left, List<String> right, boolean ignoreTrailingSpace, int context)
	{
		if(context < 0) { throw Errors.invalidArgument("context must not be negative: " + context); }
		
		List<String> a = ignoreTrailingSpace ? rtrimAll(left) : left;
		List<String> b = ignoreTrailingSpace ? rtrimAll(right) : right;
		
		char[] ops = script(a, b);
		return hunks(ops, left, right, context);
	}
	
	static String rtrim(String s)
	{
		int end = s.length();
		while(end > 0 && (s.charAt(end - 1) == ' ' || s.charAt(end - 1) == '\t')) { end--; }
		return s.substring(0, end);
	}
	
	private static List<String> rtrimAll(List<String> lines)
	{
		List<String> ret = new ArrayList<String>(lines.size());
		for(String s : lines) { ret.add(rtrim(s)); }
		return ret;
	}
	
	/** Computes the edit script as a sequence of EQUAL, DELETE and INSERT operations. */
	static char[] script(List<String> a, List<String> b)
	{
		int n = a.size(), m = b.size();
		int prefix = 0;
		while(prefix < n && prefix < m && a.get(prefix).equals(b.get(prefix)) == true) { prefix++; }
		int suffix = 0;
		while(suffix < n - prefix && suffix < m - prefix && a.get(n - 1 - suffix).equals(b.get(m - 1 - suffix)) == true) { suffix++; }
		
		int rows = n - prefix - suffix, cols = m - prefix - suffix;
		if((long)(rows + 1) * (cols + 1) > MAX_TABLE_CELLS)
		{
			throw Errors.invalidArgument("inputs differ in too many lines to align (" + rows + " x " + cols + ")");
		}
		
		// lcs[i][j] = length of the LCS of a[prefix+i..] and b[prefix+j..] within the middle section
		int[][] lcs = new int[rows + 1][cols + 1];
		for(int i = rows - 1; i >= 0; i--)
		{
			for(int j = cols - 1; j >= 0; j--)
			{
				if(a.get(prefix + i).equals(b.get(prefix + j)) == true) { lcs[i][j] = lcs[i + 1][j + 1] + 1; }
				else { lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]); }
			}
		}
		
		StringBuilder ops = new StringBuilder(n + m);
		for(int k = 0; k < prefix; k++) { ops.append(EQUAL); }
		int i = 0, j = 0;
		while(i < rows && j < cols)
		{
			if(a.get(prefix + i).equals(b.get(prefix + j)) == true) { ops.append(EQUAL); i++; j++; }
			else if(lcs[i + 1][j] >= lcs[i][j + 1]) { ops.append(DELETE); i++; }
			else { ops.append(INSERT); j++; }
		}
		while(i < rows) { ops.append(DELETE); i++; }
		while(j < cols) { ops.append(INSERT); j++; }
		for(int k = 0; k < suffix; k++) { ops.append(EQUAL); }
		return ops.toString().toCharArray();
	}
	
	private static List<Hunk> hunks(char[] ops, List<String> left, List<String> right, int context)
	{
		int total = ops.length;
		int[] leftPos = new int[total + 1];
		int[] rightPos = new int[total + 1];
		for(int k = 0; k < total; k++)
		{
			leftPos[k + 1] = leftPos[k] + (ops[k] != INSERT ? 1 : 0);
			rightPos[k + 1] = rightPos[k] + (ops[k] != DELETE ? 1 : 0);
		}
		
		List<Hunk> ret = new ArrayList<Hunk>();
		int k = 0;
		while(k < total)
		{
			if(ops[k] == EQUAL) { k++; continue; }
			
			int start = Math.max(0, k - context);
			int end = k;
			int j = k;
			while(j < total)
			{
				if(ops[j] != EQUAL) { end = ++j; continue; }
				int run = 0;
				while(j + run < total && ops[j + run] == EQUAL) { run++; }
				if(j + run >= total || run > 2 * context) { break; }
				j += run;
			}
			int stop = Math.min(total, end + context);
			
			List<String> lines = new ArrayList<String>();
			for(int x = start; x < stop; x++)
			{
				if(ops[x] == INSERT) { lines.add(INSERT + right.get(rightPos[x])); }
				else { lines.add(ops[x] + left.get(leftPos[x])); }
			}
			int lc = leftPos[stop] - leftPos[start];
			int rc = rightPos[stop] - rightPos[start];
			ret.add(new Hunk(lc == 0 ? leftPos[start] : leftPos[start] + 1, lc, rc == 0 ? rightPos[start] : rightPos[start] + 1, rc, lines));
			k = stop;
		}
		return ret;
	}
	
	/** Writes the hunks as unified diff text; nothing is written when there are no hunks. */
	public static void render(List<Hunk> hunks, String leftName, String rightName, PrintStream out)
	{
		if(hunks.isEmpty() == true) { return; }
		out.println("--- " + leftName);
		out.println("+++ " + rightName);
		for(Hunk h : hunks)
		{
			out.println(h.header());
			for(String l : h.getLines()) { out.println(l); }
		}
	}
}
