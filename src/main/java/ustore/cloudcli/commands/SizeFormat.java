package ustore.cloudcli.commands;

import java.util.Locale;

import ustore.cloudcli.utils.Errors;

/**
 * Implements human readable byte sizes ({@code 512B}, {@code 1.5K}, {@code 3.0M}) and size-limit parsing.
 */
public class SizeFormat 
{
	private static final String[] UNITS = { "B", "K", "M", "G", "T" };
	
	private SizeFormat() {}
	
	public static String human(long bytes)
	{
		if(bytes < 1024) { return bytes + "B"; }
		double v = bytes;
		int unit = 0;
		while(v >= 1024 && unit < UNITS.length - 1) { v /= 1024; unit++; }
		return String.format(Locale.ROOT, "%.1f%s", v, UNITS[unit]);
	}
	
	/** Converts a megabyte limit from the command line to bytes. */
	public static long megabytes(double mb)
	{
		if(mb <= 0 || Double.isNaN(mb) == true || Double.isInfinite(mb) == true) 
		{ 
			throw Errors.invalidArgument("size limit must be a positive number of megabytes, got " + mb); 
		}
		return (long)(mb * 1024 * 1024);
	}
}
