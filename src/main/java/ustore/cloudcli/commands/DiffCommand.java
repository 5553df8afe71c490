package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code diff}: both objects are loaded under a size guard and compared line by line.
 */
public class DiffCommand extends AbstractCommand 
{
	public DiffCommand(ExternalStorageInterface s) { super(s); }
	
	public List<LineDiff.Hunk> diff(VirtualPath left, VirtualPath right, int context, boolean ignoreSpace, long sizeLimit, boolean force)
	{
		if(context < 0) { throw Errors.invalidArgument("context must not be negative: " + context); }
		List<String> a = lines(readGuarded(left, sizeLimit, force));
		List<String> b = lines(readGuarded(right, sizeLimit, force));
		return LineDiff.diff(a, b, ignoreSpace, context);
	}
	
	/** Prints the unified diff and returns the number of hunks. */
	public int print(VirtualPath left, VirtualPath right, int context, boolean ignoreSpace, long sizeLimit, boolean force, PrintStream out)
	{
		List<LineDiff.Hunk> hunks = diff(left, right, context, ignoreSpace, sizeLimit, force);
		LineDiff.render(hunks, left.toString(), right.toString(), out);
		return hunks.size();
	}
	
	/** Splits text on {@code \n}, dropping a trailing {@code \r} per line; a final terminator adds no empty line. */
	static List<String> lines(byte[] data)
	{
		String text = new String(data, StandardCharsets.UTF_8);
		List<String> ret = new ArrayList<String>();
		int start = 0;
		for(int i = 0; i < text.length(); i++)
		{
			if(text.charAt(i) == '\n')
			{
				int end = (i > start && text.charAt(i - 1) == '\r') ? i - 1 : i;
				ret.add(text.substring(start, end));
				start = i + 1;
			}
		}
		if(start < text.length()) { ret.add(text.substring(start)); }
		return ret;
	}
}
