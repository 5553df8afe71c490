package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements {@code ls}: a single level or recursive listing, optionally with size and modification time.
 */
public class ListCommand extends AbstractCommand 
{
	public ListCommand(ExternalStorageInterface s) { super(s); }
	
	public Iterator<Entry> list(VirtualPath path, boolean recursive) { return storage.list(path, recursive); }
	
	/** Prints one line per entry and returns the number of entries. */
	public long print(VirtualPath path, boolean recursive, boolean detailed, PrintStream out)
	{
		long count = 0;
		Iterator<Entry> it = list(path, recursive);
		while(it.hasNext() == true)
		{
			Entry e = it.next();
			out.println(detailed ? formatDetailed(e) : e.getPath().toString());
			count++;
		}
		return count;
	}
	
	static String formatDetailed(Entry e)
	{
		String size = (e.getSize() == null) ? "-" : String.valueOf(e.getSize());
		String modified = (e.getModifiedAt() == null) ? "-" : DateTimeFormatter.ISO_INSTANT.format(e.getModifiedAt());
		return String.format("%12s  %-24s  %s", size, modified, e.getPath());
	}
}
