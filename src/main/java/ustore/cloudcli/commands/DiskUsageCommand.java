package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements {@code du}: cumulative sizes per directory over one streamed recursive listing.
 * <p><p>
 * A listing emits a directory before its content and keeps that content contiguous, so a stack of the open
 * directories is enough: a directory's total is final once an entry outside it arrives.
 */
public class DiskUsageCommand extends AbstractCommand 
{
	/** Represents the totals below one path. */
	public static class Usage
	{
		protected final VirtualPath path;
		protected long bytes = 0;
		protected long files = 0;
		
		public Usage(VirtualPath p) { path = p; }
		
		public VirtualPath getPath() { return path; }
		public long getBytes() { return bytes; }
		public long getFiles() { return files; }
	}
	
	/** Receives each directory total as soon as it is final. */
	public interface UsageListener { public void onUsage(Usage u); }
	
	public DiskUsageCommand(ExternalStorageInterface s) { super(s); }
	
	/** Computes totals for {@code path}; every directory below it is reported to {@code listener} unless null. */
	public Usage usage(VirtualPath path, UsageListener listener)
	{
		Entry top = storage.stat(path);
		Usage root = new Usage(top.getPath());
		if(top.isDirectory() == false)
		{
			root.bytes = top.getSizeOrZero(); root.files = top.isFile() ? 1 : 0;
			return root;
		}
		
		Deque<Usage> open = new ArrayDeque<Usage>();
		open.push(root);
		Iterator<Entry> it = storage.list(top.getPath(), true);
		while(it.hasNext() == true)
		{
			Entry e = it.next();
			while(open.size() > 1 && open.peek().getPath().isAncestorOf(e.getPath()) == false) { close(open, listener); }
			
			if(e.isDirectory() == true) { open.push(new Usage(e.getPath())); }
			else if(e.isFile() == true)
			{
				open.peek().bytes += e.getSizeOrZero();
				open.peek().files++;
			}
		}
		while(open.size() > 1) { close(open, listener); }
		return root;
	}
	
	private void close(Deque<Usage> open, UsageListener listener)
	{
		Usage done = open.pop();
		open.peek().bytes += done.bytes;
		open.peek().files += done.files;
		if(listener != null) { listener.onUsage(done); }
	}
	
	/** Prints {@code size path} rows, the summary row last; {@code -s} prints the summary and the file count only. */
	public Usage print(VirtualPath path, boolean summarize, boolean human, final PrintStream out)
	{
		final boolean h = human;
		Usage total = usage(path, summarize ? null : new UsageListener()
		{
			@Override
			public void onUsage(Usage u) { out.println(format(u.getBytes(), h) + "\t" + u.getPath()); }
		});
		out.println(format(total.getBytes(), human) + "\t" + total.getPath());
		if(summarize == true) { out.println("Total files: " + total.getFiles()); }
		return total;
	}
	
	static String format(long bytes, boolean human) { return human ? SizeFormat.human(bytes) : String.valueOf(bytes); }
}
