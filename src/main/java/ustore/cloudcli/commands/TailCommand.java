package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code tail}.
 * <p><p>
 * Line mode streams forward and keeps only the last N lines in a ring buffer, so memory is bounded by N lines
 * and no random access is needed. Byte mode issues a ranged read of the last N bytes when the backend
 * supports it, otherwise it streams and keeps the last N bytes.
 */
public class TailCommand extends AbstractCommand 
{
	public TailCommand(ExternalStorageInterface s) { super(s); }
	
	/** Returns the last {@code n} lines in original order, each with its terminator. */
	public List<byte[]> lastLines(VirtualPath path, int n)
	{
		if(n < 0) { throw Errors.invalidArgument("line count must not be negative: " + n); }
		Entry e = requireFile(path);
		ArrayDeque<byte[]> ring = new ArrayDeque<byte[]>(Math.max(1, Math.min(n, 1024)));
		if(n == 0) { return new ArrayList<byte[]>(); }
		
		try(InputStream in = storage.openRead(e.getPath(), null))
		{
			LineReader reader = new LineReader(in, sysParams.chunkSize);
			byte[] line;
			while((line = reader.next()) != null)
			{
				if(ring.size() == n) { ring.pollFirst(); }
				ring.addLast(line);
			}
		}
		catch(IOException ex) { throw Errors.translate(ex, path, null); }
		return new ArrayList<byte[]>(ring);
	}
	
	/** Returns the last {@code n} bytes of an object. */
	public byte[] lastBytes(VirtualPath path, long n)
	{
		if(n < 0) { throw Errors.invalidArgument("byte count must not be negative: " + n); }
		Entry e = requireFile(path);
		long size = e.getSizeOrZero();
		try
		{
			if(storage.getCapabilities().hasRangedRead() == true)
			{
				long offset = Math.max(0, size - n);
				try(InputStream in = storage.openRead(e.getPath(), ByteRange.of(offset, size - offset)))
				{
					return streams.readAll(in);
				}
			}
			
			int cap = (int)Math.min(n, Integer.MAX_VALUE - 8);
			byte[] ring = new byte[cap];
			long total = 0;
			try(InputStream in = storage.openRead(e.getPath(), null))
			{
				byte[] buf = new byte[sysParams.chunkSize];
				int r;
				while((r = in.read(buf)) > 0)
				{
					for(int i = 0; i < r && cap > 0; i++) { ring[(int)((total + i) % cap)] = buf[i]; }
					total += r;
				}
			}
			int len = (int)Math.min(total, cap);
			byte[] ret = new byte[len];
			long start = total - len;
			for(int i = 0; i < len; i++) { ret[i] = ring[(int)((start + i) % cap)]; }
			return ret;
		}
		catch(IOException ex) { throw Errors.translate(ex, path, null); }
	}
	
	public void tail(VirtualPath path, int lines, long bytes, OutputStream out)
	{
		try
		{
			if(bytes >= 0) { out.write(lastBytes(path, bytes)); }
			else { for(byte[] l : lastLines(path, lines)) { out.write(l); } }
		}
		catch(IOException ex) { throw Errors.provider(path, "cannot write output: " + ex.getMessage(), ex); }
	}
	
	/** Prints several objects with {@code ==> path <==} headers; returns the number of objects that failed. */
	public int tailAll(List<VirtualPath> paths, final int lines, final long bytes, boolean quiet, boolean verbose, final PrintStream out, PrintStream err)
	{
		return HeadCommand.printAll(paths, quiet, verbose, out, err, new HeadCommand.Printer()
		{
			public void print(VirtualPath p) { tail(p, lines, bytes, out); }
		});
	}
}
