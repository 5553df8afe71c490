package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;

import com.google.common.io.ByteStreams;

import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements {@code head}: the first N lines (default) or the first N bytes of one or more objects.
 */
public class HeadCommand extends AbstractCommand 
{
	public HeadCommand(ExternalStorageInterface s) { super(s); }
	
	/** Writes the start of one object; exactly one of {@code lines} and {@code bytes} is used, bytes when non-negative. */
	public void head(VirtualPath path, long lines, long bytes, OutputStream out)
	{
		Entry e = requireFile(path);
		try
		{
			if(bytes >= 0)
			{
				ByteRange range = storage.getCapabilities().hasRangedRead() ? ByteRange.of(0, bytes) : null;
				try(InputStream in = storage.openRead(e.getPath(), range))
				{
					streams.copy(ByteStreams.limit(in, bytes), out);
				}
				return;
			}
			
			try(InputStream in = storage.openRead(e.getPath(), null))
			{
				LineReader reader = new LineReader(in, sysParams.chunkSize);
				byte[] line;
				for(long n = 0; n < lines && (line = reader.next()) != null; n++) { out.write(line); }
			}
		}
		catch(IOException ex) { throw Errors.translate(ex, path, null); }
	}
	
	/** Prints several objects with {@code ==> path <==} headers; returns the number of objects that failed. */
	public int headAll(List<VirtualPath> paths, final long lines, final long bytes, boolean quiet, boolean verbose, final PrintStream out, PrintStream err)
	{
		return printAll(paths, quiet, verbose, out, err, new Printer()
		{
			public void print(VirtualPath p) { head(p, lines, bytes, out); }
		});
	}
	
	/** Prints one object. */
	interface Printer { void print(VirtualPath p); }
	
	static int printAll(List<VirtualPath> paths, boolean quiet, boolean verbose, PrintStream out, PrintStream err, Printer printer)
	{
		if(quiet == true && verbose == true) { throw Errors.invalidArgument("-q and -v are mutually exclusive"); }
		boolean headers = verbose || (paths.size() > 1 && quiet == false);
		int failures = 0;
		boolean first = true;
		for(VirtualPath p : paths)
		{
			if(headers == true)
			{
				if(first == false) { out.println(); }
				out.println("==> " + p + " <==");
			}
			first = false;
			try { printer.print(p); }
			catch(StorageException e)
			{
				failures++;
				err.println("error: " + e.describe());
			}
			out.flush();
		}
		return failures;
	}
}
