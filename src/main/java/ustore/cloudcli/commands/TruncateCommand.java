package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code truncate}: shrinks an object to a size or pads it with zero bytes.
 * <p><p>
 * The new content is streamed into a fresh write, so readers see either the old or the new object.
 */
public class TruncateCommand extends AbstractCommand 
{
	public TruncateCommand(ExternalStorageInterface s) { super(s); }
	
	/** Returns true when an object was written. */
	public boolean truncate(VirtualPath path, long size, boolean noCreate, boolean parents)
	{
		if(size < 0) { throw Errors.invalidArgument("size must not be negative: " + size); }
		if(path.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		
		Entry existing = statOrNull(path);
		if(existing != null && existing.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		if(existing == null && noCreate == true) { return false; }
		if(existing != null && existing.getSizeOrZero() == size) { return false; }
		if(existing == null && parents == true && storage.getCapabilities().hasRealDirectories() == true)
		{
			storage.createDir(path.getParent(), true);
		}
		
		long keep = (existing == null) ? 0 : Math.min(size, existing.getSizeOrZero());
		log.append("[TR] truncating " + path + " to " + size + " bytes", Log.TRACE);
		ObjectSink sink = storage.openWrite(path);
		boolean committed = false;
		try
		{
			if(keep > 0)
			{
				ByteRange range = storage.getCapabilities().hasRangedRead() ? ByteRange.of(0, keep) : null;
				try(InputStream in = storage.openRead(path, range)) { copyExactly(in, sink, keep); }
			}
			byte[] zeros = new byte[sysParams.chunkSize];
			for(long left = size - keep; left > 0; )
			{
				int n = (int)Math.min(left, zeros.length);
				sink.write(zeros, 0, n);
				left -= n;
			}
			sink.close();
			committed = true;
		}
		catch(IOException e) { throw Errors.translate(e, path, null); }
		finally { if(committed == false) { sink.abort(); } }
		return true;
	}
	
	private void copyExactly(InputStream in, ObjectSink sink, long n) throws IOException
	{
		byte[] buf = new byte[sysParams.chunkSize];
		long left = n;
		while(left > 0)
		{
			int r = in.read(buf, 0, (int)Math.min(buf.length, left));
			if(r < 0) { throw new IOException("object shrank while truncating"); }
			sink.write(buf, 0, r);
			left -= r;
		}
	}
}
