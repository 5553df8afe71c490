package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;
import ustore.cloudcli.utils.StreamUtils;

/**
 * Represents a command bound to one storage backend.
 */
public abstract class AbstractCommand 
{
	protected Log log = Log.getInstance();
	protected SystemParameters sysParams = SystemParameters.getInstance();
	protected StreamUtils streams = StreamUtils.getInstance();
	
	protected final ExternalStorageInterface storage;
	
	public AbstractCommand(ExternalStorageInterface s) { storage = s; }
	
	/** Returns the entry or null when nothing exists at {@code path}. */
	protected Entry statOrNull(VirtualPath path)
	{
		try { return storage.stat(path); }
		catch(StorageException e) 
		{ 
			if(e.getKind() == ErrorKind.NOT_FOUND) { return null; }
			throw e;
		}
	}
	
	/** Stats a path that must be a file. */
	protected Entry requireFile(VirtualPath path)
	{
		Entry e = storage.stat(path);
		if(e.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		return e;
	}
	
	/** Reads a whole object, failing with SizeLimitExceeded above {@code limit} bytes unless forced. */
	protected byte[] readGuarded(VirtualPath path, long limit, boolean force)
	{
		Entry e = requireFile(path);
		if(force == false && e.getSizeOrZero() > limit) { throw Errors.sizeLimit(path, e.getSizeOrZero(), limit); }
		try(InputStream in = storage.openRead(e.getPath(), null))
		{
			byte[] ret = streams.readAtMost(in, force ? Long.MAX_VALUE : limit);
			if(ret == null) { throw Errors.sizeLimit(path, limit + 1, limit); }
			return ret;
		}
		catch(IOException ex) { throw Errors.translate(ex, path, null); }
	}
}
