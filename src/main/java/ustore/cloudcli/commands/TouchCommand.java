package ustore.cloudcli.commands;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code touch}: creates an empty object when absent, {@code -t} empties an existing one and
 * {@code -c} never creates.
 */
public class TouchCommand extends AbstractCommand 
{
	public TouchCommand(ExternalStorageInterface s) { super(s); }
	
	/** Returns true when an object was written. */
	public boolean touch(VirtualPath path, boolean truncate, boolean noCreate)
	{
		if(path.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		Entry existing = statOrNull(path);
		if(existing != null && existing.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		
		if(existing == null)
		{
			if(noCreate == true) { return false; }
		}
		else if(truncate == false || existing.getSizeOrZero() == 0) { return false; }
		
		log.append("[TO] writing empty object " + path, Log.TRACE);
		streams.writeAndCommit(storage.openWrite(path), new byte[0]);
		return true;
	}
}
