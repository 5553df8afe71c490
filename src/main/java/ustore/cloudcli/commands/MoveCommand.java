package ustore.cloudcli.commands;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements {@code mv}. Backends without a native rename get copy then delete from the storage adapter.
 */
public class MoveCommand extends AbstractCommand 
{
	public MoveCommand(ExternalStorageInterface s) { super(s); }
	
	/** Moves {@code src} and returns its new path; an existing directory {@code dst} receives it by name. */
	public VirtualPath move(VirtualPath src, VirtualPath dst)
	{
		Entry source = storage.stat(src);
		VirtualPath target = dst;
		Entry d = dst.isRoot() ? Entry.directory(dst) : statOrNull(dst.asFile());
		if(d != null && d.isDirectory() == true) { target = d.getPath().resolve(source.getPath().getName()); }
		
		log.append("[MV] " + source.getPath() + " -> " + target, Log.TRACE);
		storage.rename(source.getPath(), target);
		return source.isDirectory() ? target.asDirectory() : target.asFile();
	}
}
