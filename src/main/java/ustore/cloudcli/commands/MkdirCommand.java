package ustore.cloudcli.commands;

import java.util.List;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

public class MkdirCommand extends AbstractCommand 
{
	public MkdirCommand(ExternalStorageInterface s) { super(s); }
	
	/** Creates each directory; {@code -p} creates missing parents. An existing directory is left as is. */
	public void mkdir(List<VirtualPath> paths, boolean parents)
	{
		for(VirtualPath p : paths) { storage.createDir(p.asDirectory(), parents); }
	}
}
