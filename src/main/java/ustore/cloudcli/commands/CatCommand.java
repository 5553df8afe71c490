package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code cat}: streams a whole object to the output, guarded by a size limit.
 */
public class CatCommand extends AbstractCommand 
{
	public CatCommand(ExternalStorageInterface s) { super(s); }
	
	public long cat(VirtualPath path, long sizeLimit, boolean force, OutputStream out)
	{
		Entry e = requireFile(path);
		if(force == false && e.getSizeOrZero() > sizeLimit) { throw Errors.sizeLimit(path, e.getSizeOrZero(), sizeLimit); }
		
		try(InputStream in = storage.openRead(e.getPath(), null))
		{
			long ret = streams.copy(in, out);
			out.flush();
			return ret;
		}
		catch(IOException ex) { throw Errors.translate(ex, path, null); }
	}
}
