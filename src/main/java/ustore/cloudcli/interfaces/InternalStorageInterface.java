package ustore.cloudcli.interfaces;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;

/**
 * Defines the internal interface of a storage backend.
 * <p><p>
 * Connectors may raise their native faults; the {@link ExternalStorageInterface} implementation translates them.
 * Paths are already normalized when they reach a connector.
 */
public interface InternalStorageInterface 
{
	public void connect() throws IOException;
	
	public Capabilities getCapabilities();
	
	/** Returns the entry at {@code path} (file or directory form), or null when nothing exists there. */
	public Entry stat(VirtualPath path) throws IOException;
	
	/** Lists the content of a directory, depth-first when recursive, directories before their content. */
	public Iterator<Entry> list(VirtualPath dir, boolean recursive) throws IOException;
	
	public InputStream openRead(VirtualPath path, ByteRange range) throws IOException;
	public ObjectSink openWrite(VirtualPath path) throws IOException;
	public ObjectSink openAppend(VirtualPath path) throws IOException;
	
	public void delete(VirtualPath path) throws IOException;
	public void createDirectory(VirtualPath path, boolean recursive) throws IOException;
	public void copy(VirtualPath src, VirtualPath dst) throws IOException;
	public void rename(VirtualPath src, VirtualPath dst) throws IOException;
	
	public void disconnect();
	
	public String getName();
}
