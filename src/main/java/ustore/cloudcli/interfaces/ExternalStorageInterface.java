package ustore.cloudcli.interfaces;

import java.io.Closeable;
import java.io.InputStream;
import java.util.Iterator;

import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;

/**
 * Defines the external interface of a storage backend, uniform across providers.
 * <p><p>
 * Every failure surfaces as a {@link ustore.cloudcli.utils.StorageException}.
 */
public interface ExternalStorageInterface extends Closeable
{
	public void connect();
	
	public Capabilities getCapabilities();
	
	public Iterator<Entry> list(VirtualPath path, boolean recursive);
	
	public Entry stat(VirtualPath path);
	
	public boolean exists(VirtualPath path);
	
	/** Opens a read stream; {@code range} may be null for the whole object. */
	public InputStream openRead(VirtualPath path, ByteRange range);
	
	public ObjectSink openWrite(VirtualPath path);
	
	/** Opens a native append stream; only valid when {@link Capabilities#hasNativeAppend()} holds. */
	public ObjectSink openAppend(VirtualPath path);
	
	public void delete(VirtualPath path);
	public void createDir(VirtualPath path, boolean recursive);
	public void copy(VirtualPath src, VirtualPath dst);
	public void rename(VirtualPath src, VirtualPath dst);
	
	public String getName();
	
	@Override
	public void close();
}
