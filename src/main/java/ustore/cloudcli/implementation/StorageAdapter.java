package ustore.cloudcli.implementation;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.amazonaws.AmazonClientException;
import com.azure.storage.blob.models.BlobStorageException;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.interfaces.InternalStorageInterface;
import ustore.cloudcli.utils.AmazonS3Utils;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements an adapter between the external storage interface and a connector's implementation.
 * <p><p>
 * The adapter is the only place where connector faults are translated into {@link StorageException}s,
 * where the storage root is protected, and where operations a backend lacks (rename on object stores) are emulated,
 * so that the commands never special-case a provider.
 */
public class StorageAdapter implements ExternalStorageInterface
{
	private Log log = Log.getInstance();
	
	protected final InternalStorageInterface storage;
	protected final Collection<String> secrets;
	protected Capabilities capabilities = null;
	protected boolean opened = false;
	
	public StorageAdapter(InternalStorageInterface s) { this(s, Collections.<String>emptyList()); }
	
	public StorageAdapter(InternalStorageInterface s, Collection<String> secretValues)
	{
		storage = s; secrets = new ArrayList<String>(secretValues);
		capabilities = s.getCapabilities();
	}
	
	protected StorageException translate(Throwable t, Object subject)
	{
		if(t instanceof StorageException) { return (StorageException)t; }
		if(t instanceof AmazonClientException) { return AmazonS3Utils.getInstance().translate((AmazonClientException)t, subject, secrets); }
		if(t instanceof BlobStorageException)
		{
			BlobStorageException bse = (BlobStorageException)t;
			return Errors.fromHttpStatus(bse.getStatusCode(), subject, String.valueOf(bse.getErrorCode()));
		}
		if(t instanceof UnsupportedOperationException) { return Errors.invalidArgument(subject, Errors.scrub(t.getMessage(), secrets)); }
		if(t instanceof UncheckedIOException) { return Errors.translate(((UncheckedIOException)t).getCause(), subject, secrets); }
		if(t instanceof IOException) { return Errors.translate((IOException)t, subject, secrets); }
		if(t instanceof RuntimeException) { return Errors.translate((RuntimeException)t, subject, secrets); }
		return Errors.provider(subject, "unexpected failure on " + subject + ": " + t.getClass().getSimpleName(), null);
	}
	
	@Override
	public void connect() 
	{
		try { storage.connect(); }
		catch(Exception e) { throw translate(e, storage.getName()); }
		opened = true;
		log.append("[SA] connected to " + storage.getName(), Log.INFO);
	}
	
	@Override
	public Capabilities getCapabilities() { return capabilities; }
	
	@Override
	public String getName() { return storage.getName(); }
	
	protected Entry statOrNull(VirtualPath path)
	{
		try { return storage.stat(path); }
		catch(Exception e) { throw translate(e, path); }
	}

	@Override
	public Entry stat(VirtualPath path) 
	{
		Entry ret = statOrNull(path);
		if(ret == null) { throw Errors.notFound(path); }
		return ret;
	}
	
	@Override
	public boolean exists(VirtualPath path) { return statOrNull(path) != null; }

	@Override
	public Iterator<Entry> list(final VirtualPath path, boolean recursive) 
	{
		Entry e = stat(path);
		if(e.isDirectory() == false) { return Iterators.singletonIterator(e); }
		
		log.append("[SA] list " + path + (recursive ? " (recursive)" : ""), Log.TRACE);
		final Iterator<Entry> inner;
		try { inner = storage.list(e.getPath(), recursive); }
		catch(Exception ex) { throw translate(ex, path); }
		
		return new AbstractIterator<Entry>()
		{
			@Override
			protected Entry computeNext() 
			{
				try { return inner.hasNext() ? inner.next() : endOfData(); }
				catch(RuntimeException ex) { throw translate(ex, path); }
			}
		};
	}

	@Override
	public InputStream openRead(final VirtualPath path, ByteRange range) 
	{
		if(path.isDirectory() == true) { throw Errors.invalidArgument(path, "is a directory"); }
		log.append("[SA] read " + path + (range == null ? "" : " " + range), Log.TRACE);
		
		final InputStream in;
		try { in = storage.openRead(path, range); }
		catch(Exception e) { throw translate(e, path); }
		
		return new FilterInputStream(in)
		{
			@Override
			public int read() 
			{
				try { return super.read(); }
				catch(IOException | RuntimeException e) { throw translate(e, path); }
			}
			
			@Override
			public int read(byte[] b, int off, int len) 
			{
				try { return super.read(b, off, len); }
				catch(IOException | RuntimeException e) { throw translate(e, path); }
			}
			
			@Override
			public void close() 
			{
				try { super.close(); }
				catch(IOException | RuntimeException e) { throw translate(e, path); }
			}
		};
	}

	@Override
	public ObjectSink openWrite(VirtualPath path) 
	{
		if(path.isRoot() == true || path.isDirectory() == true) { throw Errors.invalidArgument(path, "cannot write to a directory"); }
		log.append("[SA] write " + path, Log.TRACE);
		try { return guard(storage.openWrite(path), path); }
		catch(Exception e) { throw translate(e, path); }
	}
	
	@Override
	public ObjectSink openAppend(VirtualPath path) 
	{
		if(capabilities.hasNativeAppend() == false) { throw Errors.invalidArgument(path, "backend has no native append"); }
		if(path.isRoot() == true || path.isDirectory() == true) { throw Errors.invalidArgument(path, "cannot append to a directory"); }
		log.append("[SA] append " + path, Log.TRACE);
		try { return guard(storage.openAppend(path), path); }
		catch(Exception e) { throw translate(e, path); }
	}
	
	/** Wraps a connector sink so that its faults surface as translated failures. */
	protected ObjectSink guard(final ObjectSink inner, final VirtualPath path)
	{
		return new ObjectSink()
		{
			@Override
			public void write(byte[] b, int off, int len) 
			{
				try { inner.write(b, off, len); }
				catch(IOException | RuntimeException e) { throw translate(e, path); }
			}
			
			@Override
			public void close() 
			{
				try { inner.close(); }
				catch(IOException | RuntimeException e) { throw translate(e, path); }
			}
			
			@Override
			public void abort() { inner.abort(); }
		};
	}

	@Override
	public void delete(VirtualPath path) 
	{
		if(path.isRoot() == true) { throw Errors.invalidArgument(path, "refusing to delete the storage root"); }
		log.append("[SA] delete " + path, Log.TRACE);
		try { storage.delete(path); }
		catch(Exception e) { throw translate(e, path); }
	}

	@Override
	public void createDir(VirtualPath path, boolean recursive) 
	{
		if(path.isRoot() == true) { return; }
		Entry existing = statOrNull(path.asFile());
		if(existing != null)
		{
			if(existing.isDirectory() == true) { return; }
			throw Errors.alreadyExists(path.asFile());
		}
		if(recursive == false && exists(path.getParent()) == false) { throw Errors.notFound(path.getParent()); }
		
		log.append("[SA] mkdir " + path, Log.TRACE);
		try { storage.createDirectory(path.asDirectory(), recursive); }
		catch(Exception e) { throw translate(e, path); }
	}

	@Override
	public void copy(VirtualPath src, VirtualPath dst) 
	{
		if(dst.isRoot() == true) { throw Errors.invalidArgument(dst, "refusing to replace the storage root"); }
		Entry e = stat(src);
		if(e.isDirectory() == true) { throw Errors.invalidArgument(src, "is a directory"); }
		
		log.append("[SA] copy " + src + " -> " + dst, Log.TRACE);
		try { storage.copy(e.getPath(), dst.asFile()); }
		catch(Exception ex) { throw translate(ex, src); }
	}

	@Override
	public void rename(VirtualPath src, VirtualPath dst) 
	{
		if(src.isRoot() == true || dst.isRoot() == true) { throw Errors.invalidArgument(src.isRoot() ? src : dst, "refusing to move the storage root"); }
		Entry e = stat(src);
		VirtualPath from = e.getPath();
		VirtualPath to = e.isDirectory() ? dst.asDirectory() : dst.asFile();
		if(from.equals(to) == true) { return; }
		if(from.isAncestorOf(to) == true) { throw Errors.invalidArgument(dst, "cannot move a directory into itself"); }
		
		log.append("[SA] rename " + from + " -> " + to, Log.TRACE);
		if(capabilities.hasNativeRename() == true)
		{
			try { storage.rename(from, to); }
			catch(Exception ex) { throw translate(ex, src); }
			return;
		}
		
		if(e.isDirectory() == false)
		{
			copy(from, to);
			delete(from);
			return;
		}
		
		List<VirtualPath> markers = new ArrayList<VirtualPath>();
		Iterator<Entry> it = list(from, true);
		while(it.hasNext() == true)
		{
			Entry child = it.next();
			VirtualPath target = to.resolve(from.relativize(child.getPath()));
			if(child.isDirectory() == true)
			{
				createDir(target, true);
				markers.add(child.getPath());
			}
			else
			{
				copy(child.getPath(), target);
				delete(child.getPath());
			}
		}
		createDir(to, true);
		Collections.reverse(markers);
		for(VirtualPath m : markers) { delete(m); }
		delete(from);
	}

	@Override
	public void close() 
	{
		if(opened == false) { return; }
		storage.disconnect();
		opened = false;
		log.append("[SA] disconnected from " + storage.getName(), Log.TRACE);
	}
}
