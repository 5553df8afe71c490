package ustore.cloudcli.implementation;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.ObjectKeyIterator.ObjectRecord;
import ustore.cloudcli.interfaces.InternalStorageInterface;

/**
 * Implements an object-store style backend held in a sorted map in memory.
 * <p><p>
 * Directories are zero-length marker keys ending in {@code /} or are implied by the keys below them,
 * exactly like the S3-compatible connector. Faults can be injected per key to simulate a broken backend.
 */
public class InMemoryStorage implements InternalStorageInterface
{
	private Log log = Log.getInstance();
	
	private final NavigableMap<String, byte[]> map = new TreeMap<String, byte[]>();
	private final Map<String, Instant> modified = new HashMap<String, Instant>();
	private final Map<String, Long> writeFaults = new HashMap<String, Long>();
	
	private boolean nativeAppend = false;
	
	public InMemoryStorage() {}
	
	public InMemoryStorage(boolean supportsAppend) { nativeAppend = supportsAppend; }
	
	/** Makes every write to {@code key} fail once {@code afterBytes} bytes have been written. */
	public synchronized void injectWriteFault(String key, long afterBytes) { writeFaults.put(key, afterBytes); }
	
	public synchronized void clearFaults() { writeFaults.clear(); }
	
	/** Returns the committed bytes of a key, or null; used to inspect state. */
	public synchronized byte[] peek(String key) 
	{ 
		byte[] d = map.get(key);
		return (d == null) ? null : d.clone();
	}
	
	public synchronized void put(String key, byte[] data)
	{
		map.put(key, data.clone());
		modified.put(key, Instant.now());
	}
	
	public synchronized int size() { return map.size(); }
	
	@Override
	public void connect() { log.append("[IM] connected to in-memory storage", Log.TRACE); }
	
	@Override
	public Capabilities getCapabilities() { return new Capabilities(true, nativeAppend, false, false, true); }
	
	@Override
	public synchronized Entry stat(VirtualPath path) 
	{
		if(path.isRoot() == true) { return Entry.directory(path); }
		
		if(path.isDirectory() == false)
		{
			byte[] d = map.get(path.getKey());
			if(d != null) { return new Entry(path, EntryKind.FILE, (long)d.length, modified.get(path.getKey()), etag(d), null); }
		}
		String dirKey = path.getKey() + "/";
		if(map.containsKey(dirKey) == true) { return Entry.directory(path, modified.get(dirKey)); }
		SortedMap<String, byte[]> below = map.tailMap(dirKey, true);
		if(below.isEmpty() == false && below.firstKey().startsWith(dirKey) == true) { return Entry.directory(path); }
		return null;
	}
	
	@Override
	public synchronized Iterator<Entry> list(VirtualPath dir, boolean recursive) 
	{
		String prefix = dir.asDirectory().getObjectKey();
		List<ObjectRecord> snapshot = new ArrayList<ObjectRecord>();
		for(Map.Entry<String, byte[]> e : map.tailMap(prefix, true).entrySet())
		{
			if(e.getKey().startsWith(prefix) == false) { break; }
			snapshot.add(new ObjectRecord(e.getKey(), e.getValue().length, modified.get(e.getKey()), etag(e.getValue())));
		}
		return new ObjectKeyIterator(snapshot.iterator(), dir, recursive);
	}
	
	@Override
	public synchronized InputStream openRead(VirtualPath path, ByteRange range) throws IOException
	{
		byte[] d = map.get(path.getKey());
		if(d == null || path.isDirectory() == true) { throw new FileNotFoundException(path.toString()); }
		
		if(range != null)
		{
			int from = (int)Math.min(range.getOffset(), d.length);
			int to = range.isOpenEnded() ? d.length : (int)Math.min(d.length, range.getOffset() + range.getLength());
			d = Arrays.copyOfRange(d, from, to);
		}
		return new ByteArrayInputStream(d);
	}
	
	@Override
	public ObjectSink openWrite(VirtualPath path) throws IOException { return new MemorySink(path.getObjectKey(), null); }
	
	@Override
	public synchronized ObjectSink openAppend(VirtualPath path) throws IOException
	{
		if(nativeAppend == false) { throw new UnsupportedOperationException("append is not supported"); }
		byte[] existing = map.get(path.getKey());
		return new MemorySink(path.getKey(), existing);
	}
	
	@Override
	public synchronized void delete(VirtualPath path) throws IOException
	{
		if(path.isDirectory() == true) { map.remove(path.getObjectKey()); return; }
		if(map.remove(path.getKey()) == null) { throw new FileNotFoundException(path.toString()); }
	}
	
	@Override
	public synchronized void createDirectory(VirtualPath path, boolean recursive) 
	{
		if(path.isRoot() == true) { return; }
		put(path.asDirectory().getObjectKey(), new byte[0]);
	}
	
	@Override
	public synchronized void copy(VirtualPath src, VirtualPath dst) throws IOException
	{
		byte[] d = map.get(src.getKey());
		if(d == null) { throw new FileNotFoundException(src.toString()); }
		put(dst.getKey(), d);
	}
	
	@Override
	public void rename(VirtualPath src, VirtualPath dst) 
	{
		throw new UnsupportedOperationException("rename is not supported");
	}
	
	@Override
	public void disconnect() {}
	
	@Override
	public String getName() { return "memory"; }
	
	private static String etag(byte[] d) { return Integer.toHexString(Arrays.hashCode(d)); }
	
	private synchronized Long faultFor(String key) { return writeFaults.get(key); }
	
	private class MemorySink extends ObjectSink
	{
		private final String key;
		private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		private final Long failAfter;
		private boolean finished = false;
		
		MemorySink(String k, byte[] existing) throws IOException
		{
			key = k; failAfter = faultFor(k);
			if(existing != null) { buffer.write(existing); }
		}
		
		@Override
		public void write(byte[] b, int off, int len) throws IOException
		{
			if(finished == true) { throw new IOException("sink closed: " + key); }
			if(failAfter != null && buffer.size() + len > failAfter.longValue())
			{
				throw new IOException("injected write fault on " + key);
			}
			buffer.write(b, off, len);
		}
		
		@Override
		public void close() throws IOException
		{
			if(finished == true) { return; }
			if(failAfter != null && failAfter.longValue() <= buffer.size()) { throw new IOException("injected write fault on " + key); }
			finished = true;
			put(key, buffer.toByteArray());
		}
		
		@Override
		public void abort() { finished = true; }
	}
}
