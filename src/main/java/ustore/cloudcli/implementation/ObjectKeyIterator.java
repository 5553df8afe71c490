package ustore.cloudcli.implementation;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import com.google.common.collect.AbstractIterator;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.VirtualPath;

/**
 * Implements directory synthesis over a flat, lexicographically sorted key stream of an object store.
 * <p><p>
 * Keys sharing a prefix are contiguous in sorted order, so the chain of directories opened so far is the
 * only state kept: memory is bounded by path depth, never by the number of keys.
 */
public class ObjectKeyIterator extends AbstractIterator<Entry>
{
	/** Represents one raw object as reported by a store listing. */
	public static class ObjectRecord
	{
		protected final String key;
		protected final long size;
		protected final Instant modified;
		protected final String etag;
		
		public ObjectRecord(String k, long sz, Instant m, String tag) { key = k; size = sz; modified = m; etag = tag; }
		
		public String getKey() { return key; }
	}
	
	protected final Iterator<ObjectRecord> source;
	protected final VirtualPath base;
	protected final String prefix;
	protected final boolean recursive;
	
	protected final Deque<String> openDirs = new ArrayDeque<String>();
	protected final Deque<Entry> pending = new ArrayDeque<Entry>();
	protected String lastChild = null;
	
	public ObjectKeyIterator(Iterator<ObjectRecord> src, VirtualPath dir, boolean rec)
	{
		source = src; base = dir.asDirectory(); prefix = base.getObjectKey(); recursive = rec;
	}
	
	@Override
	protected Entry computeNext() 
	{
		while(pending.isEmpty() == true)
		{
			if(source.hasNext() == false) { return endOfData(); }
			
			ObjectRecord r = source.next();
			if(r.key.startsWith(prefix) == false) { continue; }
			String rel = r.key.substring(prefix.length());
			if(rel.isEmpty() == true) { continue; } // the directory's own marker
			
			if(recursive == true) { expandRecursive(r, rel); }
			else { expandShallow(r, rel); }
		}
		return pending.poll();
	}
	
	private void expandShallow(ObjectRecord r, String rel)
	{
		int slash = rel.indexOf('/');
		if(slash < 0)
		{
			pending.add(new Entry(VirtualPath.of(r.key), EntryKind.FILE, r.size, r.modified, r.etag, null));
			return;
		}
		String child = rel.substring(0, slash);
		if(child.equals(lastChild) == true) { return; }
		lastChild = child;
		pending.add(Entry.directory(VirtualPath.directory(prefix + child)));
	}
	
	private void expandRecursive(ObjectRecord r, String rel)
	{
		boolean marker = rel.endsWith("/");
		String[] segments = rel.split("/");
		int dirCount = marker ? segments.length : segments.length - 1;
		
		// close directories that are not ancestors of this key
		StringBuilder chain = new StringBuilder();
		Deque<String> wanted = new ArrayDeque<String>();
		for(int i = 0; i < dirCount; i++)
		{
			chain.append(segments[i]).append('/');
			wanted.addLast(chain.toString());
		}
		while(openDirs.isEmpty() == false && wanted.contains(openDirs.peekLast()) == false) { openDirs.removeLast(); }
		
		for(String d : wanted)
		{
			if(openDirs.contains(d) == true) { continue; }
			openDirs.addLast(d);
			pending.add(new Entry(VirtualPath.directory(prefix + d), EntryKind.DIRECTORY, null, marker && d.equals(rel) ? r.modified : null, null, null));
		}
		
		if(marker == false)
		{
			pending.add(new Entry(VirtualPath.of(r.key), EntryKind.FILE, r.size, r.modified, r.etag, null));
		}
	}
}
