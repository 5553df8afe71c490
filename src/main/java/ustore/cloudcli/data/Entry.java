package ustore.cloudcli.data;

import java.time.Instant;

/**
 * Represents an immutable snapshot of one listed or stat'ed object or directory.
 */
public final class Entry 
{
	private final VirtualPath path;
	private final EntryKind kind;
	private final Long size;
	private final Instant modifiedAt;
	private final String etag;
	private final String contentType;
	
	public Entry(VirtualPath p, EntryKind k, Long sz, Instant modified, String tag, String ctype)
	{
		kind = k;
		path = (k == EntryKind.DIRECTORY) ? p.asDirectory() : p.asFile();
		size = sz; modifiedAt = modified; etag = tag; contentType = ctype;
	}
	
	public static Entry file(VirtualPath p, long size, Instant modified) { return new Entry(p, EntryKind.FILE, size, modified, null, null); }
	
	public static Entry directory(VirtualPath p) { return new Entry(p, EntryKind.DIRECTORY, null, null, null, null); }
	
	public static Entry directory(VirtualPath p, Instant modified) { return new Entry(p, EntryKind.DIRECTORY, null, modified, null, null); }
	
	public VirtualPath getPath() { return path; }
	
	public EntryKind getKind() { return kind; }
	
	public boolean isFile() { return kind == EntryKind.FILE; }
	
	public boolean isDirectory() { return kind == EntryKind.DIRECTORY; }
	
	/** Size in bytes, or null when the backend reports none (directories, special files). */
	public Long getSize() { return size; }
	
	public long getSizeOrZero() { return (size == null) ? 0L : size.longValue(); }
	
	public Instant getModifiedAt() { return modifiedAt; }
	
	public String getEtag() { return etag; }
	
	public String getContentType() { return contentType; }
	
	@Override
	public String toString() { return kind + " " + path + (size != null ? " (" + size + " bytes)" : ""); }
}
