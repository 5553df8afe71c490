package ustore.cloudcli.data;

import java.util.ArrayDeque;
import java.util.Deque;

import ustore.cloudcli.utils.Errors;

/**
 * Represents a normalized path inside one backend's namespace.
 * <p><p>
 * The key never starts or ends with a separator; the directory flag is carried separately and rendered as a trailing {@code /}.
 * The root is the empty key and is always a directory. {@code .} and {@code ..} segments are resolved on construction,
 * and {@code ..} above the root is rejected.
 */
public final class VirtualPath implements Comparable<VirtualPath>
{
	public static final String SEPARATOR = "/";
	
	public static final VirtualPath ROOT = new VirtualPath("", true);
	
	private final String key;
	private final boolean directory;
	
	private VirtualPath(String k, boolean dir) { key = k; directory = dir || k.isEmpty(); }
	
	/** Parses a user or backend supplied path; a trailing separator marks a directory. */
	public static VirtualPath of(String raw)
	{
		if(raw == null) { throw Errors.invalidArgument("path must not be null"); }
		
		Deque<String> segments = new ArrayDeque<String>();
		String[] parts = raw.replace('\\', '/').split("/");
		boolean dir = raw.endsWith("/") || raw.endsWith("\\");
		for(int i = 0; i < parts.length; i++)
		{
			String p = parts[i];
			boolean last = (i == parts.length - 1);
			if(p.isEmpty() == true || p.equals(".") == true) { if(last == true) { dir = true; } continue; }
			if(p.equals("..") == true)
			{
				if(segments.isEmpty() == true) { throw Errors.invalidArgument(raw, "path escapes the storage root"); }
				segments.removeLast();
				if(last == true) { dir = true; }
				continue;
			}
			segments.addLast(p);
		}
		return new VirtualPath(String.join(SEPARATOR, segments), dir);
	}
	
	public static VirtualPath directory(String raw) { return of(raw).asDirectory(); }
	
	public String getKey() { return key; }
	
	/** Returns the object-store key: directories end with the separator, the root is empty. */
	public String getObjectKey() { return (directory == true && key.isEmpty() == false) ? key + SEPARATOR : key; }
	
	public boolean isDirectory() { return directory; }
	
	public boolean isRoot() { return key.isEmpty(); }
	
	public String getName()
	{
		int idx = key.lastIndexOf('/');
		return (idx < 0) ? key : key.substring(idx + 1);
	}
	
	/** Returns the parent directory, or null for the root. */
	public VirtualPath getParent()
	{
		if(isRoot() == true) { return null; }
		int idx = key.lastIndexOf('/');
		return (idx < 0) ? ROOT : new VirtualPath(key.substring(0, idx), true);
	}
	
	public VirtualPath asDirectory() { return (directory == true) ? this : new VirtualPath(key, true); }
	
	public VirtualPath asFile() { return (directory == false || isRoot() == true) ? this : new VirtualPath(key, false); }
	
	/** Resolves a relative child path below this one. */
	public VirtualPath resolve(String relative)
	{
		String prefix = key.isEmpty() ? "" : key + SEPARATOR;
		VirtualPath ret = of(prefix + relative);
		if(isAncestorOf(ret) == false && ret.key.equals(key) == false) 
		{ 
			throw Errors.invalidArgument(relative, "path escapes its parent"); 
		}
		return ret;
	}
	
	/** Returns true when {@code other} lies strictly below this path. */
	public boolean isAncestorOf(VirtualPath other)
	{
		if(other.key.length() <= key.length()) { return false; }
		if(key.isEmpty() == true) { return true; }
		return other.key.startsWith(key) && other.key.charAt(key.length()) == '/';
	}
	
	/** Returns the part of {@code descendant}'s key below this path (no leading separator). */
	public String relativize(VirtualPath descendant)
	{
		if(descendant.key.equals(key) == true) { return ""; }
		Errors.verify(isAncestorOf(descendant), descendant + " is not below " + this);
		return key.isEmpty() ? descendant.key : descendant.key.substring(key.length() + 1);
	}
	
	public int depth()
	{
		if(key.isEmpty() == true) { return 0; }
		int ret = 1;
		for(int i = 0; i < key.length(); i++) { if(key.charAt(i) == '/') { ret++; } }
		return ret;
	}
	
	@Override
	public int compareTo(VirtualPath o) 
	{
		int c = key.compareTo(o.key);
		return (c != 0) ? c : Boolean.compare(directory, o.directory);
	}
	
	@Override
	public boolean equals(Object o)
	{
		if(this == o) { return true; }
		if(o instanceof VirtualPath == false) { return false; }
		VirtualPath other = (VirtualPath)o;
		return key.equals(other.key) && directory == other.directory;
	}
	
	@Override
	public int hashCode() { return key.hashCode() * 31 + (directory ? 1 : 0); }
	
	@Override
	public String toString() { return isRoot() ? SEPARATOR : getObjectKey(); }
}
