package ustore.cloudcli.utils;

import java.nio.file.Path;

import ustore.cloudcli.data.VirtualPath;

/**
 * Implements conversions between local paths and virtual paths.
 */
public class PathUtils 
{
	private PathUtils() {}
	
	/** Returns {@code descendant} relative to {@code base} with forward slashes. */
	public static String relativeKey(Path base, Path descendant)
	{
		return base.relativize(descendant).toString().replace('\\', '/');
	}
	
	/** Resolves a virtual relative key below a local directory. */
	public static Path toLocal(Path base, String relativeKey)
	{
		Path ret = base;
		for(String seg : relativeKey.split("/"))
		{
			if(seg.isEmpty() == true) { continue; }
			ret = ret.resolve(seg);
		}
		return ret;
	}
	
	/** Returns the last segment of a local path, or an empty string for a file system root. */
	public static String name(Path p)
	{
		Path n = p.toAbsolutePath().normalize().getFileName();
		return (n == null) ? "" : n.toString();
	}
	
	/** Returns a display form of a virtual path prefixed with the separator. */
	public static String display(VirtualPath p)
	{
		return p.isRoot() ? "/" : "/" + p.getObjectKey();
	}
}
