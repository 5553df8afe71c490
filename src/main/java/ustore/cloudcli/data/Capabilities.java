package ustore.cloudcli.data;

/**
 * Represents what a backend can do natively; the storage adapter emulates the rest.
 */
public final class Capabilities 
{
	private final boolean rangedRead;
	private final boolean nativeAppend;
	private final boolean realDirectories;
	private final boolean nativeRename;
	private final boolean atomicCommit;
	
	public Capabilities(boolean ranged, boolean append, boolean dirs, boolean rename, boolean atomic)
	{
		rangedRead = ranged; nativeAppend = append; realDirectories = dirs; nativeRename = rename; atomicCommit = atomic;
	}
	
	public boolean hasRangedRead() { return rangedRead; }
	
	public boolean hasNativeAppend() { return nativeAppend; }
	
	/** True for hierarchical backends (filesystem, HDFS) where directories exist independently of their content. */
	public boolean hasRealDirectories() { return realDirectories; }
	
	public boolean hasNativeRename() { return nativeRename; }
	
	/** True when an interrupted write can never leave a partially written object behind. */
	public boolean hasAtomicCommit() { return atomicCommit; }
}
