package ustore.cloudcli.commands;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code append}: native append where the backend has one, otherwise read, concatenate and rewrite.
 * <p><p>
 * The rewrite goes through {@link ExternalStorageInterface#openWrite(VirtualPath)}, so a failed append leaves
 * the previous object in place.
 */
public class AppendCommand extends AbstractCommand 
{
	/** Represents the switches of one append. */
	public static class Options
	{
		public boolean noCreate = false;
		public boolean parents = false;
		public boolean force = false;
		public long sizeLimit = -1;
		public Long ifSize = null;
		public String ifEtag = null;
		
		public Options noCreate(boolean b) { noCreate = b; return this; }
		public Options parents(boolean b) { parents = b; return this; }
		public Options force(boolean b) { force = b; return this; }
		public Options sizeLimit(long n) { sizeLimit = n; return this; }
		public Options ifSize(Long n) { ifSize = n; return this; }
		public Options ifEtag(String s) { ifEtag = s; return this; }
	}
	
	public AppendCommand(ExternalStorageInterface s) { super(s); }
	
	/** Appends everything {@code source} yields to {@code target} and returns the number of bytes appended. */
	public long append(VirtualPath target, InputStream source, Options opts)
	{
		if(target.isDirectory() == true) { throw Errors.invalidArgument(target, "is a directory"); }
		long limit = (opts.sizeLimit < 0) ? sysParams.appendSizeLimit : opts.sizeLimit;
		
		Entry existing = statOrNull(target);
		if(existing != null && existing.isDirectory() == true) { throw Errors.invalidArgument(target, "is a directory"); }
		if(existing == null && opts.noCreate == true) { throw Errors.notFound(target); }
		checkPreconditions(target, existing, opts);
		
		if(existing == null && opts.parents == true && storage.getCapabilities().hasRealDirectories() == true)
		{
			storage.createDir(target.getParent(), true);
		}
		
		if(storage.getCapabilities().hasNativeAppend() == true && existing != null)
		{
			log.append("[AP] native append to " + target, Log.TRACE);
			try { return streams.copyAndCommit(source, storage.openAppend(target), null); }
			catch(IOException e) { throw Errors.translate(e, target, null); }
		}
		return rewrite(target, existing, source, limit, opts.force);
	}
	
	private void checkPreconditions(VirtualPath target, Entry existing, Options opts)
	{
		if(opts.ifSize == null && opts.ifEtag == null) { return; }
		if(existing == null) { throw Errors.notFound(target); }
		if(opts.ifSize != null && existing.getSizeOrZero() != opts.ifSize.longValue())
		{
			throw Errors.invalidArgument(target, "size is " + existing.getSizeOrZero() + ", expected " + opts.ifSize);
		}
		if(opts.ifEtag != null && opts.ifEtag.equals(existing.getEtag()) == false)
		{
			throw Errors.invalidArgument(target, "etag is " + existing.getEtag() + ", expected " + opts.ifEtag);
		}
	}
	
	private long rewrite(VirtualPath target, Entry existing, InputStream source, long limit, boolean force)
	{
		ByteArrayOutputStream merged = new ByteArrayOutputStream();
		long appended;
		try
		{
			if(existing != null)
			{
				if(force == false && existing.getSizeOrZero() > limit) { throw Errors.sizeLimit(target, existing.getSizeOrZero(), limit); }
				try(InputStream in = storage.openRead(target, null)) { streams.copy(in, merged); }
			}
			int before = merged.size();
			byte[] tail = streams.readAtMost(source, force ? Long.MAX_VALUE : limit - before);
			if(tail == null) { throw Errors.sizeLimit(target, limit + 1, limit); }
			merged.write(tail);
			appended = merged.size() - before;
		}
		catch(IOException e) { throw Errors.translate(e, target, null); }
		
		Entry now = statOrNull(target);
		if(changed(existing, now) == true) { throw Errors.invalidArgument(target, "modified concurrently, append aborted"); }
		
		log.append("[AP] rewriting " + target + " with " + appended + " appended bytes", Log.TRACE);
		ObjectSink sink = storage.openWrite(target);
		streams.writeAndCommit(sink, merged.toByteArray());
		return appended;
	}
	
	private static boolean changed(Entry before, Entry after)
	{
		if(before == null || after == null) { return before != after; }
		if(before.getSizeOrZero() != after.getSizeOrZero()) { return true; }
		return before.getEtag() != null && before.getEtag().equals(after.getEtag()) == false;
	}
}
