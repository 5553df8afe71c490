package ustore.cloudcli.implementation;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import com.google.common.collect.AbstractIterator;
import com.google.common.io.ByteStreams;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.InternalStorageInterface;

/**
 * Implements a storage backend for a directory of the local file system.
 * <p><p>
 * Writes go to a hidden temporary sibling that is fsync'ed and atomically moved over the target on commit.
 */
public class LocalStorage implements InternalStorageInterface 
{
	private static final String TEMP_MARKER = ".cloudcli-tmp-";
	
	private Log log = Log.getInstance();
	
	private final Path root;
	
	public LocalStorage(String rootPath) { root = Paths.get(rootPath).toAbsolutePath().normalize(); }
	
	public LocalStorage(Path rootPath) { root = rootPath.toAbsolutePath().normalize(); }
	
	protected Path resolve(VirtualPath p) { return p.isRoot() ? root : root.resolve(p.getKey()); }
	
	protected VirtualPath toVirtual(Path p, boolean dir)
	{
		String rel = root.relativize(p).toString().replace('\\', '/');
		return dir ? VirtualPath.directory(rel) : VirtualPath.of(rel);
	}

	@Override
	public void connect() throws IOException
	{
		if(Files.isDirectory(root) == false) { throw new NoSuchFileException(root.toString()); }
		log.append("[FS] using root " + root, Log.TRACE);
	}
	
	@Override
	public Capabilities getCapabilities() { return new Capabilities(true, true, true, true, true); }

	@Override
	public Entry stat(VirtualPath path) throws IOException
	{
		Path p = resolve(path);
		if(Files.exists(p, LinkOption.NOFOLLOW_LINKS) == false) { return null; }
		BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
		if(path.isDirectory() == true && attrs.isDirectory() == false) { return null; }
		return toEntry(p, attrs);
	}
	
	protected Entry toEntry(Path p, BasicFileAttributes attrs)
	{
		if(attrs.isDirectory() == true) { return Entry.directory(toVirtual(p, true), attrs.lastModifiedTime().toInstant()); }
		EntryKind kind = attrs.isRegularFile() ? EntryKind.FILE : EntryKind.OTHER;
		Long size = attrs.isRegularFile() ? Long.valueOf(attrs.size()) : null;
		return new Entry(toVirtual(p, false), kind, size, attrs.lastModifiedTime().toInstant(), null, null);
	}

	@Override
	public Iterator<Entry> list(VirtualPath dir, boolean recursive) throws IOException
	{
		Path start = resolve(dir);
		if(Files.isDirectory(start) == false)
		{
			if(Files.exists(start) == false) { throw new NoSuchFileException(dir.toString()); }
			throw new NotDirectoryException(dir.toString());
		}
		return new DepthFirstIterator(start, recursive);
	}
	
	/** Walks the tree depth-first; only the children of the directories on the current branch are held. */
	protected class DepthFirstIterator extends AbstractIterator<Entry>
	{
		private final Deque<Iterator<Path>> stack = new ArrayDeque<Iterator<Path>>();
		private final boolean recursive;
		
		DepthFirstIterator(Path start, boolean rec) throws IOException
		{
			recursive = rec;
			stack.push(children(start));
		}
		
		private Iterator<Path> children(Path dir) throws IOException
		{
			List<Path> ret = new ArrayList<Path>();
			try(DirectoryStream<Path> ds = Files.newDirectoryStream(dir))
			{
				for(Path p : ds) 
				{ 
					if(p.getFileName().toString().startsWith(TEMP_MARKER) == false) { ret.add(p); }
				}
			}
			Collections.sort(ret);
			return ret.iterator();
		}
		
		@Override
		protected Entry computeNext() 
		{
			while(stack.isEmpty() == false)
			{
				Iterator<Path> top = stack.peek();
				if(top.hasNext() == false) { stack.pop(); continue; }
				
				Path p = top.next();
				try
				{
					BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
					if(attrs.isDirectory() == true && recursive == true) { stack.push(children(p)); }
					return toEntry(p, attrs);
				}
				catch(NoSuchFileException e) 
				{
					log.append("[FS] " + p + " vanished during listing", Log.TRACE);
				}
				catch(IOException e) { throw new java.io.UncheckedIOException(e); }
			}
			return endOfData();
		}
	}

	@Override
	public InputStream openRead(VirtualPath path, ByteRange range) throws IOException
	{
		Path p = resolve(path);
		if(Files.isDirectory(p) == true) { throw new NotDirectoryException(path + " is a directory"); }
		if(range == null) { return Files.newInputStream(p); }
		
		SeekableByteChannel ch = Files.newByteChannel(p, StandardOpenOption.READ);
		ch.position(range.getOffset());
		InputStream in = Channels.newInputStream(ch);
		return range.isOpenEnded() ? in : ByteStreams.limit(in, range.getLength());
	}

	@Override
	public ObjectSink openWrite(VirtualPath path) throws IOException
	{
		Path target = resolve(path);
		Path temp = target.resolveSibling(TEMP_MARKER + target.getFileName() + "." + UUID.randomUUID());
		return new CommitSink(target, temp);
	}
	
	@Override
	public ObjectSink openAppend(VirtualPath path) throws IOException
	{
		final Path target = resolve(path);
		final FileChannel ch = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.APPEND, StandardOpenOption.CREATE);
		final long originalSize = ch.size();
		final OutputStream out = Channels.newOutputStream(ch);
		return new ObjectSink()
		{
			private boolean finished = false;
			
			@Override
			public void write(byte[] b, int off, int len) throws IOException { out.write(b, off, len); }
			
			@Override
			public void close() throws IOException
			{
				if(finished == true) { return; }
				finished = true;
				ch.force(true);
				ch.close();
			}
			
			@Override
			public void abort()
			{
				if(finished == true) { return; }
				finished = true;
				try { ch.truncate(originalSize); ch.close(); }
				catch(IOException e) { log.append("[FS] could not roll back append on " + target + ": " + e.getMessage(), Log.WARNING); }
			}
		};
	}
	
	/** Writes to a temporary sibling and moves it over the target on close. */
	protected class CommitSink extends ObjectSink
	{
		private final Path target;
		private final Path temp;
		private final FileChannel channel;
		private final OutputStream out;
		private boolean finished = false;
		
		CommitSink(Path t, Path tmp) throws IOException
		{
			target = t; temp = tmp;
			channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
			out = Channels.newOutputStream(channel);
		}
		
		@Override
		public void write(byte[] b, int off, int len) throws IOException { out.write(b, off, len); }
		
		@Override
		public void close() throws IOException
		{
			if(finished == true) { return; }
			finished = true;
			try
			{
				channel.force(true);
				channel.close();
				moveIntoPlace(temp, target);
			}
			catch(IOException e)
			{
				Files.deleteIfExists(temp);
				throw e;
			}
		}
		
		@Override
		public void abort()
		{
			if(finished == true) { return; }
			finished = true;
			try { channel.close(); Files.deleteIfExists(temp); }
			catch(IOException e) { log.append("[FS] could not remove temporary file " + temp + ": " + e.getMessage(), Log.WARNING); }
		}
	}
	
	private void moveIntoPlace(Path from, Path to) throws IOException
	{
		if(Files.isDirectory(to) == true) { throw new FileAlreadyExistsException(to.toString() + " is a directory"); }
		try { Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING); }
		catch(AtomicMoveNotSupportedException e) { Files.move(from, to, StandardCopyOption.REPLACE_EXISTING); }
	}

	@Override
	public void delete(VirtualPath path) throws IOException
	{
		Files.delete(resolve(path));
	}

	@Override
	public void createDirectory(VirtualPath path, boolean recursive) throws IOException
	{
		Path p = resolve(path);
		if(Files.isDirectory(p) == true) { return; }
		if(recursive == true) { Files.createDirectories(p); }
		else { Files.createDirectory(p); }
	}

	@Override
	public void copy(VirtualPath src, VirtualPath dst) throws IOException
	{
		Path from = resolve(src);
		Path to = resolve(dst);
		Path temp = to.resolveSibling(TEMP_MARKER + to.getFileName() + "." + UUID.randomUUID());
		try
		{
			Files.copy(from, temp);
			moveIntoPlace(temp, to);
		}
		finally { Files.deleteIfExists(temp); }
	}

	@Override
	public void rename(VirtualPath src, VirtualPath dst) throws IOException
	{
		Path from = resolve(src);
		Path to = resolve(dst);
		if(Files.isDirectory(from) == true) { Files.move(from, to); }
		else { moveIntoPlace(from, to); }
	}

	@Override
	public void disconnect() {}
	
	@Override
	public String getName() { return "fs:" + root; }
}
