package ustore.cloudcli.implementation;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.UUID;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.FileUtil;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;

import com.google.common.collect.AbstractIterator;
import com.google.common.io.ByteStreams;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Capabilities;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.InternalStorageInterface;

/**
 * Implements a storage backend for HDFS through the Hadoop {@link FileSystem} client.
 * <p><p>
 * Writes go to a temporary sibling that is renamed over the target on commit. Replacing an existing file is a
 * delete followed by a rename, so a crash between the two leaves the target absent but never partial.
 */
public class HdfsStorage implements InternalStorageInterface 
{
	private static final String TEMP_MARKER = ".cloudcli-tmp-";
	
	private Log log = Log.getInstance();
	
	private final String nameNode;
	private final Path root;
	private final Configuration conf;
	private FileSystem fs = null;
	
	public HdfsStorage(EffectiveConfig cfg) { this(cfg.getNameNode(), cfg.getRootPath(), new Configuration()); }
	
	public HdfsStorage(String nn, String rootPath, Configuration c)
	{
		nameNode = nn; conf = c;
		root = new Path(rootPath == null ? "/" : rootPath);
	}
	
	/** Uses an existing file system (a local one in tests). */
	public HdfsStorage(FileSystem fileSystem, String rootPath)
	{
		nameNode = fileSystem.getUri().toString(); conf = fileSystem.getConf(); fs = fileSystem;
		root = new Path(rootPath);
	}
	
	protected Path resolve(VirtualPath p) { return p.isRoot() ? root : new Path(root, p.getKey()); }
	
	protected VirtualPath toVirtual(FileStatus st)
	{
		String full = Path.getPathWithoutSchemeAndAuthority(st.getPath()).toString();
		String base = Path.getPathWithoutSchemeAndAuthority(fs.makeQualified(root)).toString();
		String rel = full.length() > base.length() ? full.substring(base.length()) : "";
		return st.isDirectory() ? VirtualPath.directory(rel) : VirtualPath.of(rel);
	}

	@Override
	public void connect() throws IOException
	{
		if(fs != null) { return; }
		conf.set(FileSystem.FS_DEFAULT_NAME_KEY, nameNode);
		fs = FileSystem.get(URI.create(nameNode), conf);
		log.append("[HD] connected to " + nameNode + " with root " + root, Log.TRACE);
	}
	
	@Override
	public Capabilities getCapabilities() { return new Capabilities(true, true, true, true, true); }
	
	protected Entry toEntry(FileStatus st)
	{
		Instant modified = Instant.ofEpochMilli(st.getModificationTime());
		if(st.isDirectory() == true) { return Entry.directory(toVirtual(st), modified); }
		EntryKind kind = st.isFile() ? EntryKind.FILE : EntryKind.OTHER;
		return new Entry(toVirtual(st), kind, st.isFile() ? Long.valueOf(st.getLen()) : null, modified, null, null);
	}

	@Override
	public Entry stat(VirtualPath path) throws IOException
	{
		try 
		{ 
			FileStatus st = fs.getFileStatus(resolve(path));
			if(path.isDirectory() == true && st.isDirectory() == false) { return null; }
			return toEntry(st); 
		}
		catch(FileNotFoundException e) { return null; }
	}

	@Override
	public Iterator<Entry> list(VirtualPath dir, boolean recursive) throws IOException
	{
		final boolean rec = recursive;
		final Deque<RemoteIterator<FileStatus>> stack = new ArrayDeque<RemoteIterator<FileStatus>>();
		stack.push(fs.listStatusIterator(resolve(dir)));
		return new AbstractIterator<Entry>()
		{
			@Override
			protected Entry computeNext() 
			{
				try
				{
					while(stack.isEmpty() == false)
					{
						RemoteIterator<FileStatus> top = stack.peek();
						if(top.hasNext() == false) { stack.pop(); continue; }
						FileStatus st = top.next();
						if(st.getPath().getName().startsWith(TEMP_MARKER) == true) { continue; }
						if(st.isDirectory() == true && rec == true) { stack.push(fs.listStatusIterator(st.getPath())); }
						return toEntry(st);
					}
					return endOfData();
				}
				catch(IOException e) { throw new java.io.UncheckedIOException(e); }
			}
		};
	}

	@Override
	public InputStream openRead(VirtualPath path, ByteRange range) throws IOException
	{
		FSDataInputStream in = fs.open(resolve(path));
		if(range == null) { return in; }
		in.seek(range.getOffset());
		return range.isOpenEnded() ? in : ByteStreams.limit(in, range.getLength());
	}

	@Override
	public ObjectSink openWrite(VirtualPath path) throws IOException
	{
		final Path target = resolve(path);
		final Path temp = new Path(target.getParent(), TEMP_MARKER + target.getName() + "." + UUID.randomUUID());
		final FSDataOutputStream out = fs.create(temp, false);
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
				try
				{
					out.hsync();
					out.close();
					if(fs.exists(target) == true) { fs.delete(target, false); }
					if(fs.rename(temp, target) == false) { throw new IOException("cannot commit " + target); }
				}
				catch(IOException e)
				{
					fs.delete(temp, false);
					throw e;
				}
			}
			
			@Override
			public void abort()
			{
				if(finished == true) { return; }
				finished = true;
				try { out.close(); fs.delete(temp, false); }
				catch(IOException e) { log.append("[HD] could not remove temporary file " + temp + ": " + e.getMessage(), Log.WARNING); }
			}
		};
	}
	
	@Override
	public ObjectSink openAppend(VirtualPath path) throws IOException
	{
		final Path target = resolve(path);
		final long originalLength = fs.exists(target) ? fs.getFileStatus(target).getLen() : -1;
		final FSDataOutputStream out = (originalLength < 0) ? fs.create(target, false) : fs.append(target);
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
				out.hsync();
				out.close();
			}
			
			@Override
			public void abort()
			{
				if(finished == true) { return; }
				finished = true;
				try
				{
					out.close();
					if(originalLength < 0) { fs.delete(target, false); }
					else { fs.truncate(target, originalLength); }
				}
				catch(IOException e) { log.append("[HD] could not roll back append on " + target + ": " + e.getMessage(), Log.WARNING); }
			}
		};
	}

	@Override
	public void delete(VirtualPath path) throws IOException
	{
		if(fs.delete(resolve(path), false) == false) { throw new FileNotFoundException(path.toString()); }
	}

	@Override
	public void createDirectory(VirtualPath path, boolean recursive) throws IOException
	{
		Path p = resolve(path);
		if(recursive == false && p.getParent() != null && fs.exists(p.getParent()) == false) 
		{ 
			throw new FileNotFoundException(path.getParent().toString()); 
		}
		fs.mkdirs(p);
	}

	@Override
	public void copy(VirtualPath src, VirtualPath dst) throws IOException
	{
		Path target = resolve(dst);
		Path temp = new Path(target.getParent(), TEMP_MARKER + target.getName() + "." + UUID.randomUUID());
		if(FileUtil.copy(fs, resolve(src), fs, temp, false, conf) == false) { throw new IOException("cannot copy " + src); }
		if(fs.exists(target) == true) { fs.delete(target, false); }
		if(fs.rename(temp, target) == false) 
		{ 
			fs.delete(temp, false);
			throw new IOException("cannot commit " + dst); 
		}
	}

	@Override
	public void rename(VirtualPath src, VirtualPath dst) throws IOException
	{
		Path from = resolve(src);
		Path to = resolve(dst);
		if(fs.exists(from) == false) { throw new FileNotFoundException(src.toString()); }
		if(fs.isFile(from) == true && fs.isFile(to) == true) { fs.delete(to, false); }
		if(fs.rename(from, to) == false) { throw new IOException("cannot rename " + src + " to " + dst); }
	}

	@Override
	public void disconnect() 
	{
		try { if(fs != null) { fs.close(); } }
		catch(IOException e) { log.append("[HD] error while closing file system: " + e.getMessage(), Log.WARNING); }
	}
	
	@Override
	public String getName() { return "hdfs:" + nameNode + root; }
}
