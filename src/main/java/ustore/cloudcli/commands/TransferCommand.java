package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.TransferReport;
import ustore.cloudcli.data.TransferTask;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.CompletionCallback;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.service.runners.ParallelRunner;
import ustore.cloudcli.threading.TaskJob;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.PartialFailureException;
import ustore.cloudcli.utils.PathUtils;
import ustore.cloudcli.utils.StorageException;
import ustore.cloudcli.utils.StreamUtils;

/**
 * Implements {@code put} and {@code get}: batch transfers between the local file system and one backend.
 * <p><p>
 * A recursive request is expanded lazily into one {@link TransferTask} per file and run on a bounded pool.
 * A failing task is recorded and the batch goes on; once every task has finished, any failure is raised as a
 * {@link PartialFailureException} whose report tells, per failed task, what was left at the destination.
 * Downloads write a temporary sibling file and move it into place, so a failed download never leaves a partial file.
 */
public class TransferCommand extends AbstractCommand 
{
	protected static final String TEMP_PREFIX = ".cloudcli-part-";
	
	private final int concurrency;
	private final CompletionCallback callback;
	
	public TransferCommand(ExternalStorageInterface s, int n, CompletionCallback cb) { super(s); concurrency = n; callback = cb; }
	
	public TransferCommand(ExternalStorageInterface s) { this(s, SystemParameters.getInstance().transferConcurrency, null); }
	
	/** Uploads a local file or, with {@code recursive}, a local directory tree. */
	public TransferReport put(Path src, VirtualPath dst, boolean recursive)
	{
		if(Files.exists(src) == false) { throw Errors.notFound(src); }
		Entry d = dst.isRoot() ? Entry.directory(dst) : statOrNull(dst.asFile());
		boolean intoDir = d != null && d.isDirectory() == true;
		String name = PathUtils.name(src);
		TransferReport report = new TransferReport();
		
		if(Files.isDirectory(src) == false)
		{
			VirtualPath target = intoDir ? d.getPath().resolve(name) : dst.asFile();
			TransferTask task = new TransferTask(src.toString(), target.toString(), TransferTask.Direction.UPLOAD, size(src));
			report.add(task);
			upload(task, src, target);
			if(task.getFailure() != null) { throw task.getFailure(); }
			return report;
		}
		
		if(recursive == false) { throw Errors.invalidArgument(src, "is a directory (use -R)"); }
		final VirtualPath base = (intoDir == true && name.isEmpty() == false) ? d.getPath().resolve(name).asDirectory() : dst.asDirectory();
		storage.createDir(base, true);
		
		try(ParallelRunner runner = new ParallelRunner(concurrency); Stream<Path> walk = Files.walk(src))
		{
			Iterator<Path> it = walk.iterator();
			while(it.hasNext() == true)
			{
				final Path local = it.next();
				if(local.equals(src) == true) { continue; }
				final VirtualPath to = base.resolve(PathUtils.relativeKey(src, local));
				if(Files.isDirectory(local) == true) { storage.createDir(to.asDirectory(), true); continue; }
				if(Files.isRegularFile(local) == false) { continue; }
				
				final TransferTask task = new TransferTask(local.toString(), to.toString(), TransferTask.Direction.UPLOAD, size(local));
				report.add(task);
				runner.schedule(new TaskJob("put " + local, task, callback, new Callable<Void>()
				{
					@Override
					public Void call() 
					{
						upload(task, local, to);
						return null;
					}
				}));
			}
			runner.awaitAll();
		}
		catch(IOException e) { throw Errors.translate(e, src, null); }
		catch(InterruptedException e) { throw interrupted(report, "put"); }
		
		return finish(report);
	}
	
	/** Downloads an object or, with {@code recursive}, a directory tree. */
	public TransferReport get(VirtualPath src, Path dst, boolean recursive)
	{
		Entry source = storage.stat(src);
		boolean intoDir = Files.isDirectory(dst);
		String name = source.getPath().getName();
		TransferReport report = new TransferReport();
		
		if(source.isDirectory() == false)
		{
			Path target = intoDir ? dst.resolve(name) : dst;
			TransferTask task = new TransferTask(source.getPath().toString(), target.toString(), TransferTask.Direction.DOWNLOAD, source.getSizeOrZero());
			report.add(task);
			download(task, source.getPath(), target);
			if(task.getFailure() != null) { throw task.getFailure(); }
			return report;
		}
		
		if(recursive == false) { throw Errors.invalidArgument(src, "is a directory (use -R)"); }
		Path base = (intoDir == true && name.isEmpty() == false) ? dst.resolve(name) : dst;
		try(ParallelRunner runner = new ParallelRunner(concurrency))
		{
			Files.createDirectories(base);
			Iterator<Entry> it = storage.list(source.getPath(), true);
			while(it.hasNext() == true)
			{
				Entry e = it.next();
				final Path to = PathUtils.toLocal(base, source.getPath().relativize(e.getPath()));
				if(e.isDirectory() == true) { Files.createDirectories(to); continue; }
				if(e.isFile() == false) { continue; }
				
				final VirtualPath from = e.getPath();
				final TransferTask task = new TransferTask(from.toString(), to.toString(), TransferTask.Direction.DOWNLOAD, e.getSizeOrZero());
				report.add(task);
				runner.schedule(new TaskJob("get " + from, task, callback, new Callable<Void>()
				{
					@Override
					public Void call() 
					{
						download(task, from, to);
						return null;
					}
				}));
			}
			runner.awaitAll();
		}
		catch(IOException e) { throw Errors.translate(e, base, null); }
		catch(InterruptedException e) { throw interrupted(report, "get"); }
		
		return finish(report);
	}
	
	protected void upload(final TransferTask task, Path local, VirtualPath target)
	{
		task.onStart();
		TransferTask.DestinationState touched = TransferTask.DestinationState.UNTOUCHED;
		try(InputStream in = Files.newInputStream(local))
		{
			touched = storage.getCapabilities().hasAtomicCommit() 
					? TransferTask.DestinationState.ABSENT : TransferTask.DestinationState.POSSIBLY_PARTIAL;
			streams.copyAndCommit(in, storage.openWrite(target), progress(task));
			succeeded(task);
		}
		catch(IOException e) { failed(task, Errors.translate(e, local, null), touched); }
		catch(StorageException e) { failed(task, e, touched); }
	}
	
	protected void download(final TransferTask task, VirtualPath remote, Path target)
	{
		task.onStart();
		Path temp = target.resolveSibling(TEMP_PREFIX + target.getFileName() + "." + UUID.randomUUID());
		try
		{
			try(InputStream in = storage.openRead(remote, null);
				FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))
			{
				OutputStream out = Channels.newOutputStream(channel);
				streams.copy(in, out, progress(task));
				channel.force(true);
			}
			try { Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING); }
			catch(AtomicMoveNotSupportedException e) { Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING); }
			succeeded(task);
		}
		catch(IOException e) { failed(task, Errors.translate(e, remote, null), TransferTask.DestinationState.ABSENT); }
		catch(StorageException e) { failed(task, e, TransferTask.DestinationState.ABSENT); }
		finally { removeTemp(temp); }
	}
	
	private void removeTemp(Path temp)
	{
		try { Files.deleteIfExists(temp); }
		catch(IOException e) { log.append("[TX] could not remove temporary file " + temp + ": " + e.getMessage(), Log.WARNING); }
	}
	
	private StreamUtils.ProgressListener progress(final TransferTask task)
	{
		return new StreamUtils.ProgressListener()
		{
			@Override
			public void onBytes(long n) { task.addBytes(n); }
		};
	}
	
	private void succeeded(TransferTask task)
	{
		task.onSuccess();
		log.append("[TX] done " + task, Log.TRACE);
		if(callback != null) { callback.onSuccess(task); }
	}
	
	private void failed(TransferTask task, StorageException e, TransferTask.DestinationState left)
	{
		task.onFailure(e, left);
		log.append("[TX] failed " + task + ": " + e.getMessage(), Log.WARNING);
		if(callback != null) { callback.onFailure(task); }
	}
	
	private StorageException interrupted(TransferReport report, String verb)
	{
		Thread.currentThread().interrupt();
		report.markInterrupted();
		return Errors.interrupted(verb);
	}
	
	private TransferReport finish(TransferReport report)
	{
		log.append("[TX] " + report.summary() + ", " + report.bytesDone() + " bytes", Log.INFO);
		if(report.hasFailures() == true) { throw new PartialFailureException(report); }
		return report;
	}
	
	private static long size(Path p)
	{
		try { return Files.size(p); }
		catch(IOException e) { throw Errors.translate(e, p, null); }
	}
}
