package ustore.cloudcli.commands;

import java.util.Iterator;
import java.util.concurrent.Callable;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.TransferReport;
import ustore.cloudcli.data.TransferTask;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.service.runners.ParallelRunner;
import ustore.cloudcli.threading.TaskJob;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.PartialFailureException;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements {@code cp} inside one backend. With {@code -R} a directory expands into one copy task per file.
 */
public class CopyCommand extends AbstractCommand 
{
	private final int concurrency;
	
	public CopyCommand(ExternalStorageInterface s, int n) { super(s); concurrency = n; }
	
	public CopyCommand(ExternalStorageInterface s) { this(s, SystemParameters.getInstance().transferConcurrency); }
	
	/** Returns where {@code name} lands when copied to {@code dst}: inside it when it is an existing directory. */
	protected VirtualPath landing(VirtualPath dst, String name)
	{
		Entry d = dst.isRoot() ? Entry.directory(dst) : statOrNull(dst.asFile());
		if(d != null && d.isDirectory() == true) { return d.getPath().resolve(name); }
		return dst;
	}
	
	public TransferReport copy(VirtualPath src, VirtualPath dst, boolean recursive)
	{
		Entry source = storage.stat(src);
		VirtualPath target = landing(dst, source.getPath().getName());
		TransferReport report = new TransferReport();
		
		if(source.isDirectory() == false)
		{
			TransferTask task = new TransferTask(source.getPath().toString(), target.toString(), TransferTask.Direction.INTRA_COPY, source.getSizeOrZero());
			report.add(task);
			run(task, source.getPath(), target);
			if(task.getFailure() != null) { throw task.getFailure(); }
			return report;
		}
		
		if(recursive == false) { throw Errors.invalidArgument(src, "is a directory (use -R)"); }
		if(source.getPath().isRoot() == false && (source.getPath().equals(target.asDirectory()) || source.getPath().isAncestorOf(target)))
		{
			throw Errors.invalidArgument(dst, "cannot copy a directory into itself");
		}
		
		VirtualPath base = target.asDirectory();
		storage.createDir(base, true);
		try(ParallelRunner runner = new ParallelRunner(concurrency))
		{
			Iterator<Entry> it = storage.list(source.getPath(), true);
			while(it.hasNext() == true)
			{
				Entry e = it.next();
				final VirtualPath to = base.resolve(source.getPath().relativize(e.getPath()));
				if(e.isDirectory() == true) { storage.createDir(to, true); continue; }
				if(e.isFile() == false) { continue; }
				
				final VirtualPath from = e.getPath();
				final TransferTask task = new TransferTask(from.toString(), to.toString(), TransferTask.Direction.INTRA_COPY, e.getSizeOrZero());
				report.add(task);
				runner.schedule(new TaskJob("cp " + from, task, new Callable<Void>()
				{
					@Override
					public Void call() 
					{
						run(task, from, to);
						return null;
					}
				}));
			}
			runner.awaitAll();
		}
		catch(InterruptedException e)
		{
			Thread.currentThread().interrupt();
			report.markInterrupted();
			throw Errors.interrupted("cp");
		}
		
		log.append("[CP] " + report.summary(), Log.INFO);
		if(report.hasFailures() == true) { throw new PartialFailureException(report); }
		return report;
	}
	
	private void run(TransferTask task, VirtualPath from, VirtualPath to)
	{
		task.onStart();
		try
		{
			storage.copy(from, to);
			task.addBytes(task.getBytesTotal());
			task.onSuccess();
		}
		catch(StorageException e)
		{
			TransferTask.DestinationState left = storage.getCapabilities().hasAtomicCommit() 
					? TransferTask.DestinationState.ABSENT : TransferTask.DestinationState.POSSIBLY_PARTIAL;
			task.onFailure(e, left);
		}
	}
}
