package ustore.cloudcli.commands;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.TransferReport;
import ustore.cloudcli.data.TransferTask;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.Confirmation;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.service.runners.ParallelRunner;
import ustore.cloudcli.threading.TaskJob;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.PartialFailureException;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements {@code rm}.
 * <p><p>
 * Every path is stat'ed and, without {@code -f}, confirmed before the first delete. A recursive delete streams the
 * subtree: files go to a bounded worker pool and a directory is removed once the listing has left it and every
 * delete below it has finished. Single failures are recorded and reported after the whole batch.
 */
public class DeleteCommand extends AbstractCommand 
{
	private final int concurrency;
	
	public DeleteCommand(ExternalStorageInterface s, int n) { super(s); concurrency = n; }
	
	public DeleteCommand(ExternalStorageInterface s) { this(s, SystemParameters.getInstance().transferConcurrency); }
	
	public TransferReport delete(List<VirtualPath> paths, boolean recursive, boolean force, Confirmation confirmation)
	{
		if(paths.isEmpty() == true) { throw Errors.invalidArgument("no path given"); }
		List<Entry> targets = new ArrayList<Entry>();
		for(VirtualPath p : paths)
		{
			if(p.isRoot() == true) { throw Errors.invalidArgument(p, "refusing to delete the storage root"); }
			Entry e = storage.stat(p);
			if(e.isDirectory() == true && recursive == false) { throw Errors.invalidArgument(p, "is a directory (use -R)"); }
			targets.add(e);
		}
		
		if(force == false)
		{
			String question = (targets.size() == 1) 
					? "remove " + (recursive ? "recursively " : "") + targets.get(0).getPath() + "?"
					: "remove " + targets.size() + " paths" + (recursive ? " recursively" : "") + "?";
			if(confirmation == null || confirmation.confirm(question) == false)
			{
				log.append("[RM] delete declined for " + paths, Log.INFO);
				throw new StorageException(ErrorKind.INTERRUPTED, null, "cancelled by user");
			}
		}
		
		TransferReport report = new TransferReport();
		try(ParallelRunner runner = new ParallelRunner(concurrency))
		{
			for(Entry target : targets)
			{
				if(target.isDirectory() == true) { deleteTree(target.getPath(), runner, report); }
				else { schedule(target.getPath(), runner, report); }
			}
			runner.awaitAll();
		}
		catch(InterruptedException e)
		{
			Thread.currentThread().interrupt();
			report.markInterrupted();
			throw Errors.interrupted("rm");
		}
		
		if(report.hasFailures() == true) { throw new PartialFailureException(report); }
		return report;
	}
	
	private void deleteTree(VirtualPath root, ParallelRunner runner, TransferReport report) throws InterruptedException
	{
		Deque<VirtualPath> open = new ArrayDeque<VirtualPath>();
		open.push(root);
		Iterator<Entry> it = storage.list(root, true);
		while(it.hasNext() == true)
		{
			Entry e = it.next();
			while(open.size() > 1 && open.peek().isAncestorOf(e.getPath()) == false) { removeDir(open.pop(), runner, report); }
			if(e.isDirectory() == true) { open.push(e.getPath()); }
			else { schedule(e.getPath(), runner, report); }
		}
		while(open.isEmpty() == false) { removeDir(open.pop(), runner, report); }
	}
	
	private void removeDir(VirtualPath dir, ParallelRunner runner, TransferReport report) throws InterruptedException
	{
		runner.awaitAll();
		TransferTask task = new TransferTask(dir.toString(), dir.toString(), TransferTask.Direction.DELETE, 0);
		report.add(task);
		run(task, dir);
	}
	
	private void schedule(final VirtualPath file, ParallelRunner runner, TransferReport report) throws InterruptedException
	{
		final TransferTask task = new TransferTask(file.toString(), file.toString(), TransferTask.Direction.DELETE, 0);
		report.add(task);
		runner.schedule(new TaskJob("rm " + file, task, new Callable<Void>()
		{
			@Override
			public Void call() 
			{
				run(task, file);
				return null;
			}
		}));
	}
	
	private void run(TransferTask task, VirtualPath path)
	{
		task.onStart();
		try
		{
			storage.delete(path);
			task.onSuccess();
		}
		catch(StorageException e)
		{
			log.append("[RM] could not delete " + path + ": " + e.getMessage(), Log.WARNING);
			task.onFailure(e, TransferTask.DestinationState.UNTOUCHED);
		}
	}
}
