package ustore.cloudcli.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the outcome of a batch of {@link TransferTask}s.
 */
public class TransferReport 
{
	protected final List<TransferTask> tasks = Collections.synchronizedList(new ArrayList<TransferTask>());
	protected volatile boolean interrupted = false;
	
	public void add(TransferTask t) { tasks.add(t); }
	
	public void markInterrupted() { interrupted = true; }
	
	public boolean wasInterrupted() { return interrupted; }
	
	public List<TransferTask> getTasks() 
	{ 
		synchronized(tasks) { return new ArrayList<TransferTask>(tasks); }
	}
	
	public List<TransferTask> getFailures() { return filter(TransferTask.Status.FAILED); }
	
	public List<TransferTask> getSucceeded() { return filter(TransferTask.Status.DONE); }
	
	public boolean hasFailures() { return getFailures().isEmpty() == false; }
	
	public int size() { return tasks.size(); }
	
	public long bytesDone()
	{
		long ret = 0;
		for(TransferTask t : getTasks()) { ret += t.getBytesDone(); }
		return ret;
	}
	
	private List<TransferTask> filter(TransferTask.Status s)
	{
		List<TransferTask> ret = new ArrayList<TransferTask>();
		for(TransferTask t : getTasks()) { if(t.getStatus() == s) { ret.add(t); } }
		return ret;
	}
	
	public String summary()
	{
		int failed = getFailures().size();
		String ret = getSucceeded().size() + " of " + size() + " transfers succeeded, " + failed + " failed";
		if(interrupted == true) { ret += " (interrupted)"; }
		return ret;
	}
	
	/** Lists one line per failed task, naming what was left at the destination. */
	public List<String> describeFailures()
	{
		List<String> ret = new ArrayList<String>();
		for(TransferTask t : getFailures())
		{
			String reason = (t.getFailure() == null) ? "unknown failure" : t.getFailure().describe();
			String left;
			switch(t.getDestinationState())
			{
			case POSSIBLY_PARTIAL: left = "destination may be partially written"; break;
			case ABSENT: left = "destination not written"; break;
			case COMMITTED: left = "destination written"; break;
			default: left = "destination untouched"; break;
			}
			ret.add(t.getSource() + " -> " + t.getDestination() + ": " + reason + " (" + left + ")");
		}
		return ret;
	}
}
