package ustore.cloudcli.threading;

import java.util.concurrent.Callable;

import ustore.cloudcli.utils.Errors;

/**
 * Represents a named unit of work whose outcome (result or failure) is kept for the caller.
 *
 * @param <T>
 */
public class Job<T>
{
	protected String name = null;
	protected Callable<T> task = null;
	protected volatile T result = null;
	protected volatile Exception failure = null;
	protected volatile boolean done = false;
	
	public Job(String n, Callable<T> t) { name = n; task = t; Errors.verify(task != null, "job without task"); }
	public Job(Callable<T> t) { this("unnamed-job", t); }

	public void call() 
	{
		try { result = task.call(); } 
		catch (Exception e) { failure = e; failed(e); }
		finally { done = true; }
	}	
	
	/** Called on the worker thread when the task throws; the failure is also kept for {@link #getFailure()}. */
	protected void failed(Exception e) {}
	
	public String getName() { return name; }
	public T getResult() { return result; }
	public Exception getFailure() { return failure; }
	public boolean isReady() { return done == true; }
	
	public String toString() { return name + ": " + task.toString(); }
}
