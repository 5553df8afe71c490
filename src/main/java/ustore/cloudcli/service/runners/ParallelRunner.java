package ustore.cloudcli.service.runners;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.threading.Job;
import ustore.cloudcli.utils.Errors;

/**
 * Runs jobs in parallel with a bounded number in flight.
 * <p><p>
 * {@link #schedule(Job)} blocks while the bound is reached, so a caller producing jobs from a lazy listing never
 * holds more than the bound in memory. Jobs record their own failures; the runner never aborts siblings.
 */
public class ParallelRunner implements Closeable
{
	protected Log log = Log.getInstance();
	
	protected final int concurrency;
	protected final ExecutorService executor;
	protected final Semaphore permits;
	protected final List<Future<?>> inFlight = new ArrayList<Future<?>>();
	protected final AtomicInteger failedJobs = new AtomicInteger(0);
	
	public ParallelRunner(int n)
	{
		Errors.verify(n > 0, "concurrency must be positive");
		concurrency = n;
		permits = new Semaphore(n);
		final AtomicInteger counter = new AtomicInteger(0);
		executor = Executors.newFixedThreadPool(n, new ThreadFactory()
		{
			@Override
			public Thread newThread(Runnable r) 
			{
				Thread t = new Thread(r, "cloudcli-worker-" + counter.incrementAndGet());
				t.setDaemon(true);
				return t;
			}
		});
	}
	
	public int getConcurrency() { return concurrency; }
	
	/** Number of jobs whose task threw. */
	public int getFailedJobs() { return failedJobs.get(); }
	
	/** Waits for a free slot and starts the job. */
	public synchronized void schedule(final Job<?> job) throws InterruptedException
	{
		permits.acquire();
		try
		{
			inFlight.add(executor.submit(new Runnable()
			{
				@Override
				public void run() 
				{
					try 
					{ 
						job.call(); 
						if(job.getFailure() != null)
						{
							failedJobs.incrementAndGet();
							log.append("[PR] job " + job.getName() + " failed: " + job.getFailure(), Log.WARNING);
						}
					}
					finally { permits.release(); }
				}
			}));
		}
		catch(RuntimeException e)
		{
			permits.release();
			throw e;
		}
		pruneDone();
	}
	
	private void pruneDone()
	{
		for(int i = inFlight.size() - 1; i >= 0; i--) { if(inFlight.get(i).isDone() == true) { inFlight.remove(i); } }
	}
	
	/** Blocks until every scheduled job has finished. */
	public synchronized void awaitAll() throws InterruptedException
	{
		for(Future<?> f : inFlight)
		{
			try { f.get(); }
			catch(ExecutionException e) { log.append("[PR] worker died with " + e.getCause(), Log.ERROR); }
		}
		inFlight.clear();
	}
	
	/** Interrupts every job still running and waits briefly for the workers to stop. */
	@Override
	public void close() 
	{ 
		executor.shutdownNow();
		try
		{
			if(executor.awaitTermination(5, TimeUnit.SECONDS) == false) { log.append("[PR] workers did not stop in time", Log.WARNING); }
		}
		catch(InterruptedException e) { Thread.currentThread().interrupt(); }
	}
}
