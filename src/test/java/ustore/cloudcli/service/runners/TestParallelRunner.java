package ustore.cloudcli.service.runners;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import ustore.cloudcli.threading.Job;

/**
 * Implements tests for the bounded parallel runner.
 */
public class TestParallelRunner 
{
	@Test
	public void testBoundIsRespected() throws Exception
	{
		final AtomicInteger running = new AtomicInteger(0);
		final AtomicInteger peak = new AtomicInteger(0);
		final AtomicInteger finished = new AtomicInteger(0);
		
		try(ParallelRunner runner = new ParallelRunner(3))
		{
			for(int i = 0; i < 20; i++)
			{
				runner.schedule(new Job<Void>("job-" + i, new Callable<Void>()
				{
					@Override
					public Void call() throws Exception 
					{
						int now = running.incrementAndGet();
						synchronized(peak) { if(now > peak.get()) { peak.set(now); } }
						Thread.sleep(5);
						running.decrementAndGet();
						finished.incrementAndGet();
						return null;
					}
				}));
			}
			runner.awaitAll();
		}
		assertEquals(20, finished.get());
		assertTrue("peak was " + peak.get(), peak.get() <= 3);
	}
	
	@Test
	public void testFailureDoesNotStopSiblings() throws Exception
	{
		List<Job<Integer>> jobs = new ArrayList<Job<Integer>>();
		try(ParallelRunner runner = new ParallelRunner(2))
		{
			for(int i = 0; i < 6; i++)
			{
				final int n = i;
				Job<Integer> job = new Job<Integer>("job-" + i, new Callable<Integer>()
				{
					@Override
					public Integer call() 
					{
						if(n == 2) { throw new IllegalStateException("boom"); }
						return n * n;
					}
				});
				jobs.add(job);
				runner.schedule(job);
			}
			runner.awaitAll();
			assertEquals(1, runner.getFailedJobs());
		}
		
		for(int i = 0; i < jobs.size(); i++)
		{
			Job<Integer> job = jobs.get(i);
			assertTrue(job.isReady());
			if(i == 2) 
			{ 
				assertNull(job.getResult());
				assertTrue(job.getFailure() instanceof IllegalStateException);
			}
			else 
			{ 
				assertNull(job.getFailure());
				assertEquals(Integer.valueOf(i * i), job.getResult());
			}
		}
	}
	
	@Test(expected = IllegalStateException.class)
	public void testConcurrencyMustBePositive()
	{
		new ParallelRunner(0).close();
	}
}
