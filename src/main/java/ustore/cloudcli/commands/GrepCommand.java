package ustore.cloudcli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.service.runners.ParallelRunner;
import ustore.cloudcli.threading.Job;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements {@code grep}: line matching over explicit files or, with {@code -R}, every file below a directory.
 * <p><p>
 * Files are searched concurrently; the matches of one file are printed together. Binary or non UTF-8 content
 * is skipped with a warning and a failing file does not stop the others.
 */
public class GrepCommand extends AbstractCommand 
{
	/** Represents the outcome of a search. */
	public static class Result
	{
		protected final AtomicLong matches = new AtomicLong(0);
		protected final AtomicInteger failures = new AtomicInteger(0);
		protected final AtomicInteger skipped = new AtomicInteger(0);
		protected final AtomicInteger searched = new AtomicInteger(0);
		
		public long getMatches() { return matches.get(); }
		public int getFailures() { return failures.get(); }
		public int getSkipped() { return skipped.get(); }
		public int getSearched() { return searched.get(); }
	}
	
	private final int concurrency;
	
	public GrepCommand(ExternalStorageInterface s, int n) { super(s); concurrency = n; }
	
	public GrepCommand(ExternalStorageInterface s) { this(s, SystemParameters.getInstance().transferConcurrency); }
	
	public static Pattern compile(String pattern, boolean ignoreCase)
	{
		try { return Pattern.compile(pattern, ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0); }
		catch(PatternSyntaxException e) { throw Errors.invalidArgument(pattern, "malformed pattern"); }
	}
	
	public Result grep(List<VirtualPath> paths, String pattern, boolean ignoreCase, boolean recursive, boolean lineNumber,
			final PrintStream out, final PrintStream err)
	{
		final Pattern re = compile(pattern, ignoreCase);
		final Result outcome = new Result();
		
		List<Entry> roots = new ArrayList<Entry>();
		boolean withFilename = paths.size() > 1;
		for(VirtualPath p : paths)
		{
			try
			{
				Entry e = storage.stat(p);
				if(e.isDirectory() == true && recursive == false) { throw Errors.invalidArgument(p, "is a directory (use -R)"); }
				if(e.isDirectory() == true) { withFilename = true; }
				roots.add(e);
			}
			catch(StorageException ex)
			{
				outcome.failures.incrementAndGet();
				err.println("error: " + ex.describe());
			}
		}
		
		final boolean prefixName = withFilename;
		final boolean prefixLine = lineNumber;
		try(ParallelRunner runner = new ParallelRunner(concurrency))
		{
			for(Entry root : roots)
			{
				Iterator<Entry> candidates = root.isDirectory() ? storage.list(root.getPath(), true) : Collections.singletonList(root).iterator();
				while(candidates.hasNext() == true)
				{
					final Entry file = candidates.next();
					if(file.isFile() == false) { continue; }
					runner.schedule(new Job<Void>("grep " + file.getPath(), new Callable<Void>()
					{
						@Override
						public Void call() 
						{
							searchOne(file.getPath(), re, prefixName, prefixLine, outcome, out, err);
							return null;
						}
					})
					{
						@Override
						protected void failed(Exception e)
						{
							outcome.failures.incrementAndGet();
							RuntimeException fault = (e instanceof RuntimeException) ? (RuntimeException)e : new IllegalStateException(e);
							err.println("error: " + Errors.translate(fault, file.getPath(), null).describe());
						}
					});
				}
			}
			runner.awaitAll();
		}
		catch(InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw Errors.interrupted("grep");
		}
		return outcome;
	}
	
	protected void searchOne(VirtualPath path, Pattern re, boolean prefixName, boolean prefixLine, Result result, PrintStream out, PrintStream err)
	{
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT).onUnmappableCharacter(CodingErrorAction.REPORT);
		List<String> hits = new ArrayList<String>();
		long matches = 0;
		try(InputStream in = storage.openRead(path, null))
		{
			LineReader reader = new LineReader(in, sysParams.chunkSize);
			byte[] line;
			long lineNo = 0;
			while((line = reader.next()) != null)
			{
				lineNo++;
				int len = LineReader.contentLength(line);
				for(int i = 0; i < len; i++)
				{
					if(line[i] == 0) { skip(path, result, err); return; }
				}
				String text = decoder.decode(ByteBuffer.wrap(line, 0, len)).toString();
				if(re.matcher(text).find() == true)
				{
					matches++;
					hits.add((prefixName ? path.getKey() + ":" : "") + (prefixLine ? lineNo + ":" : "") + text);
				}
			}
		}
		catch(CharacterCodingException e) { skip(path, result, err); return; }
		catch(IOException e) 
		{ 
			result.failures.incrementAndGet();
			err.println("error: " + Errors.translate(e, path, null).describe());
			return;
		}
		catch(StorageException e)
		{
			result.failures.incrementAndGet();
			err.println("error: " + e.describe());
			return;
		}
		
		result.searched.incrementAndGet();
		result.matches.addAndGet(matches);
		synchronized(out)
		{
			for(String h : hits) { out.println(h); }
		}
	}
	
	private void skip(VirtualPath path, Result result, PrintStream err)
	{
		result.skipped.incrementAndGet();
		log.append("[GR] skipping binary or non UTF-8 file " + path, Log.TRACE);
		err.println("warning: skipping binary file " + path);
	}
}
