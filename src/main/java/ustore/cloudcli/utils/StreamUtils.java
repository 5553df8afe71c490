package ustore.cloudcli.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.data.ObjectSink;

/**
 * Implements stream helpers shared by the commands.
 */
public class StreamUtils 
{
	/** Receives the number of bytes moved by each chunk. */
	public interface ProgressListener { public void onBytes(long n); }
	
	private static final StreamUtils instance = new StreamUtils();
	
	private final SystemParameters sysParams = SystemParameters.getInstance();
	
	private StreamUtils() {}
	
	public static StreamUtils getInstance() { return instance; }
	
	public long copy(InputStream in, OutputStream out, ProgressListener listener) throws IOException
	{
		byte[] buf = new byte[sysParams.chunkSize];
		long total = 0;
		int n;
		while((n = in.read(buf)) > 0)
		{
			if(Thread.currentThread().isInterrupted() == true) { throw new java.io.InterruptedIOException("copy interrupted"); }
			out.write(buf, 0, n);
			total += n;
			if(listener != null) { listener.onBytes(n); }
		}
		return total;
	}
	
	public long copy(InputStream in, OutputStream out) throws IOException { return copy(in, out, null); }
	
	/** Reads at most {@code limit} bytes; returns null when the stream holds more. */
	public byte[] readAtMost(InputStream in, long limit) throws IOException
	{
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		byte[] buf = new byte[sysParams.chunkSize];
		int n;
		while((n = in.read(buf)) > 0)
		{
			bos.write(buf, 0, n);
			if(bos.size() > limit) { return null; }
		}
		return bos.toByteArray();
	}
	
	public byte[] readAll(InputStream in) throws IOException { return readAtMost(in, Long.MAX_VALUE); }
	
	/** Writes {@code data} to a sink and commits it, discarding the pending object on failure. */
	public void writeAndCommit(ObjectSink sink, byte[] data)
	{
		boolean committed = false;
		try
		{
			sink.write(data, 0, data.length);
			sink.close();
			committed = true;
		}
		catch(IOException e) { throw Errors.provider(null, "write failed: " + e.getMessage(), e); }
		finally { if(committed == false) { sink.abort(); } }
	}
	
	/** Copies a stream into a sink and commits it, discarding the pending object on failure. */
	public long copyAndCommit(InputStream in, ObjectSink sink, ProgressListener listener) throws IOException
	{
		boolean committed = false;
		try
		{
			long ret = copy(in, sink, listener);
			sink.close();
			committed = true;
			return ret;
		}
		finally { if(committed == false) { sink.abort(); } }
	}
}
