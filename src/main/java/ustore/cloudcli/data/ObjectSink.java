package ustore.cloudcli.data;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Represents a pending object write. Bytes become visible only when {@link #close()} commits them;
 * {@link #abort()} discards everything written so far.
 */
public abstract class ObjectSink extends OutputStream 
{
	/** Discards the pending object. Calling it after a successful close has no effect. */
	public abstract void abort();
	
	@Override
	public void write(int b) throws IOException
	{
		write(new byte[] { (byte)b }, 0, 1);
	}
	
	@Override
	public abstract void write(byte[] b, int off, int len) throws IOException;
	
	/** Commits the object. */
	@Override
	public abstract void close() throws IOException;
}
