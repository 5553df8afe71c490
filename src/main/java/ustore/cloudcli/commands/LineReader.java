package ustore.cloudcli.commands;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Implements forward line splitting over a byte stream; each line keeps its terminator.
 */
class LineReader 
{
	private final InputStream in;
	private final byte[] buf;
	private int pos = 0;
	private int limit = 0;
	private boolean eof = false;
	
	LineReader(InputStream is, int chunkSize) { in = is; buf = new byte[chunkSize]; }
	
	/** Returns the next line including its {@code \n} (absent on a final unterminated line), or null at the end. */
	byte[] next() throws IOException
	{
		ByteArrayOutputStream line = null;
		while(true)
		{
			if(pos >= limit)
			{
				if(eof == true) { break; }
				limit = in.read(buf);
				pos = 0;
				if(limit <= 0) { eof = true; limit = 0; break; }
			}
			int start = pos;
			while(pos < limit && buf[pos] != '\n') { pos++; }
			boolean found = pos < limit;
			if(found == true) { pos++; }
			if(line == null) { line = new ByteArrayOutputStream(Math.max(64, pos - start)); }
			line.write(buf, start, pos - start);
			if(found == true) { return line.toByteArray(); }
		}
		return (line == null || line.size() == 0) ? null : line.toByteArray();
	}
	
	/** Strips a trailing {@code \n} and {@code \r}. */
	static int contentLength(byte[] line)
	{
		int n = line.length;
		if(n > 0 && line[n - 1] == '\n') { n--; }
		if(n > 0 && line[n - 1] == '\r') { n--; }
		return n;
	}
}
