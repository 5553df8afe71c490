package ustore.cloudcli.data;

import ustore.cloudcli.utils.Errors;

/**
 * Represents a byte range of an object: an offset and an optional length (to the end when absent).
 */
public final class ByteRange 
{
	public static final long TO_END = -1;
	
	private final long offset;
	private final long length;
	
	private ByteRange(long off, long len) { offset = off; length = len; }
	
	public static ByteRange from(long offset) { return of(offset, TO_END); }
	
	public static ByteRange of(long offset, long length)
	{
		if(offset < 0 || (length < 0 && length != TO_END)) { throw Errors.invalidArgument("invalid byte range " + offset + "+" + length); }
		return new ByteRange(offset, length);
	}
	
	public long getOffset() { return offset; }
	
	public long getLength() { return length; }
	
	public boolean isOpenEnded() { return length == TO_END; }
	
	/** Inclusive index of the last byte, or -1 when open ended. */
	public long getLastIndex() { return isOpenEnded() ? -1 : offset + length - 1; }
	
	@Override
	public String toString() { return "bytes=" + offset + "-" + (isOpenEnded() ? "" : String.valueOf(getLastIndex())); }
}
