package ustore.cloudcli.data;

import java.util.concurrent.atomic.AtomicLong;

import ustore.cloudcli.utils.StorageException;

/**
 * Represents one file-level unit of a batch transfer.
 * <p><p>
 * Status and progress are updated by the worker running the task and read by the command that owns the batch.
 */
public class TransferTask 
{
	public enum Direction { UPLOAD, DOWNLOAD, INTRA_COPY, DELETE };
	
	public enum Status { PENDING, RUNNING, DONE, FAILED };
	
	/** What a failed or interrupted task left at its destination. */
	public enum DestinationState { UNTOUCHED, COMMITTED, ABSENT, POSSIBLY_PARTIAL };
	
	protected final String source;
	protected final String destination;
	protected final Direction direction;
	protected final long bytesTotal;
	
	protected final AtomicLong bytesDone = new AtomicLong(0);
	protected volatile Status status = Status.PENDING;
	protected volatile DestinationState destinationState = DestinationState.UNTOUCHED;
	protected volatile StorageException failure = null;
	
	public TransferTask(String src, String dst, Direction dir, long total)
	{
		source = src; destination = dst; direction = dir; bytesTotal = total;
	}
	
	public String getSource() { return source; }
	public String getDestination() { return destination; }
	public Direction getDirection() { return direction; }
	public long getBytesTotal() { return bytesTotal; }
	public long getBytesDone() { return bytesDone.get(); }
	public Status getStatus() { return status; }
	public DestinationState getDestinationState() { return destinationState; }
	public StorageException getFailure() { return failure; }
	
	public void addBytes(long n) { bytesDone.addAndGet(n); }
	
	public void onStart() { status = Status.RUNNING; }
	
	public void onSuccess() { status = Status.DONE; destinationState = DestinationState.COMMITTED; }
	
	public void onFailure(StorageException e, DestinationState state)
	{
		failure = e; destinationState = state; status = Status.FAILED;
	}
	
	@Override
	public String toString() { return direction + " " + source + " -> " + destination + " [" + status + "]"; }
}
