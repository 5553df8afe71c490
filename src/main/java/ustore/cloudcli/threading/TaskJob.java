package ustore.cloudcli.threading;

import java.io.IOException;
import java.util.concurrent.Callable;

import ustore.cloudcli.data.TransferTask;
import ustore.cloudcli.interfaces.CompletionCallback;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;

/**
 * Represents a job working on one {@link TransferTask}.
 * <p><p>
 * A fault the task body did not record itself still fails the task, so no task of a batch stays pending or running.
 */
public class TaskJob extends Job<Void>
{
	protected final TransferTask transfer;
	protected final CompletionCallback callback;

	public TaskJob(String n, TransferTask t, CompletionCallback cb, Callable<Void> body) { super(n, body); transfer = t; callback = cb; }
	public TaskJob(String n, TransferTask t, Callable<Void> body) { this(n, t, null, body); }

	public TransferTask getTransfer() { return transfer; }

	@Override
	protected void failed(Exception e)
	{
		TransferTask.Status status = transfer.getStatus();
		if(status == TransferTask.Status.DONE || status == TransferTask.Status.FAILED) { return; }

		TransferTask.DestinationState left = (status == TransferTask.Status.PENDING)
				? TransferTask.DestinationState.UNTOUCHED : TransferTask.DestinationState.POSSIBLY_PARTIAL;
		transfer.onFailure(toStorageException(e), left);
		if(callback != null) { callback.onFailure(transfer); }
	}

	private StorageException toStorageException(Exception e)
	{
		String subject = transfer.getDestination();
		if(e instanceof RuntimeException) { return Errors.translate((RuntimeException)e, subject, null); }
		if(e instanceof IOException) { return Errors.translate((IOException)e, subject, null); }
		return Errors.provider(subject, "unexpected failure on " + subject + ": " + e, e);
	}
}
