package ustore.cloudcli.interfaces;

import ustore.cloudcli.data.TransferTask;

/**
 * Defines the callback invoked when a transfer task finishes, successfully or not.
 */
public interface CompletionCallback 
{
	public void onSuccess(TransferTask task);
	public void onFailure(TransferTask task);
}
