package ustore.cloudcli.utils;

import java.util.List;

import ustore.cloudcli.data.TransferReport;
import ustore.cloudcli.data.TransferTask;

/**
 * Represents a batch that completed with at least one failed item.
 */
public class PartialFailureException extends StorageException 
{
	private static final long serialVersionUID = 1L;
	
	private final transient TransferReport report;
	
	public PartialFailureException(TransferReport r)
	{
		super(commonKind(r.getFailures()), null, r.summary());
		report = r;
	}
	
	public TransferReport getReport() { return report; }
	
	private static ErrorKind commonKind(List<TransferTask> failures)
	{
		ErrorKind ret = null;
		for(TransferTask t : failures)
		{
			ErrorKind k = (t.getFailure() == null) ? ErrorKind.PROVIDER_ERROR : t.getFailure().getKind();
			if(ret == null) { ret = k; }
			else if(ret != k) { return ErrorKind.PROVIDER_ERROR; }
		}
		return (ret == null) ? ErrorKind.PROVIDER_ERROR : ret;
	}
}
