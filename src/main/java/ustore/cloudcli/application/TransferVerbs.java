package ustore.cloudcli.application;

import java.nio.file.Paths;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.commands.SizeFormat;
import ustore.cloudcli.commands.TransferCommand;
import ustore.cloudcli.data.TransferReport;
import ustore.cloudcli.data.TransferTask;
import ustore.cloudcli.interfaces.CompletionCallback;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Defines {@code put} and {@code get}.
 */
public class TransferVerbs 
{
	private TransferVerbs() {}
	
	/** Base of the two transfer verbs: one progress line per finished file on stderr unless quiet. */
	abstract static class Transfer extends StorageVerb implements CompletionCallback
	{
		@Option(names = { "-R", "-r", "--recursive" }, description = "Transfer directory trees.")
		boolean recursive;
		
		@Option(names = { "-q", "--quiet" }, description = "Do not print a line per file.")
		boolean quiet;
		
		@Option(names = { "-j", "--jobs" }, paramLabel = "N", description = "Concurrent transfers (default: 8).")
		int jobs = SystemParameters.getInstance().transferConcurrency;
		
		protected TransferCommand command(ExternalStorageInterface storage) { return new TransferCommand(storage, Math.max(1, jobs), this); }
		
		@Override
		public void onSuccess(TransferTask task) 
		{
			if(quiet == false) { synchronized(err()) { err().println(task.getSource() + " -> " + task.getDestination()); } }
		}
		
		@Override
		public void onFailure(TransferTask task) { /* listed with the batch summary */ }
		
		protected int report(TransferReport r)
		{
			if(quiet == false) { err().println(r.summary() + ", " + SizeFormat.human(r.bytesDone())); }
			return 0;
		}
	}
	
	@Command(name = "put", description = "Upload local files.")
	public static class Put extends Transfer
	{
		@Parameters(index = "0", paramLabel = "LOCAL")
		String local;
		
		@Parameters(index = "1", paramLabel = "REMOTE")
		String remote;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			return report(command(storage).put(Paths.get(local), path(remote), recursive));
		}
	}
	
	@Command(name = "get", description = "Download objects.")
	public static class Get extends Transfer
	{
		@Parameters(index = "0", paramLabel = "REMOTE")
		String remote;
		
		@Parameters(index = "1", paramLabel = "LOCAL")
		String local;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			return report(command(storage).get(path(remote), Paths.get(local), recursive));
		}
	}
}
