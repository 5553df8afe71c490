package ustore.cloudcli.application;

import java.io.PrintStream;

import picocli.CommandLine;
import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.PartialFailureException;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements the mapping from failures to {@code error: Kind: message} lines and process exit codes.
 */
public class ExitCodeHandler implements CommandLine.IExecutionExceptionHandler
{
	public static final int PARTIAL_FAILURE = 8;
	
	private Log log = Log.getInstance();
	
	private final PrintStream err;
	
	public ExitCodeHandler(PrintStream e) { err = e; }
	
	@Override
	public int handleExecutionException(Exception ex, CommandLine cl, CommandLine.ParseResult parseResult) 
	{
		if(ex instanceof PartialFailureException)
		{
			PartialFailureException pf = (PartialFailureException)ex;
			for(String line : pf.getReport().describeFailures()) { err.println("failed: " + line); }
			err.println("error: " + pf.getReport().summary());
			return PARTIAL_FAILURE;
		}
		if(ex instanceof StorageException)
		{
			StorageException se = (StorageException)ex;
			log.append("[CL] " + cl.getCommandName() + " failed", se);
			err.println("error: " + se.describe());
			return se.getKind().getExitCode();
		}
		
		log.append("[CL] unexpected failure in " + cl.getCommandName(), ex);
		err.println("error: " + ErrorKind.PROVIDER_ERROR.getLabel() + ": " + ex);
		return ErrorKind.PROVIDER_ERROR.getExitCode();
	}
}
