package ustore.cloudcli.application;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine.ParentCommand;
import ustore.cloudcli.commands.SizeFormat;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Represents a verb that runs against the configured storage backend.
 */
public abstract class StorageVerb implements Callable<Integer>
{
	@ParentCommand
	protected CloudCli root;
	
	@Override
	public Integer call() throws Exception 
	{ 
		int ret = run(root.storage());
		root.getOut().flush();
		return ret;
	}
	
	/** Runs the verb and returns the exit code. */
	protected abstract int run(ExternalStorageInterface storage) throws Exception;
	
	protected PrintStream out() { return root.getOut(); }
	
	protected PrintStream err() { return root.getErr(); }
	
	protected static VirtualPath path(String raw) { return VirtualPath.of(raw); }
	
	protected static List<VirtualPath> paths(List<String> raw)
	{
		List<VirtualPath> ret = new ArrayList<VirtualPath>();
		for(String r : raw) { ret.add(VirtualPath.of(r)); }
		return ret;
	}
	
	protected static long limit(double megabytes) { return SizeFormat.megabytes(megabytes); }
	
	/** Exit code of a multi-path verb that reported its own per-path failures. */
	protected static int partial(int failures) { return (failures == 0) ? 0 : ExitCodeHandler.PARTIAL_FAILURE; }
}
