package ustore.cloudcli.application;

import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.ConfigResolver;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.config.Environment;
import ustore.cloudcli.config.ProfileStore;
import ustore.cloudcli.config.SystemEnvironment;
import ustore.cloudcli.construction.StorageFactory;
import ustore.cloudcli.crypto.KeySource;
import ustore.cloudcli.crypto.MachineKeySource;
import ustore.cloudcli.crypto.PassphraseKeySource;
import ustore.cloudcli.interfaces.Confirmation;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements the command line entry point.
 * <p><p>
 * One instance serves one invocation: the profile store and the storage connection are opened on first use
 * and the connection is closed when the command returns.
 */
@Command(name = "cloudcli", mixinStandardHelpOptions = true, version = "cloudcli 0.3.0",
	description = "One set of file commands for OSS, S3, MinIO, COS, HDFS, Azure Blob and the local file system.",
	subcommands = {
		CommandLine.HelpCommand.class,
		BrowseVerbs.Ls.class, BrowseVerbs.Tree.class, BrowseVerbs.Find.class, BrowseVerbs.Du.class, BrowseVerbs.Stat.class,
		ReadVerbs.Cat.class, ReadVerbs.Head.class, ReadVerbs.Tail.class, ReadVerbs.Grep.class, ReadVerbs.Diff.class,
		WriteVerbs.Append.class, WriteVerbs.Touch.class, WriteVerbs.Truncate.class, WriteVerbs.Mkdir.class,
		WriteVerbs.Rm.class, WriteVerbs.Cp.class, WriteVerbs.Mv.class,
		TransferVerbs.Put.class, TransferVerbs.Get.class,
		ConfigCommand.class
	})
public class CloudCli implements Callable<Integer>
{
	@Option(names = "--profile", paramLabel = "NAME", description = "Profile to use instead of the default one.")
	protected String profile;
	
	@Option(names = "--profile-store", paramLabel = "FILE", description = "Profile store file (default: $STORAGE_PROFILE_PATH or ~/.config/cloudcli/profiles.bin).")
	protected String profileStore;
	
	@Option(names = "--master-password", paramLabel = "PASSWORD", description = "Passphrase protecting the profile store (default: $STORAGE_MASTER_PASSWORD, else a machine-bound key).")
	protected String masterPassword;
	
	@Option(names = "--verbose", description = "Log backend operations to stderr.")
	protected boolean verbose;
	
	private Log log = Log.getInstance();
	private SystemParameters sysParams = SystemParameters.getInstance();
	
	protected final Environment env;
	protected final PrintStream out;
	protected final PrintStream err;
	protected final InputStream in;
	protected Confirmation confirmation;
	
	private ProfileStore store = null;
	private ExternalStorageInterface storage = null;
	private volatile boolean running = false;
	
	public CloudCli() { this(new SystemEnvironment(), System.out, System.err, System.in); }
	
	public CloudCli(Environment e, PrintStream o, PrintStream er, InputStream i)
	{
		env = e; out = o; err = er; in = i;
		confirmation = new ConsoleConfirmation(i, er);
	}
	
	public CloudCli setConfirmation(Confirmation c) { confirmation = c; return this; }
	
	public Environment getEnvironment() { return env; }
	public PrintStream getOut() { return out; }
	public PrintStream getErr() { return err; }
	public InputStream getIn() { return in; }
	public Confirmation getConfirmation() { return confirmation; }
	public String getProfile() { return profile; }
	
	protected Instant now() { return Instant.now(); }
	
	@Override
	public Integer call() 
	{
		CommandLine.usage(this, out);
		return 0;
	}
	
	/** Opens the profile store on first use. */
	public synchronized ProfileStore store()
	{
		if(store == null)
		{
			Path file = sysParams.profileStorePath(profileStore, env.get(SystemParameters.PROFILE_PATH_ENV));
			store = ProfileStore.open(file, keySource());
		}
		return store;
	}
	
	protected KeySource keySource()
	{
		String pass = (masterPassword != null) ? masterPassword : env.get(SystemParameters.MASTER_PASSWORD_ENV);
		if(pass != null) { return new PassphraseKeySource(pass.toCharArray()); }
		return new MachineKeySource();
	}
	
	public EffectiveConfig resolve() { return new ConfigResolver(store(), env).resolve(profile, now()); }
	
	/** Connects to the configured backend on first use. */
	public synchronized ExternalStorageInterface storage()
	{
		if(storage == null) { storage = StorageFactory.getInstance().createStorage(resolve()); }
		return storage;
	}
	
	/** Runs one command line and returns its exit code. */
	public int execute(String... args)
	{
		CommandLine cl = new CommandLine(this);
		cl.setOut(new PrintWriter(out, true));
		cl.setErr(new PrintWriter(err, true));
		cl.setExecutionExceptionHandler(new ExitCodeHandler(err));
		cl.setExecutionStrategy(new CommandLine.IExecutionStrategy()
		{
			@Override
			public int execute(CommandLine.ParseResult parseResult) 
			{
				if(verbose == true) { log.setVerbose(true); }
				return new CommandLine.RunLast().execute(parseResult);
			}
		});
		
		running = true;
		try { return cl.execute(args); }
		finally 
		{ 
			running = false;
			release();
		}
	}
	
	protected synchronized void release()
	{
		if(storage != null) 
		{ 
			storage.close();
			storage = null;
		}
	}
	
	/** Reports an interrupt that arrives while a command is still running. */
	protected void onShutdown()
	{
		if(running == false) { return; }
		ExternalStorageInterface s;
		synchronized(this) { s = storage; }
		err.println("error: Interrupted: cancelled by user");
		if(s != null && s.getCapabilities() != null && s.getCapabilities().hasAtomicCommit() == false)
		{
			err.println("warning: objects being written on " + s.getName() + " may be left partially written");
		}
		err.flush();
	}
	
	public static void main(String[] args) 
	{
		final CloudCli cli = new CloudCli();
		Runtime.getRuntime().addShutdownHook(new Thread("cloudcli-interrupt")
		{
			@Override
			public void run() { cli.onShutdown(); }
		});
		System.exit(cli.execute(args));
	}
}
