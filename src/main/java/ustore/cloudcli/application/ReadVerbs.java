package ustore.cloudcli.application;

import java.util.List;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.commands.CatCommand;
import ustore.cloudcli.commands.DiffCommand;
import ustore.cloudcli.commands.GrepCommand;
import ustore.cloudcli.commands.HeadCommand;
import ustore.cloudcli.commands.TailCommand;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Defines the verbs that read object content: {@code cat}, {@code head}, {@code tail}, {@code grep} and {@code diff}.
 */
public class ReadVerbs 
{
	private ReadVerbs() {}
	
	@Command(name = "cat", description = "Print an object.")
	public static class Cat extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "PATH")
		String path;
		
		@Option(names = "--size-limit", paramLabel = "MB", description = "Refuse objects larger than this (default: 10).")
		double sizeLimit = 10;
		
		@Option(names = { "-f", "--force" }, description = "Ignore the size limit.")
		boolean force;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new CatCommand(storage).cat(path(path), limit(sizeLimit), force, out());
			return 0;
		}
	}
	
	@Command(name = "head", description = "Print the first lines or bytes of objects.")
	public static class Head extends StorageVerb
	{
		@Parameters(arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-n", "--lines" }, paramLabel = "N", description = "Lines to print (default: 10).")
		long lines = 10;
		
		@Option(names = { "-c", "--bytes" }, paramLabel = "N", description = "Bytes to print instead of lines.")
		long bytes = -1;
		
		@Option(names = { "-q", "--quiet" }, description = "Never print headers.")
		boolean quiet;
		
		@Option(names = { "-v", "--verbose" }, description = "Always print headers.")
		boolean verbose;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			HeadCommand cmd = new HeadCommand(storage);
			List<VirtualPath> targets = paths(paths);
			if(targets.size() == 1 && verbose == false)
			{
				cmd.head(targets.get(0), lines, bytes, out());
				return 0;
			}
			return partial(cmd.headAll(targets, lines, bytes, quiet, verbose, out(), err()));
		}
	}
	
	@Command(name = "tail", description = "Print the last lines or bytes of objects.")
	public static class Tail extends StorageVerb
	{
		@Parameters(arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-n", "--lines" }, paramLabel = "N", description = "Lines to print (default: 10).")
		int lines = 10;
		
		@Option(names = { "-c", "--bytes" }, paramLabel = "N", description = "Bytes to print instead of lines.")
		long bytes = -1;
		
		@Option(names = { "-q", "--quiet" }, description = "Never print headers.")
		boolean quiet;
		
		@Option(names = { "-v", "--verbose" }, description = "Always print headers.")
		boolean verbose;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			TailCommand cmd = new TailCommand(storage);
			List<VirtualPath> targets = paths(paths);
			if(targets.size() == 1 && verbose == false)
			{
				cmd.tail(targets.get(0), lines, bytes, out());
				return 0;
			}
			return partial(cmd.tailAll(targets, lines, bytes, quiet, verbose, out(), err()));
		}
	}
	
	@Command(name = "grep", description = "Print lines matching a regular expression.")
	public static class Grep extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "PATTERN")
		String pattern;
		
		@Parameters(index = "1..*", arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-i", "--ignore-case" }, description = "Match case-insensitively.")
		boolean ignoreCase;
		
		@Option(names = { "-R", "--recursive" }, description = "Search every file below directories.")
		boolean recursive;
		
		@Option(names = { "-n", "--line-number" }, description = "Prefix matches with their line number.")
		boolean lineNumber;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			GrepCommand.Result r = new GrepCommand(storage).grep(paths(paths), pattern, ignoreCase, recursive, lineNumber, out(), err());
			return partial(r.getFailures());
		}
	}
	
	@Command(name = "diff", description = "Compare two objects line by line (unified format).")
	public static class Diff extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "LEFT")
		String left;
		
		@Parameters(index = "1", paramLabel = "RIGHT")
		String right;
		
		@Option(names = { "-U", "--unified" }, paramLabel = "N", description = "Context lines (default: 3).")
		int context = SystemParameters.getInstance().diffContextLines;
		
		@Option(names = { "-w", "--ignore-trailing-space" }, description = "Ignore whitespace at line ends.")
		boolean ignoreSpace;
		
		@Option(names = "--size-limit", paramLabel = "MB", description = "Refuse objects larger than this (default: 10).")
		double sizeLimit = 10;
		
		@Option(names = { "-f", "--force" }, description = "Ignore the size limit.")
		boolean force;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new DiffCommand(storage).print(path(left), path(right), context, ignoreSpace, limit(sizeLimit), force, out());
			return 0;
		}
	}
}
