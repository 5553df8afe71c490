package ustore.cloudcli.application;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ustore.cloudcli.commands.DiskUsageCommand;
import ustore.cloudcli.commands.FindCommand;
import ustore.cloudcli.commands.ListCommand;
import ustore.cloudcli.commands.StatCommand;
import ustore.cloudcli.commands.TreeCommand;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Defines the verbs that inspect the namespace: {@code ls}, {@code tree}, {@code find}, {@code du} and {@code stat}.
 */
public class BrowseVerbs 
{
	private BrowseVerbs() {}
	
	@Command(name = "ls", description = "List a directory.")
	public static class Ls extends StorageVerb
	{
		@Parameters(index = "0", arity = "0..1", defaultValue = "/", paramLabel = "PATH")
		String path;
		
		@Option(names = { "-R", "--recursive" }, description = "List the whole subtree.")
		boolean recursive;
		
		@Option(names = { "-l", "--long" }, description = "Print size and modification time.")
		boolean detailed;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new ListCommand(storage).print(path(path), recursive, detailed, out());
			return 0;
		}
	}
	
	@Command(name = "tree", description = "Print a directory tree.")
	public static class Tree extends StorageVerb
	{
		@Parameters(index = "0", arity = "0..1", defaultValue = "/", paramLabel = "PATH")
		String path;
		
		@Option(names = { "-L", "--depth" }, paramLabel = "N", description = "Maximum depth; 0 prints the root only.")
		int depth = TreeCommand.UNLIMITED;
		
		@Option(names = { "-d", "--dirs-only" }, description = "Leave files out.")
		boolean dirsOnly;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new TreeCommand(storage).tree(path(path), depth, dirsOnly, out());
			return 0;
		}
	}
	
	@Command(name = "find", description = "Find entries by name glob, regular expression or type.")
	public static class Find extends StorageVerb
	{
		@Parameters(index = "0", arity = "0..1", defaultValue = "/", paramLabel = "PATH")
		String path;
		
		@Option(names = "--name", paramLabel = "GLOB", description = "Glob; '**' spans directories, '*' stays within one.")
		String name;
		
		@Option(names = "--regex", paramLabel = "REGEX", description = "Regular expression searched in the full path.")
		String regex;
		
		@Option(names = "--type", paramLabel = "f|d|o", description = "Entry type: file, directory or other.")
		String type;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new FindCommand(storage).print(path(path), name, regex, FindCommand.parseType(type), out());
			return 0;
		}
	}
	
	@Command(name = "du", description = "Summarize space used below a path.")
	public static class Du extends StorageVerb
	{
		@Parameters(index = "0", arity = "0..1", defaultValue = "/", paramLabel = "PATH")
		String path;
		
		@Option(names = { "-s", "--summarize" }, description = "Print the total only.")
		boolean summarize;
		
		@Option(names = { "-h", "--human-readable" }, description = "Print sizes as 1.5K, 3.0M, ...")
		boolean human;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new DiskUsageCommand(storage).print(path(path), summarize, human, out());
			return 0;
		}
	}
	
	@Command(name = "stat", description = "Show the metadata of one entry.")
	public static class Stat extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "PATH")
		String path;
		
		@Option(names = "--json", description = "Print a JSON object.")
		boolean json;
		
		@Option(names = "--raw", description = "Print key=value lines.")
		boolean raw;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			StatCommand cmd = new StatCommand(storage);
			StatCommand.Format f = json ? StatCommand.Format.JSON : (raw ? StatCommand.Format.RAW : StatCommand.Format.HUMAN);
			cmd.render(cmd.stat(path(path)), f, out());
			return 0;
		}
	}
}
