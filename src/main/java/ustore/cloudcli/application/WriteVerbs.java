package ustore.cloudcli.application;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ustore.cloudcli.commands.AppendCommand;
import ustore.cloudcli.commands.CopyCommand;
import ustore.cloudcli.commands.DeleteCommand;
import ustore.cloudcli.commands.MkdirCommand;
import ustore.cloudcli.commands.MoveCommand;
import ustore.cloudcli.commands.TouchCommand;
import ustore.cloudcli.commands.TruncateCommand;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Defines the verbs that change the backend.
 */
public class WriteVerbs 
{
	private WriteVerbs() {}
	
	@Command(name = "append", description = "Append a local file or standard input to an object.")
	public static class Append extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "PATH")
		String target;
		
		@Parameters(index = "1", arity = "0..1", paramLabel = "SOURCE", description = "Local file (default: standard input).")
		String source;
		
		@Option(names = { "-c", "--no-create" }, description = "Fail when the object does not exist.")
		boolean noCreate;
		
		@Option(names = { "-p", "--parents" }, description = "Create missing parent directories.")
		boolean parents;
		
		@Option(names = "--size-limit", paramLabel = "MB", description = "Largest object that is rewritten in memory (default: 10).")
		double sizeLimit = 10;
		
		@Option(names = { "-f", "--force" }, description = "Ignore the size limit.")
		boolean force;
		
		@Option(names = "--if-size", paramLabel = "BYTES", description = "Only append when the object has this size.")
		Long ifSize;
		
		@Option(names = "--if-etag", paramLabel = "ETAG", description = "Only append when the object has this etag.")
		String ifEtag;
		
		@Override
		protected int run(ExternalStorageInterface storage) throws Exception
		{
			AppendCommand.Options opts = new AppendCommand.Options().noCreate(noCreate).parents(parents).force(force)
					.sizeLimit(limit(sizeLimit)).ifSize(ifSize).ifEtag(ifEtag);
			if(source == null) 
			{ 
				new AppendCommand(storage).append(path(target), root.getIn(), opts);
				return 0;
			}
			if(Files.isRegularFile(Paths.get(source)) == false) { throw Errors.notFound(source); }
			try(InputStream in = Files.newInputStream(Paths.get(source)))
			{
				new AppendCommand(storage).append(path(target), in, opts);
			}
			return 0;
		}
	}
	
	@Command(name = "touch", description = "Create empty objects.")
	public static class Touch extends StorageVerb
	{
		@Parameters(arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-t", "--truncate" }, description = "Empty existing objects.")
		boolean truncate;
		
		@Option(names = { "-c", "--no-create" }, description = "Never create objects.")
		boolean noCreate;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			TouchCommand cmd = new TouchCommand(storage);
			for(String p : paths) { cmd.touch(path(p), truncate, noCreate); }
			return 0;
		}
	}
	
	@Command(name = "truncate", description = "Shrink or zero-extend an object to a size.")
	public static class Truncate extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "PATH")
		String path;
		
		@Option(names = { "-s", "--size" }, required = true, paramLabel = "BYTES", description = "New size.")
		long size;
		
		@Option(names = { "-c", "--no-create" }, description = "Do nothing when the object does not exist.")
		boolean noCreate;
		
		@Option(names = { "-p", "--parents" }, description = "Create missing parent directories.")
		boolean parents;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new TruncateCommand(storage).truncate(path(path), size, noCreate, parents);
			return 0;
		}
	}
	
	@Command(name = "mkdir", description = "Create directories.")
	public static class Mkdir extends StorageVerb
	{
		@Parameters(arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-p", "--parents" }, description = "Create missing parents.")
		boolean parents;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new MkdirCommand(storage).mkdir(paths(paths), parents);
			return 0;
		}
	}
	
	@Command(name = "rm", description = "Delete objects or directory trees.")
	public static class Rm extends StorageVerb
	{
		@Parameters(arity = "1..*", paramLabel = "PATH")
		List<String> paths;
		
		@Option(names = { "-R", "-r", "--recursive" }, description = "Delete directories with their content.")
		boolean recursive;
		
		@Option(names = { "-f", "--force" }, description = "Do not ask for confirmation.")
		boolean force;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new DeleteCommand(storage).delete(paths(paths), recursive, force, root.getConfirmation());
			return 0;
		}
	}
	
	@Command(name = "cp", description = "Copy within the backend.")
	public static class Cp extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "SRC")
		String src;
		
		@Parameters(index = "1", paramLabel = "DST")
		String dst;
		
		@Option(names = { "-R", "-r", "--recursive" }, description = "Copy directory trees.")
		boolean recursive;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new CopyCommand(storage).copy(path(src), path(dst), recursive);
			return 0;
		}
	}
	
	@Command(name = "mv", description = "Move or rename within the backend.")
	public static class Mv extends StorageVerb
	{
		@Parameters(index = "0", paramLabel = "SRC")
		String src;
		
		@Parameters(index = "1", paramLabel = "DST")
		String dst;
		
		@Override
		protected int run(ExternalStorageInterface storage) 
		{
			new MoveCommand(storage).move(path(src), path(dst));
			return 0;
		}
	}
}
