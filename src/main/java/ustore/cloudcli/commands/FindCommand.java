package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code find}: a lazy filter over a recursive listing.
 * <p><p>
 * A name glob with a separator is matched against the whole key, otherwise against the entry name.
 * A regex is searched anywhere in the whole key. Results are streamed in listing order.
 */
public class FindCommand extends AbstractCommand 
{
	public FindCommand(ExternalStorageInterface s) { super(s); }
	
	public static EntryKind parseType(String type)
	{
		if(type == null) { return null; }
		if(type.equals("f") == true) { return EntryKind.FILE; }
		if(type.equals("d") == true) { return EntryKind.DIRECTORY; }
		if(type.equals("o") == true) { return EntryKind.OTHER; }
		throw Errors.invalidArgument(type, "unknown type (expected f, d or o)");
	}
	
	public Iterator<Entry> find(VirtualPath root, String nameGlob, String regex, EntryKind kind)
	{
		final GlobMatcher glob = (nameGlob == null) ? null : new GlobMatcher(nameGlob);
		final Pattern re;
		try { re = (regex == null) ? null : Pattern.compile(regex); }
		catch(PatternSyntaxException e) { throw Errors.invalidArgument(regex, "malformed regular expression"); }
		final EntryKind type = kind;
		
		return Iterators.filter(storage.list(root, true), new Predicate<Entry>()
		{
			@Override
			public boolean apply(Entry e) 
			{
				String key = e.getPath().getKey();
				if(type != null && e.getKind() != type) { return false; }
				if(glob != null && glob.matches(key) == false) { return false; }
				if(re != null && re.matcher(key).find() == false) { return false; }
				return true;
			}
		});
	}
	
	public long print(VirtualPath root, String nameGlob, String regex, EntryKind kind, PrintStream out)
	{
		long count = 0;
		Iterator<Entry> it = find(root, nameGlob, regex, kind);
		while(it.hasNext() == true) { out.println(it.next().getPath().toString()); count++; }
		return count;
	}
}
