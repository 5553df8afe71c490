package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code tree}: bounded-depth descent rendered with branch connectors, directories before files.
 */
public class TreeCommand extends AbstractCommand 
{
	public static final int UNLIMITED = -1;
	
	private static final String BRANCH = "├── ";
	private static final String LAST_BRANCH = "└── ";
	private static final String PIPE = "│   ";
	private static final String SPACE = "    ";
	
	private static final Comparator<Entry> ORDER = new Comparator<Entry>()
	{
		@Override
		public int compare(Entry a, Entry b) 
		{
			if(a.isDirectory() != b.isDirectory()) { return a.isDirectory() ? -1 : 1; }
			return a.getPath().getName().compareTo(b.getPath().getName());
		}
	};
	
	protected long directories = 0;
	protected long files = 0;
	
	public TreeCommand(ExternalStorageInterface s) { super(s); }
	
	public void tree(VirtualPath root, int depth, boolean dirsOnly, PrintStream out)
	{
		if(depth < UNLIMITED) { throw Errors.invalidArgument("depth must not be negative: " + depth); }
		directories = 0; files = 0;
		
		Entry top = storage.stat(root);
		if(top.isDirectory() == false)
		{
			out.println(top.getPath().toString());
			return;
		}
		
		out.println(top.getPath().isRoot() ? "/" : top.getPath().getKey() + "/");
		walk(top.getPath(), "", 1, depth, dirsOnly, out);
		out.println();
		out.println(directories + (directories == 1 ? " directory" : " directories") 
				+ (dirsOnly ? "" : ", " + files + (files == 1 ? " file" : " files")));
	}
	
	public long getDirectoryCount() { return directories; }
	
	public long getFileCount() { return files; }
	
	private void walk(VirtualPath dir, String indent, int level, int maxDepth, boolean dirsOnly, PrintStream out)
	{
		if(maxDepth != UNLIMITED && level > maxDepth) { return; }
		
		List<Entry> children = new ArrayList<Entry>();
		Iterator<Entry> it = storage.list(dir, false);
		while(it.hasNext() == true)
		{
			Entry e = it.next();
			if(dirsOnly == true && e.isDirectory() == false) { continue; }
			children.add(e);
		}
		Collections.sort(children, ORDER);
		
		for(int i = 0; i < children.size(); i++)
		{
			Entry e = children.get(i);
			boolean last = (i == children.size() - 1);
			out.println(indent + (last ? LAST_BRANCH : BRANCH) + e.getPath().getName() + (e.isDirectory() ? "/" : ""));
			if(e.isDirectory() == true)
			{
				directories++;
				walk(e.getPath(), indent + (last ? SPACE : PIPE), level + 1, maxDepth, dirsOnly, out);
			}
			else { files++; }
		}
	}
}
