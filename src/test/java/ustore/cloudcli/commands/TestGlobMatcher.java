package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.EntryKind;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for glob compilation and {@code find}.
 */
public class TestGlobMatcher 
{
	private InMemoryStorage mem;
	private ExternalStorageInterface storage;
	
	@Before
	public void setUp()
	{
		mem = new InMemoryStorage();
		for(String k : new String[] { "a.log", "app/a.log", "app/b.txt", "app/deep/c.log", "app/deep/c.log.gz", "web/x.log", "web/logs/" })
		{
			mem.put(k, k.endsWith("/") ? new byte[0] : k.getBytes(StandardCharsets.UTF_8));
		}
		storage = new StorageAdapter(mem);
		storage.connect();
	}
	
	@Test
	public void testGlobMatchesFullPath()
	{
		GlobMatcher g = new GlobMatcher("*.log");
		assertTrue(g.matches("a.log"));
		assertFalse(g.matches("app/deep/c.log"));
		assertFalse(g.matches("app/a.log"));
		
		GlobMatcher prefix = new GlobMatcher("app*");
		assertTrue(prefix.matches("app"));
		assertFalse(prefix.matches("app/a.log"));
	}
	
	@Test
	public void testFindNameIsTestedAgainstFullPath()
	{
		Set<String> found = new HashSet<String>();
		Iterator<Entry> it = new FindCommand(storage).find(VirtualPath.ROOT, "*.log", null, null);
		while(it.hasNext() == true) { found.add(it.next().getPath().getKey()); }
		assertEquals(1, found.size());
		assertTrue(found.contains("a.log"));
		
		found.clear();
		it = new FindCommand(storage).find(VirtualPath.ROOT, "app*", null, null);
		while(it.hasNext() == true) { found.add(it.next().getPath().getKey()); }
		assertEquals(1, found.size());
		assertTrue(found.contains("app"));
	}
	
	@Test
	public void testPathGlob()
	{
		GlobMatcher g = new GlobMatcher("app/*.log");
		assertTrue(g.matches("app/a.log"));
		assertFalse(g.matches("app/deep/c.log"));
		
		GlobMatcher any = new GlobMatcher("**/*.log");
		assertTrue(any.matches("a.log"));
		assertTrue(any.matches("app/deep/c.log"));
		assertFalse(any.matches("app/deep/c.log.gz"));
	}
	
	@Test
	public void testClassesAndBraces()
	{
		assertTrue(new GlobMatcher("[ab].{log,txt}").matches("b.txt"));
		assertFalse(new GlobMatcher("[!ab].log").matches("a.log"));
		assertTrue(new GlobMatcher("c.l?g").matches("c.log"));
		assertFalse(new GlobMatcher("c.log").matches("cxlog"));
	}
	
	@Test
	public void testMalformedGlobs()
	{
		for(String bad : new String[] { "[abc", "{a,b", "a}", "x\\" })
		{
			try
			{
				new GlobMatcher(bad);
				fail("expected InvalidArgument for " + bad);
			}
			catch(StorageException e) { assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind()); }
		}
	}
	
	@Test
	public void testFindMatchesManualFilter()
	{
		GlobMatcher g = new GlobMatcher("**/*.log");
		Set<VirtualPath> expected = new HashSet<VirtualPath>();
		Iterator<Entry> all = storage.list(VirtualPath.ROOT, true);
		while(all.hasNext() == true)
		{
			Entry e = all.next();
			if(g.matches(e.getPath().getKey()) == true) { expected.add(e.getPath()); }
		}
		
		Set<VirtualPath> found = new HashSet<VirtualPath>();
		Iterator<Entry> it = new FindCommand(storage).find(VirtualPath.ROOT, "**/*.log", null, null);
		while(it.hasNext() == true) { found.add(it.next().getPath()); }
		
		assertEquals(expected, found);
		assertEquals(4, found.size());
		assertTrue(found.contains(VirtualPath.of("app/deep/c.log")));
	}
	
	@Test
	public void testFindByTypeAndRegex()
	{
		Set<String> dirs = new HashSet<String>();
		Iterator<Entry> it = new FindCommand(storage).find(VirtualPath.ROOT, null, null, FindCommand.parseType("d"));
		while(it.hasNext() == true) 
		{ 
			Entry e = it.next();
			assertEquals(EntryKind.DIRECTORY, e.getKind());
			dirs.add(e.getPath().getKey());
		}
		assertTrue(dirs.contains("app/deep"));
		assertTrue(dirs.contains("web/logs"));
		
		Iterator<Entry> both = new FindCommand(storage).find(VirtualPath.ROOT, "app/**/*.log", "^app/", null);
		int n = 0;
		while(both.hasNext() == true) { assertTrue(both.next().getPath().getKey().startsWith("app/")); n++; }
		assertEquals(2, n);
	}
}
