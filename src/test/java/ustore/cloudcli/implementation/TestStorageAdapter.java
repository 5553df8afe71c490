package ustore.cloudcli.implementation;

import static org.junit.Assert.*;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import ustore.cloudcli.data.ByteRange;
import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.ObjectSink;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;
import ustore.cloudcli.utils.StreamUtils;

/**
 * Implements tests for the storage adapter over an object-store style backend.
 */
public class TestStorageAdapter 
{
	private InMemoryStorage mem;
	private ExternalStorageInterface storage;
	
	@Before
	public void setUp()
	{
		mem = new InMemoryStorage();
		mem.put("a/1.txt", "one".getBytes(StandardCharsets.UTF_8));
		mem.put("a/b/2.txt", "two".getBytes(StandardCharsets.UTF_8));
		mem.put("a/empty/", new byte[0]);
		mem.put("top.txt", "0123456789".getBytes(StandardCharsets.UTF_8));
		storage = new StorageAdapter(mem);
		storage.connect();
	}
	
	private static List<String> names(Iterator<Entry> it)
	{
		List<String> ret = new ArrayList<String>();
		while(it.hasNext() == true) { ret.add(it.next().getPath().toString()); }
		return ret;
	}
	
	private static void expect(ErrorKind kind, Runnable r)
	{
		try
		{
			r.run();
			fail("expected " + kind);
		}
		catch(StorageException e) { assertEquals(kind, e.getKind()); }
	}
	
	@Test
	public void testStatAndListing()
	{
		assertTrue(storage.stat(VirtualPath.of("a")).isDirectory());
		assertEquals(Long.valueOf(3), storage.stat(VirtualPath.of("a/1.txt")).getSize());
		assertFalse(storage.exists(VirtualPath.of("nope")));
		
		assertEquals(java.util.Arrays.asList("a/1.txt", "a/b/", "a/empty/"), names(storage.list(VirtualPath.of("a"), false)));
		assertEquals(java.util.Arrays.asList("a/1.txt", "a/b/", "a/b/2.txt", "a/empty/"), names(storage.list(VirtualPath.of("a"), true)));
		assertEquals(Collections.singletonList("top.txt"), names(storage.list(VirtualPath.of("top.txt"), false)));
	}
	
	@Test
	public void testRangedRead() throws Exception
	{
		try(InputStream in = storage.openRead(VirtualPath.of("top.txt"), ByteRange.of(2, 3)))
		{
			assertEquals("234", new String(StreamUtils.getInstance().readAll(in), StandardCharsets.UTF_8));
		}
		try(InputStream in = storage.openRead(VirtualPath.of("top.txt"), ByteRange.from(8)))
		{
			assertEquals("89", new String(StreamUtils.getInstance().readAll(in), StandardCharsets.UTF_8));
		}
	}
	
	@Test
	public void testRootIsProtected()
	{
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.delete(VirtualPath.ROOT); } });
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.rename(VirtualPath.ROOT, VirtualPath.of("x")); } });
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.openWrite(VirtualPath.ROOT); } });
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.copy(VirtualPath.of("top.txt"), VirtualPath.ROOT); } });
		assertEquals(4, mem.size());
	}
	
	@Test
	public void testFaultsAreTranslated()
	{
		expect(ErrorKind.NOT_FOUND, new Runnable() { public void run() { storage.stat(VirtualPath.of("missing.txt")); } });
		expect(ErrorKind.NOT_FOUND, new Runnable() { public void run() { storage.openRead(VirtualPath.of("missing.txt"), null); } });
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.openAppend(VirtualPath.of("top.txt")); } });
		expect(ErrorKind.ALREADY_EXISTS, new Runnable() { public void run() { storage.createDir(VirtualPath.directory("top.txt"), true); } });
		expect(ErrorKind.NOT_FOUND, new Runnable() { public void run() { storage.createDir(VirtualPath.directory("x/y"), false); } });
	}
	
	@Test
	public void testAbortedWriteLeavesNothing() throws Exception
	{
		ObjectSink sink = storage.openWrite(VirtualPath.of("new.txt"));
		sink.write("partial".getBytes(StandardCharsets.UTF_8), 0, 7);
		sink.abort();
		assertNull(mem.peek("new.txt"));
		
		mem.injectWriteFault("top.txt", 2);
		ObjectSink failing = storage.openWrite(VirtualPath.of("top.txt"));
		try
		{
			failing.write(new byte[10], 0, 10);
			fail("expected ProviderError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.PROVIDER_ERROR, e.getKind()); }
		failing.abort();
		assertEquals("0123456789", new String(mem.peek("top.txt"), StandardCharsets.UTF_8));
	}
	
	@Test
	public void testRenameFileIsEmulated()
	{
		storage.rename(VirtualPath.of("top.txt"), VirtualPath.of("moved/top.txt"));
		assertNull(mem.peek("top.txt"));
		assertEquals("0123456789", new String(mem.peek("moved/top.txt"), StandardCharsets.UTF_8));
	}
	
	@Test
	public void testRenameDirectoryIsEmulated()
	{
		storage.rename(VirtualPath.of("a"), VirtualPath.of("z"));
		assertFalse(storage.exists(VirtualPath.of("a")));
		assertEquals("one", new String(mem.peek("z/1.txt"), StandardCharsets.UTF_8));
		assertEquals("two", new String(mem.peek("z/b/2.txt"), StandardCharsets.UTF_8));
		assertTrue(storage.stat(VirtualPath.of("z/empty")).isDirectory());
		
		expect(ErrorKind.INVALID_ARGUMENT, new Runnable() { public void run() { storage.rename(VirtualPath.of("z"), VirtualPath.of("z/inner")); } });
	}
}
