package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.LocalStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for {@code append}.
 */
public class TestAppendCommand 
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();
	
	private InMemoryStorage mem;
	private ExternalStorageInterface storage;
	
	@Before
	public void setUp()
	{
		mem = new InMemoryStorage();
		storage = new StorageAdapter(mem);
		storage.connect();
	}
	
	private static InputStream text(String s) { return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)); }
	
	private String content(InMemoryStorage m, String key) { return new String(m.peek(key), StandardCharsets.UTF_8); }
	
	@Test
	public void testNoCreateOnMissingTarget()
	{
		try
		{
			new AppendCommand(storage).append(VirtualPath.of("logs/new.txt"), text("hello"), new AppendCommand.Options().noCreate(true));
			fail("expected NotFound");
		}
		catch(StorageException e) { assertEquals(ErrorKind.NOT_FOUND, e.getKind()); }
		assertNull(mem.peek("logs/new.txt"));
	}
	
	@Test
	public void testCreatesMissingTarget()
	{
		long n = new AppendCommand(storage).append(VirtualPath.of("logs/new.txt"), text("hello"), new AppendCommand.Options());
		assertEquals(5, n);
		assertEquals("hello", content(mem, "logs/new.txt"));
	}
	
	@Test
	public void testRewriteAppend()
	{
		mem.put("a.txt", "hello".getBytes(StandardCharsets.UTF_8));
		new AppendCommand(storage).append(VirtualPath.of("a.txt"), text(" world"), new AppendCommand.Options().noCreate(true));
		assertEquals("hello world", content(mem, "a.txt"));
	}
	
	@Test
	public void testNativeAppend()
	{
		InMemoryStorage appendable = new InMemoryStorage(true);
		appendable.put("a.txt", "ab".getBytes(StandardCharsets.UTF_8));
		ExternalStorageInterface s = new StorageAdapter(appendable);
		s.connect();
		new AppendCommand(s).append(VirtualPath.of("a.txt"), text("cd"), new AppendCommand.Options());
		assertEquals("abcd", content(appendable, "a.txt"));
	}
	
	@Test
	public void testPreconditions()
	{
		mem.put("a.txt", "12345".getBytes(StandardCharsets.UTF_8));
		AppendCommand cmd = new AppendCommand(storage);
		try
		{
			cmd.append(VirtualPath.of("a.txt"), text("x"), new AppendCommand.Options().ifSize(4L));
			fail("expected InvalidArgument");
		}
		catch(StorageException e) { assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind()); }
		assertEquals("12345", content(mem, "a.txt"));
		
		String etag = storage.stat(VirtualPath.of("a.txt")).getEtag();
		cmd.append(VirtualPath.of("a.txt"), text("6"), new AppendCommand.Options().ifSize(5L).ifEtag(etag));
		assertEquals("123456", content(mem, "a.txt"));
	}
	
	@Test
	public void testSizeLimit()
	{
		mem.put("big.txt", new byte[100]);
		try
		{
			new AppendCommand(storage).append(VirtualPath.of("big.txt"), text("x"), new AppendCommand.Options().sizeLimit(50));
			fail("expected SizeLimitExceeded");
		}
		catch(StorageException e) { assertEquals(ErrorKind.SIZE_LIMIT_EXCEEDED, e.getKind()); }
		assertEquals(100, mem.peek("big.txt").length);
		
		new AppendCommand(storage).append(VirtualPath.of("big.txt"), text("x"), new AppendCommand.Options().sizeLimit(50).force(true));
		assertEquals(101, mem.peek("big.txt").length);
	}
	
	@Test
	public void testDirectoryTargetRejected()
	{
		mem.put("dir/file", new byte[1]);
		try
		{
			new AppendCommand(storage).append(VirtualPath.of("dir"), text("x"), new AppendCommand.Options());
			fail("expected InvalidArgument");
		}
		catch(StorageException e) { assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind()); }
	}
	
	@Test
	public void testParentsOnLocalStorage() throws Exception
	{
		Path root = folder.newFolder("root").toPath();
		ExternalStorageInterface local = new StorageAdapter(new LocalStorage(root));
		local.connect();
		new AppendCommand(local).append(VirtualPath.of("x/y/z.txt"), text("data"), new AppendCommand.Options().parents(true));
		assertEquals("data", new String(Files.readAllBytes(root.resolve("x/y/z.txt")), StandardCharsets.UTF_8));
		
		new AppendCommand(local).append(VirtualPath.of("x/y/z.txt"), text("+more"), new AppendCommand.Options());
		assertEquals("data+more", new String(Files.readAllBytes(root.resolve("x/y/z.txt")), StandardCharsets.UTF_8));
	}
}
