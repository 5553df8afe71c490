package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for {@code ls}, {@code tree} and {@code stat}.
 */
public class TestBrowseCommands 
{
	private InMemoryStorage mem;
	private ExternalStorageInterface storage;
	private ByteArrayOutputStream bytes;
	private PrintStream out;
	
	@Before
	public void setUp() throws Exception
	{
		mem = new InMemoryStorage();
		mem.put("dir/a.txt", "aaaa".getBytes(StandardCharsets.UTF_8));
		mem.put("dir/sub/c.txt", "c".getBytes(StandardCharsets.UTF_8));
		mem.put("z.txt", "zzz".getBytes(StandardCharsets.UTF_8));
		mem.put("empty/", new byte[0]);
		storage = new StorageAdapter(mem);
		storage.connect();
		bytes = new ByteArrayOutputStream();
		out = new PrintStream(bytes, true, "UTF-8");
	}
	
	private String output() { return new String(bytes.toByteArray(), StandardCharsets.UTF_8); }
	
	@Test
	public void testList()
	{
		assertEquals(3, new ListCommand(storage).print(VirtualPath.ROOT, false, false, out));
		assertEquals("dir/\nempty/\nz.txt\n", output());
	}
	
	@Test
	public void testEmptyDirectoryListsNothing()
	{
		assertEquals(0, new ListCommand(storage).print(VirtualPath.of("empty"), true, false, out));
		assertEquals("", output());
	}
	
	@Test
	public void testTree()
	{
		TreeCommand tree = new TreeCommand(storage);
		tree.tree(VirtualPath.ROOT, TreeCommand.UNLIMITED, false, out);
		assertEquals("/\n"
				+ "├── dir/\n"
				+ "│   ├── sub/\n"
				+ "│   │   └── c.txt\n"
				+ "│   └── a.txt\n"
				+ "├── empty/\n"
				+ "└── z.txt\n"
				+ "\n"
				+ "3 directories, 3 files\n", output());
		assertEquals(3, tree.getFileCount());
	}
	
	@Test
	public void testTreeDepthAndDirsOnly()
	{
		new TreeCommand(storage).tree(VirtualPath.of("dir"), 1, true, out);
		assertEquals("dir/\n└── sub/\n\n1 directory\n", output());
		
		bytes.reset();
		new TreeCommand(storage).tree(VirtualPath.ROOT, 0, false, out);
		assertEquals("/\n\n0 directories, 0 files\n", output());
		
		try
		{
			new TreeCommand(storage).tree(VirtualPath.ROOT, -2, false, out);
			fail("expected InvalidArgument");
		}
		catch(StorageException e) { assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind()); }
	}
	
	@Test
	public void testStatFormats() throws Exception
	{
		StatCommand stat = new StatCommand(storage);
		stat.render(stat.stat(VirtualPath.of("z.txt")), StatCommand.Format.RAW, out);
		String raw = output();
		assertTrue(raw.startsWith("path=z.txt\ntype=file\nsize=3\n"));
		assertTrue(raw.contains("backend=memory\n"));
		
		bytes.reset();
		stat.render(stat.stat(VirtualPath.of("dir")), StatCommand.Format.JSON, out);
		JsonNode node = new ObjectMapper().readTree(output());
		assertEquals("dir/", node.get("path").asText());
		assertEquals("directory", node.get("type").asText());
		assertFalse(node.has("size"));
	}
}
