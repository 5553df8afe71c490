package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for {@code grep}.
 */
public class TestGrepCommand 
{
	private ExternalStorageInterface storage;
	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;
	private PrintStream out;
	private PrintStream err;
	
	@Before
	public void setUp() throws Exception
	{
		InMemoryStorage mem = new InMemoryStorage();
		mem.put("logs/app.log", "start\nERROR disk full\nok\nerror again\n".getBytes(StandardCharsets.UTF_8));
		mem.put("logs/old/web.log", "GET /\nerror 500\n".getBytes(StandardCharsets.UTF_8));
		mem.put("logs/blob.bin", new byte[] { 'e', 'r', 'r', 0, 1, 2 });
		storage = new StorageAdapter(mem);
		storage.connect();
		
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
		out = new PrintStream(outBytes, true, "UTF-8");
		err = new PrintStream(errBytes, true, "UTF-8");
	}
	
	private String stdout() throws Exception { return new String(outBytes.toByteArray(), StandardCharsets.UTF_8); }
	
	private String stderr() throws Exception { return new String(errBytes.toByteArray(), StandardCharsets.UTF_8); }
	
	@Test
	public void testSingleFile() throws Exception
	{
		GrepCommand.Result r = new GrepCommand(storage, 1).grep(Collections.singletonList(VirtualPath.of("logs/app.log")), 
				"error", false, false, true, out, err);
		assertEquals(1, r.getMatches());
		assertEquals("4:error again\n", stdout());
	}
	
	@Test
	public void testIgnoreCase() throws Exception
	{
		GrepCommand.Result r = new GrepCommand(storage, 1).grep(Collections.singletonList(VirtualPath.of("logs/app.log")), 
				"error", true, false, false, out, err);
		assertEquals(2, r.getMatches());
		assertEquals("ERROR disk full\nerror again\n", stdout());
	}
	
	@Test
	public void testRecursiveSkipsBinary() throws Exception
	{
		GrepCommand.Result r = new GrepCommand(storage, 2).grep(Collections.singletonList(VirtualPath.of("logs")), 
				"err", false, true, false, out, err);
		assertEquals(2, r.getMatches());
		assertEquals(1, r.getSkipped());
		assertEquals(2, r.getSearched());
		assertTrue(stdout().contains("logs/app.log:error again"));
		assertTrue(stdout().contains("logs/old/web.log:error 500"));
		assertTrue(stderr().contains("logs/blob.bin"));
	}
	
	@Test
	public void testMissingFileDoesNotStopOthers() throws Exception
	{
		GrepCommand.Result r = new GrepCommand(storage, 1).grep(Arrays.asList(VirtualPath.of("nope.log"), VirtualPath.of("logs/app.log")), 
				"ok", false, false, false, out, err);
		assertEquals(1, r.getFailures());
		assertEquals(1, r.getMatches());
		assertEquals("logs/app.log:ok\n", stdout());
		assertTrue(stderr().contains("NotFound"));
	}
	
	@Test
	public void testDirectoryWithoutRecursive() throws Exception
	{
		GrepCommand.Result r = new GrepCommand(storage, 1).grep(Collections.singletonList(VirtualPath.of("logs")), 
				"x", false, false, false, out, err);
		assertEquals(1, r.getFailures());
		assertTrue(stderr().contains("InvalidArgument"));
	}
	
	@Test
	public void testMalformedPattern()
	{
		try
		{
			GrepCommand.compile("(unclosed", false);
			fail("expected InvalidArgument");
		}
		catch(StorageException e) { assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind()); }
	}
}
