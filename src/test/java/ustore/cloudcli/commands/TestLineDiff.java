package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for line alignment and {@code diff}.
 */
public class TestLineDiff 
{
	@Test
	public void testIdenticalInputsGiveNoHunks()
	{
		List<String> f = Arrays.asList("alpha", "beta", "", "gamma  ", "beta");
		assertTrue(LineDiff.diff(f, f, false, 3).isEmpty());
		assertTrue(LineDiff.diff(f, f, true, 0).isEmpty());
	}
	
	@Test
	public void testSingleChange()
	{
		List<LineDiff.Hunk> hunks = LineDiff.diff(Arrays.asList("a", "b", "c"), Arrays.asList("a", "x", "c"), false, 1);
		assertEquals(1, hunks.size());
		assertEquals("@@ -1,3 +1,3 @@", hunks.get(0).header());
		assertEquals(Arrays.asList(" a", "-b", "+x", " c"), hunks.get(0).getLines());
	}
	
	@Test
	public void testDistantChangesSplitIntoHunks()
	{
		List<String> left = Arrays.asList("1", "2", "3", "4", "5", "6", "7", "8", "9", "10");
		List<String> right = Arrays.asList("one", "2", "3", "4", "5", "6", "7", "8", "9", "ten");
		List<LineDiff.Hunk> hunks = LineDiff.diff(left, right, false, 1);
		assertEquals(2, hunks.size());
		assertEquals("@@ -1,2 +1,2 @@", hunks.get(0).header());
		assertEquals("@@ -9,2 +9,2 @@", hunks.get(1).header());
		
		assertEquals(1, LineDiff.diff(left, right, false, 4).size());
	}
	
	@Test
	public void testTrailingWhitespaceIgnored()
	{
		List<String> left = Arrays.asList("x  ", "y");
		List<String> right = Arrays.asList("x", "y\t");
		assertEquals(2, LineDiff.diff(left, right, false, 3).get(0).getLeftCount());
		assertTrue(LineDiff.diff(left, right, true, 3).isEmpty());
	}
	
	@Test
	public void testDiffCommandOnStorage()
	{
		InMemoryStorage mem = new InMemoryStorage();
		mem.put("v1.txt", "a\nb\nc\n".getBytes(StandardCharsets.UTF_8));
		mem.put("v2.txt", "a\nB\nc\n".getBytes(StandardCharsets.UTF_8));
		ExternalStorageInterface storage = new StorageAdapter(mem);
		storage.connect();
		
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		DiffCommand cmd = new DiffCommand(storage);
		assertEquals(0, cmd.print(VirtualPath.of("v1.txt"), VirtualPath.of("v1.txt"), 3, false, 1024, false, new PrintStream(bos, true)));
		assertEquals(0, bos.size());
		
		int hunks = cmd.print(VirtualPath.of("v1.txt"), VirtualPath.of("v2.txt"), 3, false, 1024, false, new PrintStream(bos, true));
		assertEquals(1, hunks);
		String text = new String(bos.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text.startsWith("--- v1.txt"));
		assertTrue(text.contains("+++ v2.txt"));
		assertTrue(text.contains("-b"));
		assertTrue(text.contains("+B"));
	}
	
	@Test
	public void testSizeGuard()
	{
		InMemoryStorage mem = new InMemoryStorage();
		mem.put("big", new byte[2048]);
		ExternalStorageInterface storage = new StorageAdapter(mem);
		storage.connect();
		DiffCommand cmd = new DiffCommand(storage);
		try
		{
			cmd.diff(VirtualPath.of("big"), VirtualPath.of("big"), 3, false, 1024, false);
			fail("expected SizeLimitExceeded");
		}
		catch(StorageException e) { assertEquals(ErrorKind.SIZE_LIMIT_EXCEEDED, e.getKind()); }
		assertTrue(cmd.diff(VirtualPath.of("big"), VirtualPath.of("big"), 3, false, 1024, true).isEmpty());
	}
}
