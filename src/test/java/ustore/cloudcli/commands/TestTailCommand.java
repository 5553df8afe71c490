package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements tests for {@code head} and {@code tail}.
 */
public class TestTailCommand 
{
	private ExternalStorageInterface storage;
	
	@Before
	public void setUp()
	{
		InMemoryStorage mem = new InMemoryStorage();
		mem.put("short.txt", "one\ntwo\nthree\n".getBytes(StandardCharsets.UTF_8));
		StringBuilder sb = new StringBuilder();
		for(int i = 1; i <= 1000; i++) { sb.append("line ").append(i).append('\n'); }
		mem.put("long.txt", sb.toString().getBytes(StandardCharsets.UTF_8));
		mem.put("bytes.bin", "abcdef".getBytes(StandardCharsets.UTF_8));
		mem.put("open.txt", "x\ny".getBytes(StandardCharsets.UTF_8));
		storage = new StorageAdapter(mem);
		storage.connect();
	}
	
	private static List<String> strings(List<byte[]> lines)
	{
		String[] ret = new String[lines.size()];
		for(int i = 0; i < ret.length; i++) { ret[i] = new String(lines.get(i), StandardCharsets.UTF_8); }
		return Arrays.asList(ret);
	}
	
	@Test
	public void testShortFileReturnedWhole()
	{
		List<String> got = strings(new TailCommand(storage).lastLines(VirtualPath.of("short.txt"), 10));
		assertEquals(Arrays.asList("one\n", "two\n", "three\n"), got);
	}
	
	@Test
	public void testLastLinesInOrder()
	{
		List<String> got = strings(new TailCommand(storage).lastLines(VirtualPath.of("long.txt"), 3));
		assertEquals(Arrays.asList("line 998\n", "line 999\n", "line 1000\n"), got);
		assertTrue(new TailCommand(storage).lastLines(VirtualPath.of("long.txt"), 0).isEmpty());
	}
	
	@Test
	public void testUnterminatedLastLine()
	{
		List<String> got = strings(new TailCommand(storage).lastLines(VirtualPath.of("open.txt"), 1));
		assertEquals(Arrays.asList("y"), got);
	}
	
	@Test
	public void testLastBytes()
	{
		TailCommand cmd = new TailCommand(storage);
		assertEquals("ef", new String(cmd.lastBytes(VirtualPath.of("bytes.bin"), 2), StandardCharsets.UTF_8));
		assertEquals("abcdef", new String(cmd.lastBytes(VirtualPath.of("bytes.bin"), 100), StandardCharsets.UTF_8));
	}
	
	@Test
	public void testHead()
	{
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		new HeadCommand(storage).head(VirtualPath.of("long.txt"), 2, -1, bos);
		assertEquals("line 1\nline 2\n", new String(bos.toByteArray(), StandardCharsets.UTF_8));
		
		bos.reset();
		new HeadCommand(storage).head(VirtualPath.of("bytes.bin"), 10, 3, bos);
		assertEquals("abc", new String(bos.toByteArray(), StandardCharsets.UTF_8));
	}
	
	@Test
	public void testHeadersAndFailuresAcrossFiles()
	{
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		List<VirtualPath> paths = Arrays.asList(VirtualPath.of("short.txt"), VirtualPath.of("missing.txt"), VirtualPath.of("bytes.bin"));
		int failures = new TailCommand(storage).tailAll(paths, 1, -1, false, false, new PrintStream(out, true), new PrintStream(err, true));
		
		assertEquals(1, failures);
		String text = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text.contains("==> short.txt <=="));
		assertTrue(text.contains("three\n"));
		assertTrue(text.contains("==> bytes.bin <=="));
		assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("NotFound"));
		
		out.reset();
		new HeadCommand(storage).headAll(Arrays.asList(VirtualPath.of("short.txt"), VirtualPath.of("bytes.bin")), 1, -1, true, false,
				new PrintStream(out, true), new PrintStream(err, true));
		assertEquals("one\nabcdef", new String(out.toByteArray(), StandardCharsets.UTF_8));
	}
}
