package ustore.cloudcli.commands;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.implementation.InMemoryStorage;
import ustore.cloudcli.implementation.StorageAdapter;
import ustore.cloudcli.interfaces.ExternalStorageInterface;

/**
 * Implements tests for {@code du}.
 */
public class TestDiskUsageCommand 
{
	private ExternalStorageInterface storage;
	
	@Before
	public void setUp()
	{
		InMemoryStorage mem = new InMemoryStorage();
		mem.put("a", new byte[3]);
		mem.put("d/b", new byte[5]);
		mem.put("d/e/c", new byte[7]);
		mem.put("d/empty/", new byte[0]);
		mem.put("z/f", new byte[11]);
		storage = new StorageAdapter(mem);
		storage.connect();
	}
	
	@Test
	public void testSummaryEqualsSumOfFiles()
	{
		long sum = 0;
		Iterator<Entry> it = storage.list(VirtualPath.ROOT, true);
		while(it.hasNext() == true)
		{
			Entry e = it.next();
			if(e.isFile() == true) { sum += e.getSizeOrZero(); }
		}
		DiskUsageCommand.Usage u = new DiskUsageCommand(storage).usage(VirtualPath.ROOT, null);
		assertEquals(sum, u.getBytes());
		assertEquals(26, u.getBytes());
		assertEquals(4, u.getFiles());
	}
	
	@Test
	public void testPerDirectoryTotals()
	{
		final Map<String, Long> totals = new HashMap<String, Long>();
		new DiskUsageCommand(storage).usage(VirtualPath.ROOT, new DiskUsageCommand.UsageListener()
		{
			@Override
			public void onUsage(DiskUsageCommand.Usage u) { totals.put(u.getPath().toString(), u.getBytes()); }
		});
		assertEquals(Long.valueOf(12), totals.get("d/"));
		assertEquals(Long.valueOf(7), totals.get("d/e/"));
		assertEquals(Long.valueOf(0), totals.get("d/empty/"));
		assertEquals(Long.valueOf(11), totals.get("z/"));
	}
	
	@Test
	public void testSummarizedOutput()
	{
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		new DiskUsageCommand(storage).print(VirtualPath.of("d"), true, false, new PrintStream(bos, true));
		String[] lines = new String(bos.toByteArray(), StandardCharsets.UTF_8).split("\\r?\\n");
		assertEquals(2, lines.length);
		assertEquals("12\td/", lines[0]);
		assertEquals("Total files: 2", lines[1]);
	}
	
	@Test
	public void testSingleFile()
	{
		DiskUsageCommand.Usage u = new DiskUsageCommand(storage).usage(VirtualPath.of("z/f"), null);
		assertEquals(11, u.getBytes());
		assertEquals(1, u.getFiles());
		assertEquals("1.5K", SizeFormat.human(1536));
		assertEquals("512B", SizeFormat.human(512));
	}
}
