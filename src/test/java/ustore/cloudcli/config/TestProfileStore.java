package ustore.cloudcli.config;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ustore.cloudcli.crypto.KeySource;
import ustore.cloudcli.crypto.MachineKeySource;
import ustore.cloudcli.crypto.PassphraseKeySource;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for the encrypted profile store.
 */
public class TestProfileStore 
{
	private static final int ITERATIONS = 1000;
	
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();
	
	private Path file;
	private KeySource key;
	
	@Before
	public void setUp() throws Exception
	{
		file = folder.getRoot().toPath().resolve("conf/profiles.bin");
		key = new PassphraseKeySource("correct horse".toCharArray());
	}
	
	private static Profile oss(String bucket)
	{
		return new Profile(Provider.OSS).set(ConfigField.BUCKET, bucket)
				.set(ConfigField.ACCESS_KEY_ID, "LTAIexample").set(ConfigField.ACCESS_KEY_SECRET, "s3cr3t-value");
	}
	
	@Test
	public void testRoundTrip()
	{
		ProfileStore store = ProfileStore.open(file, key, ITERATIONS);
		store.saveProfile("prod", oss("my-bucket"), true);
		store.saveProfile("dev", new Profile(Provider.FS).set(ConfigField.ROOT_PATH, "/tmp/dev"), false);
		
		ProfileStore reopened = ProfileStore.open(file, key, ITERATIONS);
		assertEquals("prod", reopened.defaultProfile());
		assertEquals(2, reopened.profileNames().size());
		assertEquals(oss("my-bucket"), reopened.getProfile("prod"));
		assertEquals("/tmp/dev", reopened.getProfile("dev").get(ConfigField.ROOT_PATH));
		assertNull(reopened.getProfile("missing"));
	}
	
	@Test
	public void testSecretsAreNotStoredInClear() throws Exception
	{
		ProfileStore.open(file, key, ITERATIONS).saveProfile("prod", oss("my-bucket"), false);
		String raw = new String(Files.readAllBytes(file), "ISO-8859-1");
		assertFalse(raw.contains("s3cr3t-value"));
		assertFalse(raw.contains("my-bucket"));
	}
	
	@Test
	public void testWrongKeyIsConfigError()
	{
		ProfileStore.open(file, key, ITERATIONS).saveProfile("prod", oss("b"), false);
		try
		{
			ProfileStore.open(file, new PassphraseKeySource("wrong".toCharArray()), ITERATIONS);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testCorruptedCiphertextIsConfigError() throws Exception
	{
		ProfileStore.open(file, key, ITERATIONS).saveProfile("prod", oss("b"), false);
		byte[] raw = Files.readAllBytes(file);
		raw[raw.length - 3] ^= 0x5a;
		Files.write(file, raw);
		try
		{
			ProfileStore.open(file, key, ITERATIONS);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testGarbageFileIsConfigError() throws Exception
	{
		Files.createDirectories(file.getParent());
		Files.write(file, "not a store".getBytes("UTF-8"));
		try
		{
			ProfileStore.open(file, key, ITERATIONS);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testMachineKeyIsBoundToPath()
	{
		ProfileStore.open(file, new MachineKeySource("alice"), ITERATIONS).saveProfile("p", oss("b"), false);
		assertTrue(ProfileStore.open(file, new MachineKeySource("alice"), ITERATIONS).hasProfile("p"));
		try
		{
			ProfileStore.open(file, new MachineKeySource("bob"), ITERATIONS);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testDeletingTheDefaultClearsIt()
	{
		ProfileStore store = ProfileStore.open(file, key, ITERATIONS);
		store.saveProfile("prod", oss("b"), true);
		store.deleteProfile("prod");
		assertNull(store.defaultProfile());
		assertNull(ProfileStore.open(file, key, ITERATIONS).defaultProfile());
		
		try
		{
			store.deleteProfile("prod");
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testUnknownDefaultIsRejected()
	{
		ProfileStore store = ProfileStore.open(file, key, ITERATIONS);
		try
		{
			store.setDefault("ghost");
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testTemporaryConfigExpires()
	{
		Instant created = Instant.parse("2024-05-01T10:00:00Z");
		ProfileStore store = ProfileStore.open(file, key, ITERATIONS);
		store.setTemporary(new TemporaryConfig(oss("tmp-bucket"), created, Duration.ofHours(1)));
		
		ProfileStore reopened = ProfileStore.open(file, key, ITERATIONS);
		assertNotNull(reopened.getTemporary(created.plusSeconds(60)));
		assertEquals("tmp-bucket", reopened.getTemporary(created.plusSeconds(60)).getProfile().get(ConfigField.BUCKET));
		assertNull(reopened.getTemporary(created.plusSeconds(3600)));
		
		assertTrue(reopened.clearTemporary());
		assertFalse(reopened.clearTemporary());
	}
	
	@Test
	public void testBackupIsKept()
	{
		ProfileStore store = ProfileStore.open(file, key, ITERATIONS);
		store.saveProfile("a", oss("b"), false);
		store.saveProfile("c", oss("d"), false);
		assertTrue(Files.exists(file.resolveSibling("profiles.bin.bak")));
	}
	
	@Test
	public void testShortChannelWritesAreCompleted() throws Exception
	{
		final ByteArrayOutputStream sink = new ByteArrayOutputStream();
		WritableByteChannel trickle = new WritableByteChannel()
		{
			@Override
			public int write(ByteBuffer src)
			{
				int n = Math.min(3, src.remaining());
				byte[] chunk = new byte[n];
				src.get(chunk);
				sink.write(chunk, 0, n);
				return n;
			}
			
			@Override
			public boolean isOpen() { return true; }
			
			@Override
			public void close() {}
		};
		
		byte[] data = "a store body longer than one chunk".getBytes("UTF-8");
		ProfileStore.writeFully(trickle, ByteBuffer.wrap(data));
		assertArrayEquals(data, sink.toByteArray());
	}
}
