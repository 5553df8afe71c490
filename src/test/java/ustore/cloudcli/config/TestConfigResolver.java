package ustore.cloudcli.config;

import static org.junit.Assert.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ustore.cloudcli.crypto.PassphraseKeySource;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements tests for configuration precedence.
 */
public class TestConfigResolver 
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();
	
	private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
	
	private ProfileStore store;
	
	@Before
	public void setUp()
	{
		Path file = folder.getRoot().toPath().resolve("profiles.bin");
		store = ProfileStore.open(file, new PassphraseKeySource("pw".toCharArray()), 1000);
		store.saveProfile("prod", new Profile(Provider.OSS).set(ConfigField.BUCKET, "prod-bucket")
				.set(ConfigField.ACCESS_KEY_ID, "id-prod").set(ConfigField.ACCESS_KEY_SECRET, "secret-prod"), true);
		store.saveProfile("local", new Profile(Provider.FS).set(ConfigField.ROOT_PATH, "/data"), false);
	}
	
	@Test
	public void testDefaultProfile()
	{
		EffectiveConfig c = new ConfigResolver(store, new MapEnvironment()).resolve(null, NOW);
		assertEquals(Provider.OSS, c.getProvider());
		assertEquals("prod-bucket", c.getBucket());
		assertEquals(ConfigSource.DEFAULT_PROFILE, c.getSource());
		assertEquals("profile prod", c.originOf(ConfigField.BUCKET));
		assertFalse(c.isAnonymous());
	}
	
	@Test
	public void testExplicitProfileWinsOverDefault()
	{
		EffectiveConfig c = new ConfigResolver(store, new MapEnvironment()).resolve("local", NOW);
		assertEquals(Provider.FS, c.getProvider());
		assertEquals("/data", c.getRootPath());
		assertEquals(ConfigSource.EXPLICIT_PROFILE, c.getSource());
	}
	
	@Test
	public void testEnvironmentWinsOverProfile()
	{
		MapEnvironment env = new MapEnvironment().with("OSS_BUCKET", "env-bucket");
		EffectiveConfig c = new ConfigResolver(store, env).resolve(null, NOW);
		assertEquals("env-bucket", c.getBucket());
		assertEquals("env OSS_BUCKET", c.originOf(ConfigField.BUCKET));
		
		env.with("STORAGE_BUCKET", "generic-bucket");
		c = new ConfigResolver(store, env).resolve(null, NOW);
		assertEquals("generic-bucket", c.getBucket());
		assertEquals("id-prod", c.getAccessKeyId());
	}
	
	@Test
	public void testEnvironmentCredentialsOverrideAnonymousProfile()
	{
		store.saveProfile("pub", new Profile(Provider.S3).set(ConfigField.BUCKET, "b").setAnonymous(true), true);

		EffectiveConfig c = new ConfigResolver(store, new MapEnvironment()).resolve(null, NOW);
		assertTrue(c.isAnonymous());
		assertNull(c.getAccessKeyId());

		MapEnvironment env = new MapEnvironment().with("STORAGE_ACCESS_KEY_ID", "envid").with("STORAGE_ACCESS_KEY_SECRET", "envsecret");
		c = new ConfigResolver(store, env).resolve(null, NOW);
		assertFalse(c.isAnonymous());
		assertEquals("envid", c.getAccessKeyId());
		assertEquals("env STORAGE_ACCESS_KEY_ID", c.originOf(ConfigField.ACCESS_KEY_ID));
		assertEquals("b", c.getBucket());

		MapEnvironment aws = new MapEnvironment().with("AWS_ACCESS_KEY_ID", "awsid").with("AWS_SECRET_ACCESS_KEY", "awssecret");
		c = new ConfigResolver(store, aws).resolve(null, NOW);
		assertFalse(c.isAnonymous());
		assertEquals("awsid", c.getAccessKeyId());
	}

	@Test
	public void testTemporaryConfigWinsOverProfiles()
	{
		store.setTemporary(new TemporaryConfig(new Profile(Provider.FS).set(ConfigField.ROOT_PATH, "/scratch"), NOW.minusSeconds(10), Duration.ofMinutes(5)));
		EffectiveConfig c = new ConfigResolver(store, new MapEnvironment()).resolve("prod", NOW);
		assertEquals(Provider.FS, c.getProvider());
		assertEquals("/scratch", c.getRootPath());
		assertEquals(ConfigSource.TEMPORARY, c.getSource());
		
		c = new ConfigResolver(store, new MapEnvironment()).resolve("prod", NOW.plusSeconds(600));
		assertEquals(Provider.OSS, c.getProvider());
	}
	
	@Test
	public void testEnvironmentOnly()
	{
		store.setDefault(null);
		MapEnvironment env = new MapEnvironment().with("STORAGE_PROVIDER", "fs");
		EffectiveConfig c = new ConfigResolver(store, env).resolve(null, NOW);
		assertEquals(Provider.FS, c.getProvider());
		assertEquals(ProviderSpec.FS_DEFAULT_ROOT, c.getRootPath());
		assertEquals("default", c.originOf(ConfigField.ROOT_PATH));
		assertEquals(ConfigSource.ENVIRONMENT, c.getSource());
	}
	
	@Test
	public void testNothingConfigured()
	{
		store.setDefault(null);
		try
		{
			new ConfigResolver(store, new MapEnvironment()).resolve(null, NOW);
			fail("expected ConfigError");
		}
		catch(StorageException e) 
		{ 
			assertEquals(ErrorKind.CONFIG_ERROR, e.getKind());
			assertTrue(e.getMessage().contains("prod"));
		}
	}
	
	@Test
	public void testUnknownProfile()
	{
		try
		{
			new ConfigResolver(store, new MapEnvironment()).resolve("staging", NOW);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
	
	@Test
	public void testRequiredFieldsAndCredentials()
	{
		MapEnvironment env = new MapEnvironment().with("STORAGE_PROVIDER", "cos").with("COS_BUCKET", "b");
		store.setDefault(null);
		try
		{
			new ConfigResolver(store, env).resolve(null, NOW);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
		
		env.with("COS_SECRET_ID", "id").with("COS_SECRET_KEY", "key");
		EffectiveConfig c = new ConfigResolver(store, env).resolve(null, NOW);
		assertEquals(ProviderSpec.COS_DEFAULT_ENDPOINT, c.getEndpoint());
		
		MapEnvironment s3 = new MapEnvironment().with("STORAGE_PROVIDER", "s3").with("AWS_S3_BUCKET", "public-data");
		c = new ConfigResolver(store, s3).resolve(null, NOW);
		assertTrue(c.isAnonymous());
		
		s3.with("AWS_ACCESS_KEY_ID", "only-id");
		try
		{
			new ConfigResolver(store, s3).resolve(null, NOW);
			fail("expected ConfigError");
		}
		catch(StorageException e) { assertEquals(ErrorKind.CONFIG_ERROR, e.getKind()); }
	}
}
