package ustore.cloudcli.application;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.MapEnvironment;
import ustore.cloudcli.interfaces.Confirmation;

/**
 * Implements end-to-end tests of the command line against the local file system backend.
 */
public class TestCloudCli 
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();
	
	private int savedIterations;
	private Path storeFile;
	private Path data;
	private MapEnvironment env;
	
	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;
	
	@Before
	public void setUp() throws Exception
	{
		SystemParameters sysParams = SystemParameters.getInstance();
		savedIterations = sysParams.keyDerivationIterations;
		sysParams.keyDerivationIterations = 1000;
		
		storeFile = folder.getRoot().toPath().resolve("store/profiles.bin");
		data = folder.newFolder("data").toPath();
		Files.createDirectories(data.resolve("docs/img"));
		Files.write(data.resolve("docs/readme.md"), "# readme\nline two\n".getBytes(StandardCharsets.UTF_8));
		Files.write(data.resolve("docs/img/logo.png"), new byte[] { 1, 2, 3 });
		Files.write(data.resolve("notes.txt"), "alpha\nbeta\n".getBytes(StandardCharsets.UTF_8));
		
		env = new MapEnvironment()
				.with(SystemParameters.PROFILE_PATH_ENV, storeFile.toString())
				.with(SystemParameters.MASTER_PASSWORD_ENV, "test-password");
	}
	
	@After
	public void tearDown()
	{
		SystemParameters.getInstance().keyDerivationIterations = savedIterations;
	}
	
	private MapEnvironment fsEnv()
	{
		return env.with("STORAGE_PROVIDER", "fs").with("STORAGE_ROOT_PATH", data.toString());
	}
	
	private int run(String... args) { return run(null, args); }
	
	private int run(Confirmation confirmation, String... args)
	{
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(outBytes, true);
		PrintStream err = new PrintStream(errBytes, true);
		CloudCli cli = new CloudCli(env, out, err, new ByteArrayInputStream(new byte[0]));
		if(confirmation != null) { cli.setConfirmation(confirmation); }
		return cli.execute(args);
	}
	
	private String stdout() { return new String(outBytes.toByteArray(), StandardCharsets.UTF_8); }
	
	private String stderr() { return new String(errBytes.toByteArray(), StandardCharsets.UTF_8); }
	
	private static Confirmation answer(final boolean yes)
	{
		return new Confirmation()
		{
			@Override
			public boolean confirm(String question) { return yes; }
		};
	}
	
	@Test
	public void testDefaultProfileRoundTrip()
	{
		assertEquals(0, run("config", "create", "prod", "--provider", "oss", "--bucket", "my-bucket"));
		assertTrue(stdout().contains("Profile 'prod' saved to"));
		assertEquals(0, run("config", "set", "prod"));
		
		assertEquals(0, run("config", "show", "--default"));
		assertTrue(stdout().contains("# Configuration source: default profile 'prod'"));
		assertTrue(stdout().contains("provider: oss"));
		assertTrue(stdout().contains("bucket: my-bucket"));
		
		assertEquals(0, run("config", "list"));
		assertTrue(stdout().contains("* prod"));
		
		assertEquals(2, run("config", "show", "prod", "--default"));
		assertTrue(stderr().contains("error: InvalidArgument"));
	}
	
	@Test
	public void testSecretsAreMasked()
	{
		assertEquals(0, run("config", "create", "cos1", "--provider", "cos", "--bucket", "b", 
				"--access-key-id", "AKIDexample", "--access-key-secret", "very-secret"));
		assertEquals(0, run("config", "show", "cos1"));
		assertTrue(stdout().contains("access_key_id: AKID****"));
		assertTrue(stdout().contains("access_key_secret: ****"));
		assertFalse(stdout().contains("very-secret"));
	}
	
	@Test
	public void testInvalidProfileIsRejected()
	{
		assertEquals(7, run("config", "create", "bad", "--provider", "cos", "--bucket", "b"));
		assertTrue(stderr().contains("error: ConfigError"));
		assertEquals(7, run("config", "create", "bad", "--provider", "nimbus"));
	}
	
	@Test
	public void testDeclinedDeleteOfProfile()
	{
		assertEquals(0, run("config", "create", "dev", "--provider", "fs", "--root-path", data.toString()));
		assertEquals(130, run(answer(false), "config", "delete", "dev"));
		assertEquals(0, run("config", "delete", "dev", "-f"));
		assertEquals(7, run("config", "show", "dev"));
	}
	
	@Test
	public void testNoConfiguration()
	{
		assertEquals(7, run("ls"));
		assertTrue(stderr().contains("error: ConfigError"));
	}
	
	@Test
	public void testBrowseAndRead()
	{
		fsEnv();
		assertEquals(0, run("ls"));
		assertEquals("docs/\nnotes.txt\n", stdout().replace("\r\n", "\n"));
		
		assertEquals(0, run("cat", "notes.txt"));
		assertEquals("alpha\nbeta\n", stdout());
		
		assertEquals(0, run("head", "-n", "1", "docs/readme.md"));
		assertEquals("# readme\n", stdout().replace("\r\n", "\n"));
		
		assertEquals(3, run("cat", "missing.txt"));
		assertTrue(stderr().contains("error: NotFound"));
		
		assertEquals(2, run("frobnicate"));
	}
	
	@Test
	public void testDeclinedRecursiveDeleteKeepsFiles()
	{
		fsEnv();
		assertEquals(130, run(answer(false), "rm", "-R", "docs"));
		assertTrue(Files.exists(data.resolve("docs/readme.md")));
		assertTrue(Files.exists(data.resolve("docs/img/logo.png")));
		
		assertEquals(2, run("rm", "-f", "docs"));
		assertTrue(Files.exists(data.resolve("docs")));
		
		assertEquals(0, run(answer(true), "rm", "-R", "docs"));
		assertFalse(Files.exists(data.resolve("docs")));
	}
	
	@Test
	public void testWriteVerbs() throws Exception
	{
		fsEnv();
		assertEquals(0, run("mkdir", "-p", "out/logs"));
		assertTrue(Files.isDirectory(data.resolve("out/logs")));
		
		assertEquals(0, run("touch", "out/logs/app.log"));
		Path local = folder.newFile("extra.txt").toPath();
		Files.write(local, "more\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(0, run("append", "out/logs/app.log", local.toString()));
		assertEquals("more\n", new String(Files.readAllBytes(data.resolve("out/logs/app.log")), StandardCharsets.UTF_8));
		
		assertEquals(0, run("cp", "notes.txt", "out"));
		assertTrue(Files.exists(data.resolve("out/notes.txt")));
		assertEquals(0, run("mv", "out/notes.txt", "out/renamed.txt"));
		assertTrue(Files.exists(data.resolve("out/renamed.txt")));
		
		assertEquals(0, run("truncate", "-s", "3", "out/renamed.txt"));
		assertEquals("alp", new String(Files.readAllBytes(data.resolve("out/renamed.txt")), StandardCharsets.UTF_8));
	}
	
	@Test
	public void testTransfers() throws Exception
	{
		fsEnv();
		Path upload = folder.newFolder("upload").toPath();
		Files.write(upload.resolve("a.txt"), "A".getBytes(StandardCharsets.UTF_8));
		Files.createDirectories(upload.resolve("sub"));
		Files.write(upload.resolve("sub/b.txt"), "B".getBytes(StandardCharsets.UTF_8));
		
		assertEquals(0, run("put", "-R", "-q", upload.toString(), "incoming"));
		assertEquals("B", new String(Files.readAllBytes(data.resolve("incoming/sub/b.txt")), StandardCharsets.UTF_8));
		
		Path download = folder.newFolder("download").toPath();
		assertEquals(0, run("get", "-R", "-q", "incoming", download.toString()));
		assertEquals("A", new String(Files.readAllBytes(download.resolve("incoming/a.txt")), StandardCharsets.UTF_8));
		
		assertEquals(2, run("get", "incoming", download.toString()));
	}
	
	@Test
	public void testTemporaryConfigTakesOver()
	{
		assertEquals(0, run("config", "temp", "set", "--provider", "fs", "--root-path", data.toString(), "--ttl", "1h"));
		assertEquals(0, run("ls", "docs"));
		assertTrue(stdout().contains("docs/readme.md"));
		
		assertEquals(0, run("config", "temp", "clear"));
		assertEquals(7, run("ls"));
	}
}
