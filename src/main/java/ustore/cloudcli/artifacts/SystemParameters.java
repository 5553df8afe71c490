package ustore.cloudcli.artifacts;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Represents the parameters of the system. 
 * 
 * <p>
 * <p>
 * <h4>Implementation notes:</h4>
 * <ul>
 * <li>Uses the <a href="https://en.wikipedia.org/wiki/Singleton_pattern">Singleton</a> design pattern.</li>
 * </ul>
 * <p>
 */
public class SystemParameters 
{
	private SystemParameters() {}
	
	private static final SystemParameters instance = new SystemParameters();
	public static SystemParameters getInstance() { return instance; }
	
	public static final String PROFILE_PATH_ENV = "STORAGE_PROFILE_PATH";
	public static final String MASTER_PASSWORD_ENV = "STORAGE_MASTER_PASSWORD";
	
	public int transferConcurrency = 8;
	
	public long catSizeLimit = 10L * 1024 * 1024;
	public long appendSizeLimit = 10L * 1024 * 1024;
	
	public int chunkSize = 64 * 1024;
	
	public long temporaryConfigTtlSeconds = 24L * 60 * 60;
	
	public int storageOpMaxAttempts = 3;
	
	public int keyDerivationIterations = 210000;
	
	public int diffContextLines = 3;
	
	public String defaultStoreRelativePath = ".config/cloudcli/profiles.bin";
	
	/** Resolves the profile store location: explicit value, then the environment, then the home directory. */
	public Path profileStorePath(String explicit, String fromEnv)
	{
		if(explicit != null && explicit.isEmpty() == false) { return Paths.get(explicit); }
		if(fromEnv != null && fromEnv.isEmpty() == false) { return Paths.get(fromEnv); }
		return Paths.get(System.getProperty("user.home"), defaultStoreRelativePath);
	}
}
