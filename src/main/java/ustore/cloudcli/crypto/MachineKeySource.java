package ustore.cloudcli.crypto;

import java.nio.file.Path;

/**
 * Implements a key source bound to the local user and the store location.
 * <p><p>
 * Copying the store to another account or path makes it unreadable without a passphrase.
 */
public class MachineKeySource implements KeySource 
{
	private static final String CONTEXT = "cloudcli profile store v1";
	
	private final String user;
	
	public MachineKeySource() { this(System.getProperty("user.name", "unknown")); }
	
	public MachineKeySource(String userName) { user = userName; }
	
	@Override
	public char[] secretFor(Path storePath) 
	{
		String material = user + "\n" + storePath.toAbsolutePath().normalize() + "\n" + CONTEXT;
		return material.toCharArray();
	}
	
	@Override
	public String describe() { return "machine-bound key (user " + user + ")"; }
}
