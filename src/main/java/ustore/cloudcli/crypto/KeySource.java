package ustore.cloudcli.crypto;

import java.nio.file.Path;

/**
 * Defines where the secret protecting the profile store comes from.
 */
public interface KeySource 
{
	/** Returns the secret for the store at {@code storePath}; callers wipe the returned array. */
	public char[] secretFor(Path storePath);
	
	public String describe();
}
