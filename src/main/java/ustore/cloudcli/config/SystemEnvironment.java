package ustore.cloudcli.config;

/**
 * Implements {@link Environment} over the process environment.
 */
public class SystemEnvironment implements Environment 
{
	@Override
	public String get(String key) 
	{
		String v = System.getenv(key);
		return (v == null || v.trim().isEmpty() == true) ? null : v.trim();
	}
}
