package ustore.cloudcli.config;

/**
 * Defines read access to environment variables. Blank values are reported as absent.
 */
public interface Environment 
{
	public String get(String key);
}
