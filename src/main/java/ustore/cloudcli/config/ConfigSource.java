package ustore.cloudcli.config;

/**
 * Defines where the base of an effective configuration came from.
 */
public enum ConfigSource 
{
	EXPLICIT_PROFILE("explicit profile"),
	DEFAULT_PROFILE("default profile"),
	TEMPORARY("temporary config"),
	ENVIRONMENT("environment");
	
	private final String description;
	
	ConfigSource(String d) { description = d; }
	
	public String getDescription() { return description; }
}
