package ustore.cloudcli.config;

/**
 * Defines the configurable fields of a backend connection, with their generic environment overrides.
 */
public enum ConfigField 
{
	BUCKET("bucket", "STORAGE_BUCKET"),
	ACCESS_KEY_ID("access_key_id", "STORAGE_ACCESS_KEY_ID"),
	ACCESS_KEY_SECRET("access_key_secret", "STORAGE_ACCESS_KEY_SECRET"),
	ENDPOINT("endpoint", "STORAGE_ENDPOINT"),
	REGION("region", "STORAGE_REGION"),
	ROOT_PATH("root_path", null),
	NAME_NODE("name_node", null);
	
	private final String label;
	private final String genericEnv;
	
	ConfigField(String l, String env) { label = l; genericEnv = env; }
	
	public String getLabel() { return label; }
	
	/** The {@code STORAGE_*} variable that overrides this field for every provider, or null. */
	public String getGenericEnv() { return genericEnv; }
	
	public boolean isSecret() { return this == ACCESS_KEY_SECRET; }
}
