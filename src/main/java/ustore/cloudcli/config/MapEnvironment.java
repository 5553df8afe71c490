package ustore.cloudcli.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Implements {@link Environment} over an explicit map of variables.
 */
public class MapEnvironment implements Environment 
{
	private final Map<String, String> vars = new HashMap<String, String>();
	
	public MapEnvironment() {}
	
	public MapEnvironment(Map<String, String> m) { vars.putAll(m); }
	
	public MapEnvironment with(String key, String value) { vars.put(key, value); return this; }
	
	@Override
	public String get(String key) 
	{
		String v = vars.get(key);
		return (v == null || v.trim().isEmpty() == true) ? null : v.trim();
	}
}
