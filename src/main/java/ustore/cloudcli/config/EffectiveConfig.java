package ustore.cloudcli.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the resolved, immutable configuration used to build one storage connection.
 * <p><p>
 * Every field records the origin of its value so that {@code config show} can explain the result.
 */
public final class EffectiveConfig 
{
	private final Provider provider;
	private final Map<ConfigField, String> values;
	private final Map<ConfigField, String> origins;
	private final boolean anonymous;
	private final ConfigSource source;
	private final String profileName;
	
	private EffectiveConfig(Builder b)
	{
		provider = b.provider; anonymous = b.anonymous; source = b.source; profileName = b.profileName;
		values = Collections.unmodifiableMap(new EnumMap<ConfigField, String>(b.values));
		origins = Collections.unmodifiableMap(new EnumMap<ConfigField, String>(b.origins));
	}
	
	public Provider getProvider() { return provider; }
	
	public String get(ConfigField f) { return values.get(f); }
	
	/** Describes where a field's value came from, or null when unset. */
	public String originOf(ConfigField f) { return origins.get(f); }
	
	public boolean isAnonymous() { return anonymous; }
	
	public ConfigSource getSource() { return source; }
	
	/** The profile the configuration was based on, or null. */
	public String getProfileName() { return profileName; }
	
	public String getBucket() { return get(ConfigField.BUCKET); }
	public String getAccessKeyId() { return get(ConfigField.ACCESS_KEY_ID); }
	public String getAccessKeySecret() { return get(ConfigField.ACCESS_KEY_SECRET); }
	public String getEndpoint() { return get(ConfigField.ENDPOINT); }
	public String getRegion() { return get(ConfigField.REGION); }
	public String getRootPath() { return get(ConfigField.ROOT_PATH); }
	public String getNameNode() { return get(ConfigField.NAME_NODE); }
	
	/** Values that must never appear in output or error messages. */
	public List<String> secrets()
	{
		List<String> ret = new ArrayList<String>();
		if(getAccessKeySecret() != null) { ret.add(getAccessKeySecret()); }
		return ret;
	}
	
	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("EffectiveConfig{provider=").append(provider);
		for(Map.Entry<ConfigField, String> e : values.entrySet())
		{
			sb.append(", ").append(e.getKey().getLabel()).append('=').append(e.getKey().isSecret() ? "****" : e.getValue());
		}
		return sb.append(", anonymous=").append(anonymous).append('}').toString();
	}
	
	/** Collects field values while a configuration is being resolved. */
	public static class Builder
	{
		protected final Provider provider;
		protected final Map<ConfigField, String> values = new EnumMap<ConfigField, String>(ConfigField.class);
		protected final Map<ConfigField, String> origins = new EnumMap<ConfigField, String>(ConfigField.class);
		protected boolean anonymous = false;
		protected ConfigSource source = ConfigSource.ENVIRONMENT;
		protected String profileName = null;
		
		public Builder(Provider p) { provider = p; }
		
		public Provider getProvider() { return provider; }
		
		public Builder set(ConfigField f, String value, String origin)
		{
			if(value == null || value.trim().isEmpty() == true) { values.remove(f); origins.remove(f); }
			else { values.put(f, value.trim()); origins.put(f, origin); }
			return this;
		}
		
		public String get(ConfigField f) { return values.get(f); }
		
		public Builder anonymous(boolean a) { anonymous = a; return this; }
		
		public boolean isAnonymous() { return anonymous; }
		
		public Builder source(ConfigSource s, String name) { source = s; profileName = name; return this; }
		
		public EffectiveConfig build() { return new EffectiveConfig(this); }
	}
}
