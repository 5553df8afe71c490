package ustore.cloudcli.config;

import java.util.EnumMap;
import java.util.Map;

import ustore.cloudcli.utils.Errors;

/**
 * Implements the per-provider field rules: which fields are required, optional (possibly with a default) or unsupported.
 */
public class ProviderSpec 
{
	public enum Requirement { REQUIRED, OPTIONAL, UNSUPPORTED };
	
	protected static class FieldRule
	{
		protected final Requirement requirement;
		protected final String defaultValue;
		
		protected FieldRule(Requirement r, String d) { requirement = r; defaultValue = d; }
	}
	
	public static final String COS_DEFAULT_ENDPOINT = "https://cos.ap-guangzhou.myqcloud.com";
	public static final String FS_DEFAULT_ROOT = "./";
	public static final String HDFS_DEFAULT_ROOT = "/";
	public static final String MINIO_DEFAULT_REGION = "us-east-1";
	
	private final Provider provider;
	private final Map<ConfigField, FieldRule> rules = new EnumMap<ConfigField, FieldRule>(ConfigField.class);
	
	private ProviderSpec(Provider p) 
	{ 
		provider = p;
		for(ConfigField f : ConfigField.values()) { rules.put(f, new FieldRule(Requirement.UNSUPPORTED, null)); }
	}
	
	private ProviderSpec rule(ConfigField f, Requirement r) { return rule(f, r, null); }
	
	private ProviderSpec rule(ConfigField f, Requirement r, String def) { rules.put(f, new FieldRule(r, def)); return this; }
	
	public static ProviderSpec forProvider(Provider p)
	{
		ProviderSpec s = new ProviderSpec(p);
		switch(p)
		{
		case OSS:
		case S3:
			return s.rule(ConfigField.BUCKET, Requirement.REQUIRED)
					.rule(ConfigField.ACCESS_KEY_ID, Requirement.OPTIONAL).rule(ConfigField.ACCESS_KEY_SECRET, Requirement.OPTIONAL)
					.rule(ConfigField.ENDPOINT, Requirement.OPTIONAL).rule(ConfigField.REGION, Requirement.OPTIONAL);
		case MINIO:
			return s.rule(ConfigField.BUCKET, Requirement.REQUIRED)
					.rule(ConfigField.ACCESS_KEY_ID, Requirement.OPTIONAL).rule(ConfigField.ACCESS_KEY_SECRET, Requirement.OPTIONAL)
					.rule(ConfigField.ENDPOINT, Requirement.REQUIRED).rule(ConfigField.REGION, Requirement.OPTIONAL, MINIO_DEFAULT_REGION);
		case COS:
			return s.rule(ConfigField.BUCKET, Requirement.REQUIRED)
					.rule(ConfigField.ACCESS_KEY_ID, Requirement.REQUIRED).rule(ConfigField.ACCESS_KEY_SECRET, Requirement.REQUIRED)
					.rule(ConfigField.ENDPOINT, Requirement.OPTIONAL, COS_DEFAULT_ENDPOINT).rule(ConfigField.REGION, Requirement.OPTIONAL);
		case FS:
			return s.rule(ConfigField.ROOT_PATH, Requirement.OPTIONAL, FS_DEFAULT_ROOT);
		case HDFS:
			return s.rule(ConfigField.NAME_NODE, Requirement.REQUIRED).rule(ConfigField.ROOT_PATH, Requirement.OPTIONAL, HDFS_DEFAULT_ROOT);
		default:
			return s.rule(ConfigField.BUCKET, Requirement.REQUIRED)
					.rule(ConfigField.ACCESS_KEY_ID, Requirement.REQUIRED).rule(ConfigField.ACCESS_KEY_SECRET, Requirement.REQUIRED)
					.rule(ConfigField.ENDPOINT, Requirement.OPTIONAL);
		}
	}
	
	public Requirement requirement(ConfigField f) { return rules.get(f).requirement; }
	
	public String defaultValue(ConfigField f) { return rules.get(f).defaultValue; }
	
	/** True when the provider takes credentials at all. */
	public boolean usesCredentials() { return requirement(ConfigField.ACCESS_KEY_ID) != Requirement.UNSUPPORTED; }
	
	/**
	 * Validates and completes a configuration: drops unsupported fields, fills defaults, enforces required fields
	 * and decides anonymous mode.
	 */
	public void apply(EffectiveConfig.Builder b)
	{
		for(ConfigField f : ConfigField.values())
		{
			FieldRule r = rules.get(f);
			if(r.requirement == Requirement.UNSUPPORTED) { b.set(f, null, null); continue; }
			if(b.get(f) == null && r.defaultValue != null) { b.set(f, r.defaultValue, "default"); }
		}
		
		enforceCredentials(b);
		
		for(ConfigField f : ConfigField.values())
		{
			if(f == ConfigField.ACCESS_KEY_ID || f == ConfigField.ACCESS_KEY_SECRET) { continue; }
			if(rules.get(f).requirement == Requirement.REQUIRED && b.get(f) == null)
			{
				throw Errors.config(provider + " requires " + f.getLabel() + hint(f));
			}
		}
	}
	
	private void enforceCredentials(EffectiveConfig.Builder b)
	{
		if(usesCredentials() == false) { b.anonymous(provider.allowsAnonymous()); return; }
		
		if(b.isAnonymous() == true)
		{
			if(provider.allowsAnonymous() == false) { throw Errors.config(provider + " does not support anonymous access"); }
			b.set(ConfigField.ACCESS_KEY_ID, null, null);
			b.set(ConfigField.ACCESS_KEY_SECRET, null, null);
			return;
		}
		
		boolean hasId = b.get(ConfigField.ACCESS_KEY_ID) != null;
		boolean hasSecret = b.get(ConfigField.ACCESS_KEY_SECRET) != null;
		if(hasId != hasSecret)
		{
			ConfigField missing = hasId ? ConfigField.ACCESS_KEY_SECRET : ConfigField.ACCESS_KEY_ID;
			throw Errors.config(provider + " credentials are incomplete: missing " + missing.getLabel() + hint(missing));
		}
		if(hasId == false)
		{
			if(provider.allowsAnonymous() == false) 
			{ 
				throw Errors.config(provider + " requires credentials (access_key_id and access_key_secret)" + hint(ConfigField.ACCESS_KEY_ID)); 
			}
			b.anonymous(true);
		}
	}
	
	private String hint(ConfigField f)
	{
		StringBuilder sb = new StringBuilder();
		if(f.getGenericEnv() != null) { sb.append(f.getGenericEnv()); }
		for(String k : provider.envKeys(f)) { if(sb.length() > 0) { sb.append(", "); } sb.append(k); }
		return (sb.length() == 0) ? "" : " (set it in the profile or via " + sb + ")";
	}
}
