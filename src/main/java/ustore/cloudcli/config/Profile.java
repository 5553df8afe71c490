package ustore.cloudcli.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a named bundle of provider, location and credentials as persisted in the profile store.
 * <p><p>
 * Whether a profile is the default is recorded by the store, not by the profile itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Profile 
{
	@JsonProperty("provider")
	protected Provider provider;
	
	@JsonProperty("bucket")
	protected String bucket;
	
	@JsonProperty("access_key_id")
	protected String accessKeyId;
	
	@JsonProperty("access_key_secret")
	protected String accessKeySecret;
	
	@JsonProperty("endpoint")
	protected String endpoint;
	
	@JsonProperty("region")
	protected String region;
	
	@JsonProperty("root_path")
	protected String rootPath;
	
	@JsonProperty("name_node")
	protected String nameNode;
	
	@JsonProperty("anonymous")
	protected boolean anonymous = false;
	
	public Profile() {}
	
	public Profile(Provider p) { provider = p; }
	
	public Provider getProvider() { return provider; }
	public Profile setProvider(Provider p) { provider = p; return this; }
	
	public boolean isAnonymous() { return anonymous; }
	public Profile setAnonymous(boolean anon) { anonymous = anon; return this; }
	
	@JsonIgnore
	public String get(ConfigField f)
	{
		switch(f)
		{
		case BUCKET: return bucket;
		case ACCESS_KEY_ID: return accessKeyId;
		case ACCESS_KEY_SECRET: return accessKeySecret;
		case ENDPOINT: return endpoint;
		case REGION: return region;
		case ROOT_PATH: return rootPath;
		default: return nameNode;
		}
	}
	
	public Profile set(ConfigField f, String value)
	{
		String v = (value == null || value.trim().isEmpty() == true) ? null : value.trim();
		switch(f)
		{
		case BUCKET: bucket = v; break;
		case ACCESS_KEY_ID: accessKeyId = v; break;
		case ACCESS_KEY_SECRET: accessKeySecret = v; break;
		case ENDPOINT: endpoint = v; break;
		case REGION: region = v; break;
		case ROOT_PATH: rootPath = v; break;
		default: nameNode = v; break;
		}
		return this;
	}
	
	public Profile copy()
	{
		Profile ret = new Profile(provider);
		for(ConfigField f : ConfigField.values()) { ret.set(f, get(f)); }
		ret.anonymous = anonymous;
		return ret;
	}
	
	@Override
	public boolean equals(Object o)
	{
		if(this == o) { return true; }
		if(o instanceof Profile == false) { return false; }
		Profile other = (Profile)o;
		if(provider != other.provider || anonymous != other.anonymous) { return false; }
		for(ConfigField f : ConfigField.values()) { if(Objects.equals(get(f), other.get(f)) == false) { return false; } }
		return true;
	}
	
	@Override
	public int hashCode() { return Objects.hash(provider, bucket, accessKeyId, endpoint, region, rootPath, nameNode, anonymous); }
	
	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Profile{provider=").append(provider);
		for(ConfigField f : ConfigField.values())
		{
			String v = get(f);
			if(v == null) { continue; }
			sb.append(", ").append(f.getLabel()).append('=').append(f.isSecret() ? "****" : v);
		}
		if(anonymous == true) { sb.append(", anonymous"); }
		return sb.append('}').toString();
	}
}
