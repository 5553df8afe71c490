package ustore.cloudcli.config;

import java.time.Instant;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.utils.Errors;

/**
 * Implements configuration resolution for one invocation.
 * <p><p>
 * Precedence, highest first: generic {@code STORAGE_*} variables, provider-specific variables, the unexpired temporary
 * config, the named profile (explicit or stored default), provider defaults.
 */
public class ConfigResolver 
{
	public static final String PROVIDER_ENV = "STORAGE_PROVIDER";
	
	private Log log = Log.getInstance();
	
	private final ProfileStore store;
	private final Environment env;
	
	public ConfigResolver(ProfileStore s, Environment e) { store = s; env = e; }
	
	public EffectiveConfig resolve(String explicitProfile, Instant now)
	{
		Profile base = null;
		ConfigSource source = ConfigSource.ENVIRONMENT;
		String baseName = null;
		
		if(explicitProfile != null)
		{
			base = store.requireProfile(explicitProfile);
			source = ConfigSource.EXPLICIT_PROFILE;
			baseName = explicitProfile;
		}
		else if(store.defaultProfile() != null)
		{
			baseName = store.defaultProfile();
			base = store.requireProfile(baseName);
			source = ConfigSource.DEFAULT_PROFILE;
		}
		
		TemporaryConfig temp = store.getTemporary(now);
		if(temp != null)
		{
			base = temp.getProfile();
			source = ConfigSource.TEMPORARY;
			baseName = null;
		}
		
		Provider provider = null;
		String envProvider = env.get(PROVIDER_ENV);
		if(envProvider != null) { provider = Provider.parse(envProvider); }
		else if(base != null) { provider = base.getProvider(); }
		if(provider == null)
		{
			throw Errors.config("no storage configuration: pass --profile, set a default profile or set " + PROVIDER_ENV + store.availableHint());
		}
		
		String baseOrigin = (source == ConfigSource.TEMPORARY) ? "temporary config" : (baseName == null ? null : "profile " + baseName);
		EffectiveConfig.Builder b = new EffectiveConfig.Builder(provider).source(source, baseName);
		boolean envCredentials = false;
		for(ConfigField f : ConfigField.values())
		{
			String value = null;
			String origin = null;
			if(f.getGenericEnv() != null && env.get(f.getGenericEnv()) != null)
			{
				value = env.get(f.getGenericEnv()); origin = "env " + f.getGenericEnv();
			}
			if(value == null)
			{
				for(String k : provider.envKeys(f))
				{
					if(env.get(k) != null) { value = env.get(k); origin = "env " + k; break; }
				}
			}
			boolean fromEnv = value != null;
			if(value == null && base != null && base.get(f) != null)
			{
				value = base.get(f); origin = baseOrigin;
			}
			b.set(f, value, origin);
			if(fromEnv == true && (f == ConfigField.ACCESS_KEY_ID || f == ConfigField.ACCESS_KEY_SECRET)) { envCredentials = true; }
		}
		// credentials from the environment override an anonymous profile
		b.anonymous(base != null && base.isAnonymous() && envCredentials == false);
		
		ProviderSpec.forProvider(provider).apply(b);
		
		EffectiveConfig ret = b.build();
		log.append("[CR] resolved " + ret + " from " + source.getDescription(), Log.TRACE);
		return ret;
	}
}
