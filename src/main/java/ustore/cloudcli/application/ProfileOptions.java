package ustore.cloudcli.application;

import picocli.CommandLine.Option;
import ustore.cloudcli.config.ConfigField;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.config.Profile;
import ustore.cloudcli.config.Provider;
import ustore.cloudcli.config.ProviderSpec;

/**
 * Defines the options describing a profile, shared by {@code config create} and {@code config temp set}.
 */
public class ProfileOptions 
{
	@Option(names = "--provider", required = true, paramLabel = "NAME", description = "oss, s3, minio, cos, fs, hdfs or azblob.")
	String provider;
	
	@Option(names = "--bucket", paramLabel = "NAME", description = "Bucket, or container for azblob.")
	String bucket;
	
	@Option(names = "--access-key-id", paramLabel = "ID", description = "Access key id, or account name for azblob.")
	String accessKeyId;
	
	@Option(names = "--access-key-secret", paramLabel = "SECRET", description = "Access key secret, or account key for azblob.")
	String accessKeySecret;
	
	@Option(names = "--endpoint", paramLabel = "URL")
	String endpoint;
	
	@Option(names = "--region", paramLabel = "REGION")
	String region;
	
	@Option(names = "--root-path", paramLabel = "PATH", description = "Root directory for fs and hdfs.")
	String rootPath;
	
	@Option(names = "--name-node", paramLabel = "URI", description = "HDFS name node, e.g. hdfs://namenode:8020.")
	String nameNode;
	
	@Option(names = "--anonymous", description = "Connect without credentials.")
	boolean anonymous;
	
	/** Builds the profile and checks it against the provider's field rules. */
	public Profile toProfile()
	{
		Profile p = new Profile(Provider.parse(provider));
		p.set(ConfigField.BUCKET, bucket);
		p.set(ConfigField.ACCESS_KEY_ID, accessKeyId);
		p.set(ConfigField.ACCESS_KEY_SECRET, accessKeySecret);
		p.set(ConfigField.ENDPOINT, endpoint);
		p.set(ConfigField.REGION, region);
		p.set(ConfigField.ROOT_PATH, rootPath);
		p.set(ConfigField.NAME_NODE, nameNode);
		p.setAnonymous(anonymous);
		validate(p);
		return p;
	}
	
	static void validate(Profile p)
	{
		EffectiveConfig.Builder b = new EffectiveConfig.Builder(p.getProvider());
		for(ConfigField f : ConfigField.values()) { b.set(f, p.get(f), "profile"); }
		b.anonymous(p.isAnonymous());
		ProviderSpec.forProvider(p.getProvider()).apply(b);
	}
}
