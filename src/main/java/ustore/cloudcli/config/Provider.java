package ustore.cloudcli.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import ustore.cloudcli.utils.Errors;

/**
 * Defines the closed set of supported backends and their provider-specific environment variables.
 */
public enum Provider 
{
	OSS("oss", true),
	S3("s3", true),
	MINIO("minio", true),
	COS("cos", false),
	FS("fs", true),
	HDFS("hdfs", false),
	AZBLOB("azblob", false);
	
	private final String name;
	private final boolean anonymousAllowed;
	private final Map<ConfigField, List<String>> envKeys = new EnumMap<ConfigField, List<String>>(ConfigField.class);
	
	static
	{
		OSS.env(ConfigField.BUCKET, "OSS_BUCKET");
		OSS.env(ConfigField.ACCESS_KEY_ID, "OSS_ACCESS_KEY_ID");
		OSS.env(ConfigField.ACCESS_KEY_SECRET, "OSS_ACCESS_KEY_SECRET");
		OSS.env(ConfigField.REGION, "OSS_REGION");
		OSS.env(ConfigField.ENDPOINT, "OSS_ENDPOINT");
		
		S3.env(ConfigField.BUCKET, "AWS_S3_BUCKET", "MINIO_BUCKET");
		S3.env(ConfigField.ACCESS_KEY_ID, "AWS_ACCESS_KEY_ID", "MINIO_ACCESS_KEY");
		S3.env(ConfigField.ACCESS_KEY_SECRET, "AWS_SECRET_ACCESS_KEY", "MINIO_SECRET_KEY");
		S3.env(ConfigField.REGION, "AWS_DEFAULT_REGION", "MINIO_DEFAULT_REGION");
		S3.env(ConfigField.ENDPOINT, "MINIO_ENDPOINT");
		
		MINIO.env(ConfigField.BUCKET, "MINIO_BUCKET");
		MINIO.env(ConfigField.ACCESS_KEY_ID, "MINIO_ACCESS_KEY");
		MINIO.env(ConfigField.ACCESS_KEY_SECRET, "MINIO_SECRET_KEY");
		MINIO.env(ConfigField.REGION, "MINIO_DEFAULT_REGION");
		MINIO.env(ConfigField.ENDPOINT, "MINIO_ENDPOINT");
		
		COS.env(ConfigField.BUCKET, "COS_BUCKET");
		COS.env(ConfigField.ACCESS_KEY_ID, "COS_SECRET_ID");
		COS.env(ConfigField.ACCESS_KEY_SECRET, "COS_SECRET_KEY");
		COS.env(ConfigField.REGION, "COS_REGION");
		COS.env(ConfigField.ENDPOINT, "COS_ENDPOINT");
		
		FS.env(ConfigField.ROOT_PATH, "STORAGE_ROOT_PATH");
		
		HDFS.env(ConfigField.NAME_NODE, "HDFS_NAME_NODE");
		HDFS.env(ConfigField.ROOT_PATH, "HDFS_ROOT_PATH");
		
		AZBLOB.env(ConfigField.BUCKET, "AZBLOB_CONTAINER");
		AZBLOB.env(ConfigField.ACCESS_KEY_ID, "AZBLOB_ACCOUNT_NAME");
		AZBLOB.env(ConfigField.ACCESS_KEY_SECRET, "AZBLOB_ACCOUNT_KEY");
		AZBLOB.env(ConfigField.ENDPOINT, "AZBLOB_ENDPOINT");
	}
	
	Provider(String n, boolean anon) { name = n; anonymousAllowed = anon; }
	
	private void env(ConfigField f, String... keys) { envKeys.put(f, Collections.unmodifiableList(Arrays.asList(keys))); }
	
	@JsonValue
	public String getName() { return name; }
	
	/** True when the backend accepts credential-less access. */
	public boolean allowsAnonymous() { return anonymousAllowed; }
	
	/** Provider-specific variables for a field, highest priority first. */
	public List<String> envKeys(ConfigField f)
	{
		List<String> ret = envKeys.get(f);
		return (ret == null) ? Collections.<String>emptyList() : ret;
	}
	
	@JsonCreator
	public static Provider parse(String s)
	{
		if(s != null)
		{
			String n = s.trim().toLowerCase(Locale.ROOT);
			for(Provider p : values()) { if(p.name.equals(n) == true) { return p; } }
		}
		throw Errors.config("unknown provider '" + s + "' (expected one of " + names() + ")");
	}
	
	public static String names()
	{
		StringBuilder sb = new StringBuilder();
		for(Provider p : values()) { if(sb.length() > 0) { sb.append(", "); } sb.append(p.name); }
		return sb.toString();
	}
	
	@Override
	public String toString() { return name; }
}
