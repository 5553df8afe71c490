package ustore.cloudcli.utils;

import java.util.Collection;
import java.util.Locale;

import com.amazonaws.AbortedException;
import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.AnonymousAWSCredentials;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.config.Provider;

/**
 * Implements utility functions for S3-compatible services (S3, MinIO, OSS, COS).
 */
public class AmazonS3Utils 
{
	public static final String DEFAULT_REGION = "us-east-1";
	public static final String OSS_DEFAULT_REGION = "cn-hangzhou";
	
	private static final AmazonS3Utils instance = new AmazonS3Utils();
	
	private Log log = Log.getInstance();
	
	private AmazonS3Utils() {}
	
	public static AmazonS3Utils getInstance() { return instance; }
	
	/** Builds a client for the configured service; endpoints of OSS and COS default from the region. */
	public AmazonS3 initialize(EffectiveConfig cfg)
	{
		AWSCredentialsProvider credentials = (cfg.isAnonymous() == true) 
				? new AWSStaticCredentialsProvider(new AnonymousAWSCredentials())
				: new AWSStaticCredentialsProvider(new BasicAWSCredentials(cfg.getAccessKeyId(), cfg.getAccessKeySecret()));
		
		ClientConfiguration cc = new ClientConfiguration().withMaxErrorRetry(SystemParameters.getInstance().storageOpMaxAttempts);
		
		AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
				.withCredentials(credentials)
				.withClientConfiguration(cc);
		
		String region = cfg.getRegion();
		String endpoint = endpointFor(cfg.getProvider(), cfg.getEndpoint(), region);
		if(region == null) { region = (cfg.getProvider() == Provider.OSS) ? OSS_DEFAULT_REGION : DEFAULT_REGION; }
		
		if(endpoint != null) { builder = builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region)); }
		else { builder = builder.withRegion(region); }
		
		if(cfg.getProvider() == Provider.MINIO) { builder = builder.withPathStyleAccessEnabled(true); }
		
		log.append("[S3] client for " + cfg.getProvider() + " at " + (endpoint == null ? "region " + region : endpoint), Log.TRACE);
		return builder.build();
	}
	
	protected String endpointFor(Provider p, String endpoint, String region)
	{
		if(endpoint != null) { return endpoint; }
		if(p == Provider.OSS)
		{
			String r = (region == null) ? OSS_DEFAULT_REGION : region.toLowerCase(Locale.ROOT);
			if(r.startsWith("oss-") == true) { r = r.substring(4); }
			return "https://oss-" + r + ".aliyuncs.com";
		}
		if(p == Provider.COS && region != null) { return "https://cos." + region + ".myqcloud.com"; }
		return null;
	}
	
	/** Translates an SDK fault into the failure taxonomy. */
	public StorageException translate(AmazonClientException ace, Object subject, Collection<String> secrets)
	{
		if(ace instanceof AbortedException) { return Errors.interrupted(subject); }
		if(ace instanceof AmazonServiceException)
		{
			AmazonServiceException ase = (AmazonServiceException)ace;
			log.append("[S3] service error " + ase.getStatusCode() + " " + ase.getErrorCode() + " (request " + ase.getRequestId() + ") on " + subject, Log.TRACE);
			return Errors.fromHttpStatus(ase.getStatusCode(), subject, ase.getErrorCode() + ": " + Errors.scrub(ase.getErrorMessage(), secrets));
		}
		log.append("[S3] client error on " + subject + ": " + ace.getClass().getSimpleName(), Log.TRACE);
		return Errors.provider(subject, "cannot reach storage service for " + subject + ": " + Errors.scrub(ace.getMessage(), secrets), null);
	}
	
	/** True for faults worth another attempt: network trouble and server-side errors. */
	public boolean isTransient(AmazonClientException ace)
	{
		if(ace instanceof AmazonServiceException) { return ((AmazonServiceException)ace).getStatusCode() >= 500; }
		return (ace instanceof AbortedException) == false && ace.isRetryable();
	}
}
