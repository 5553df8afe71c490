package ustore.cloudcli.config;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents an unnamed profile with a time-to-live measured from its creation.
 */
public class TemporaryConfig 
{
	@JsonProperty("profile")
	protected Profile profile;
	
	@JsonProperty("created_at")
	protected long createdAtMillis;
	
	@JsonProperty("ttl_seconds")
	protected long ttlSeconds;
	
	public TemporaryConfig() {}
	
	public TemporaryConfig(Profile p, Instant created, Duration ttl)
	{
		profile = p; createdAtMillis = created.toEpochMilli(); ttlSeconds = ttl.getSeconds();
	}
	
	public Profile getProfile() { return profile; }
	
	@JsonIgnore
	public Instant getCreatedAt() { return Instant.ofEpochMilli(createdAtMillis); }
	
	@JsonIgnore
	public Instant getExpiresAt() { return getCreatedAt().plusSeconds(ttlSeconds); }
	
	public boolean isExpired(Instant now) { return now.isBefore(getExpiresAt()) == false; }
}
