package ustore.cloudcli.utils;

/**
 * Defines the failure categories every backend fault is translated into.
 */
public enum ErrorKind 
{
	NOT_FOUND("NotFound", 3),
	PERMISSION_DENIED("PermissionDenied", 4),
	ALREADY_EXISTS("AlreadyExists", 5),
	INVALID_ARGUMENT("InvalidArgument", 2),
	SIZE_LIMIT_EXCEEDED("SizeLimitExceeded", 6),
	CONFIG_ERROR("ConfigError", 7),
	PROVIDER_ERROR("ProviderError", 1),
	INTERRUPTED("Interrupted", 130);
	
	private final String label;
	private final int exitCode;
	
	ErrorKind(String l, int code) { label = l; exitCode = code; }
	
	public String getLabel() { return label; }
	
	public int getExitCode() { return exitCode; }
}
