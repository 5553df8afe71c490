package ustore.cloudcli.utils;

/**
 * Represents a failure of a storage or configuration operation, classified by {@link ErrorKind}.
 * <p><p>
 * The subject is the path or profile name the failure is about. Messages never carry secret values.
 */
public class StorageException extends RuntimeException 
{
	private static final long serialVersionUID = 1L;
	
	private final ErrorKind kind;
	private final String subject;
	
	public StorageException(ErrorKind k, String subj, String message)
	{
		this(k, subj, message, null);
	}
	
	public StorageException(ErrorKind k, String subj, String message, Throwable cause)
	{
		super(message, cause);
		kind = k; subject = subj;
	}
	
	public ErrorKind getKind() { return kind; }
	
	public String getSubject() { return subject; }
	
	/** Formats the failure the way the command line reports it: {@code Kind: message}. */
	public String describe()
	{
		return kind.getLabel() + ": " + getMessage();
	}
}
