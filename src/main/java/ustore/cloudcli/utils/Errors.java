package ustore.cloudcli.utils;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Collection;

import ustore.cloudcli.artifacts.Log;

/**
 * Implements helpers to build and translate failures into {@link StorageException}s.
 */
public class Errors 
{
	private static final Log log = Log.getInstance();
	
	private Errors() {}
	
	public static StorageException notFound(Object subject)
	{
		return new StorageException(ErrorKind.NOT_FOUND, String.valueOf(subject), "no such file or directory: " + subject);
	}
	
	public static StorageException alreadyExists(Object subject)
	{
		return new StorageException(ErrorKind.ALREADY_EXISTS, String.valueOf(subject), "already exists: " + subject);
	}
	
	public static StorageException permissionDenied(Object subject)
	{
		return new StorageException(ErrorKind.PERMISSION_DENIED, String.valueOf(subject), "permission denied: " + subject);
	}
	
	public static StorageException invalidArgument(String message)
	{
		return new StorageException(ErrorKind.INVALID_ARGUMENT, null, message);
	}
	
	public static StorageException invalidArgument(Object subject, String message)
	{
		return new StorageException(ErrorKind.INVALID_ARGUMENT, String.valueOf(subject), message + ": " + subject);
	}
	
	public static StorageException sizeLimit(Object subject, long size, long limit)
	{
		return new StorageException(ErrorKind.SIZE_LIMIT_EXCEEDED, String.valueOf(subject), 
				subject + " is " + size + " bytes, over the limit of " + limit + " bytes (use -f to override)");
	}
	
	public static StorageException config(String message)
	{
		return new StorageException(ErrorKind.CONFIG_ERROR, null, message);
	}
	
	public static StorageException config(String message, Throwable cause)
	{
		return new StorageException(ErrorKind.CONFIG_ERROR, null, message, cause);
	}
	
	public static StorageException provider(Object subject, String message, Throwable cause)
	{
		return new StorageException(ErrorKind.PROVIDER_ERROR, String.valueOf(subject), message, cause);
	}
	
	public static StorageException interrupted(Object subject)
	{
		return new StorageException(ErrorKind.INTERRUPTED, String.valueOf(subject), "interrupted: " + subject);
	}
	
	/** Maps an HTTP status returned by an object store to the failure taxonomy. */
	public static StorageException fromHttpStatus(int status, Object subject, String detail)
	{
		switch(status)
		{
		case 404: return notFound(subject);
		case 401:
		case 403: return permissionDenied(subject);
		case 409:
		case 412: return new StorageException(ErrorKind.ALREADY_EXISTS, String.valueOf(subject), "conflict on " + subject + ": " + detail);
		default: return provider(subject, "storage service returned " + status + " for " + subject + ": " + detail, null);
		}
	}
	
	/** Translates a JDK or Hadoop I/O fault raised while operating on {@code subject}. */
	public static StorageException translate(IOException e, Object subject, Collection<String> secrets)
	{
		if(e instanceof NoSuchFileException || e instanceof FileNotFoundException) { return notFound(subject); }
		if(e instanceof AccessDeniedException) { return permissionDenied(subject); }
		if(e instanceof FileAlreadyExistsException) { return alreadyExists(subject); }
		if(e instanceof DirectoryNotEmptyException) { return invalidArgument(subject, "directory not empty"); }
		if(e instanceof NotDirectoryException) { return invalidArgument(subject, "not a directory"); }
		if(e instanceof InterruptedIOException) { return interrupted(subject); }
		
		String simpleName = e.getClass().getSimpleName();
		if(simpleName.equals("AccessControlException") == true) { return permissionDenied(subject); }
		if(simpleName.equals("PathIsNotEmptyDirectoryException") == true) { return invalidArgument(subject, "directory not empty"); }
		
		log.append("[ER] I/O fault on " + subject + ": " + simpleName, Log.TRACE);
		return provider(subject, "I/O error on " + subject + ": " + scrub(e.getMessage(), secrets), null);
	}
	
	/** Translates an unchecked fault that is not already a {@link StorageException}. */
	public static StorageException translate(RuntimeException e, Object subject, Collection<String> secrets)
	{
		if(e instanceof StorageException) { return (StorageException)e; }
		if(e instanceof SecurityException) { return permissionDenied(subject); }
		if(e instanceof java.io.UncheckedIOException) { return translate(((java.io.UncheckedIOException)e).getCause(), subject, secrets); }
		
		return provider(subject, "backend error on " + subject + ": " + scrub(e.getMessage(), secrets), null);
	}
	
	/** Removes every configured secret value from a message. */
	public static String scrub(String message, Collection<String> secrets)
	{
		if(message == null) { return ""; }
		String ret = message;
		if(secrets != null)
		{
			for(String s : secrets)
			{
				if(s != null && s.isEmpty() == false) { ret = ret.replace(s, "****"); }
			}
		}
		return ret;
	}
	
	public static void verify(boolean condition, String message)
	{
		if(condition == false) { throw new IllegalStateException(message); }
	}
}
