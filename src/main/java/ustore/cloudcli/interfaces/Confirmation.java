package ustore.cloudcli.interfaces;

/**
 * Defines how a destructive command asks the user for permission.
 */
public interface Confirmation 
{
	public boolean confirm(String question);
}
