package ustore.cloudcli.data;

/**
 * Defines the kinds of entries a listing can produce.
 */
public enum EntryKind 
{
	FILE, DIRECTORY, OTHER;
}
