package ustore.cloudcli.crypto;

import java.nio.file.Path;

import ustore.cloudcli.utils.Errors;

/**
 * Implements a key source backed by a user supplied passphrase.
 */
public class PassphraseKeySource implements KeySource 
{
	private final char[] passphrase;
	
	public PassphraseKeySource(char[] pass)
	{
		if(pass == null || pass.length == 0) { throw Errors.config("the master password must not be empty"); }
		passphrase = pass.clone();
	}
	
	@Override
	public char[] secretFor(Path storePath) { return passphrase.clone(); }
	
	@Override
	public String describe() { return "master password"; }
}
