package ustore.cloudcli.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Implements the authenticated encryption used by the profile store (AES-256-GCM, PBKDF2-HMAC-SHA256 key stretching).
 * 
 * <p>
 * <p>
 * <h4>Implementation notes:</h4>
 * <ul>
 * <li>Uses the <a href="https://en.wikipedia.org/wiki/Singleton_pattern">Singleton</a> design pattern.</li>
 * </ul>
 * <p>
 */
public class CryptoProvider 
{
	public static final int KEY_BITS = 256;
	public static final int TAG_BITS = 128;
	public static final int SALT_BYTES = 16;
	public static final int NONCE_BYTES = 12;
	
	private static final String CIPHER = "AES/GCM/NoPadding";
	private static final String KDF = "PBKDF2WithHmacSHA256";
	
	private static final CryptoProvider instance = new CryptoProvider();
	
	private final SecureRandom rnd = new SecureRandom();
	
	private CryptoProvider() {}
	
	public static CryptoProvider getInstance() { return instance; }
	
	public byte[] randomBytes(int n)
	{
		byte[] ret = new byte[n];
		rnd.nextBytes(ret);
		return ret;
	}
	
	/** Stretches a secret into an AES key; the secret array is left untouched. */
	public SecretKey deriveKey(char[] secret, byte[] salt, int iterations) throws GeneralSecurityException
	{
		PBEKeySpec spec = new PBEKeySpec(secret, salt, iterations, KEY_BITS);
		try
		{
			byte[] raw = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
			SecretKey ret = new SecretKeySpec(raw, "AES");
			Arrays.fill(raw, (byte)0);
			return ret;
		}
		finally { spec.clearPassword(); }
	}
	
	public byte[] encrypt(SecretKey key, byte[] nonce, byte[] aad, byte[] plaintext) throws GeneralSecurityException
	{
		Cipher c = Cipher.getInstance(CIPHER);
		c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
		if(aad != null) { c.updateAAD(aad); }
		return c.doFinal(plaintext);
	}
	
	/** Decrypts and authenticates; a tampered ciphertext or header raises {@link javax.crypto.AEADBadTagException}. */
	public byte[] decrypt(SecretKey key, byte[] nonce, byte[] aad, byte[] ciphertext) throws GeneralSecurityException
	{
		Cipher c = Cipher.getInstance(CIPHER);
		c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
		if(aad != null) { c.updateAAD(aad); }
		return c.doFinal(ciphertext);
	}
}
