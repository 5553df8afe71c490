package ustore.cloudcli.crypto;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;

import javax.crypto.SecretKey;

import org.junit.Test;

/**
 * Implements tests for the authenticated encryption helpers.
 */
public class TestCryptoProvider 
{
	private final CryptoProvider crypto = CryptoProvider.getInstance();
	
	@Test
	public void testEncryptDecrypt() throws Exception
	{
		byte[] salt = crypto.randomBytes(CryptoProvider.SALT_BYTES);
		byte[] nonce = crypto.randomBytes(CryptoProvider.NONCE_BYTES);
		SecretKey key = crypto.deriveKey("pw".toCharArray(), salt, 1000);
		byte[] aad = "header".getBytes(StandardCharsets.UTF_8);
		byte[] plain = "{\"profiles\":{}}".getBytes(StandardCharsets.UTF_8);
		
		byte[] ct = crypto.encrypt(key, nonce, aad, plain);
		assertEquals(plain.length + CryptoProvider.TAG_BITS / 8, ct.length);
		assertArrayEquals(plain, crypto.decrypt(key, nonce, aad, ct));
	}
	
	@Test(expected = GeneralSecurityException.class)
	public void testTamperedHeaderIsRejected() throws Exception
	{
		byte[] salt = crypto.randomBytes(CryptoProvider.SALT_BYTES);
		byte[] nonce = crypto.randomBytes(CryptoProvider.NONCE_BYTES);
		SecretKey key = crypto.deriveKey("pw".toCharArray(), salt, 1000);
		byte[] ct = crypto.encrypt(key, nonce, new byte[] { 1 }, new byte[] { 42 });
		crypto.decrypt(key, nonce, new byte[] { 2 }, ct);
	}
	
	@Test
	public void testKeyDerivationIsDeterministic() throws Exception
	{
		byte[] salt = new byte[CryptoProvider.SALT_BYTES];
		SecretKey a = crypto.deriveKey("pw".toCharArray(), salt, 1000);
		SecretKey b = crypto.deriveKey("pw".toCharArray(), salt, 1000);
		SecretKey c = crypto.deriveKey("other".toCharArray(), salt, 1000);
		assertArrayEquals(a.getEncoded(), b.getEncoded());
		assertFalse(java.util.Arrays.equals(a.getEncoded(), c.getEncoded()));
		assertEquals(CryptoProvider.KEY_BITS / 8, a.getEncoded().length);
	}
	
	@Test
	public void testKeySources()
	{
		MachineKeySource alice = new MachineKeySource("alice");
		assertArrayEquals(alice.secretFor(Paths.get("/tmp/a.bin")), new MachineKeySource("alice").secretFor(Paths.get("/tmp/a.bin")));
		assertFalse(java.util.Arrays.equals(alice.secretFor(Paths.get("/tmp/a.bin")), alice.secretFor(Paths.get("/tmp/b.bin"))));
		assertArrayEquals("pw".toCharArray(), new PassphraseKeySource("pw".toCharArray()).secretFor(Paths.get("/x")));
	}
}
