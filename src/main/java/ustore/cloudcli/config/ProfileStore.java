package ustore.cloudcli.config;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.crypto.CryptoProvider;
import ustore.cloudcli.crypto.KeySource;
import ustore.cloudcli.utils.Errors;

/**
 * Implements the encrypted profile store: every named profile, the default pointer and the temporary config in one record.
 * <p><p>
 * File layout: {@code magic(8) | version(1) | salt(16) | nonce(12) | ciphertext+tag}, with the header bound as
 * additional authenticated data. Writes go to a temporary file that is fsync'ed, the previous file is kept as
 * {@code .bak}, then the temporary file is atomically renamed over the store.
 * <p>
 * A handle is loaded once per invocation and is not shared between threads.
 */
public class ProfileStore 
{
	public static final byte[] MAGIC = { 'U', 'C', 'L', 'I', 'P', 'S', '1', 0 };
	public static final byte VERSION = 1;
	public static final int HEADER_BYTES = MAGIC.length + 1 + CryptoProvider.SALT_BYTES + CryptoProvider.NONCE_BYTES;
	
	private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
	private static final Set<PosixFilePermission> OWNER_ONLY_DIR = PosixFilePermissions.fromString("rwx------");
	
	/** Represents the plaintext document inside the encrypted record. */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	protected static class Document
	{
		@JsonProperty("default")
		protected String defaultProfile;
		
		@JsonProperty("profiles")
		protected TreeMap<String, Profile> profiles = new TreeMap<String, Profile>();
		
		@JsonProperty("temporary")
		protected TemporaryConfig temporary;
	}
	
	private Log log = Log.getInstance();
	private CryptoProvider crypto = CryptoProvider.getInstance();
	
	private final ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	
	private final Path file;
	private final SecretKey key;
	private final byte[] salt;
	private Document doc;
	
	private ProfileStore(Path f, SecretKey k, byte[] s, Document d) { file = f; key = k; salt = s; doc = d; }
	
	/** Opens (or starts) the store at {@code file}; an undecryptable or malformed file is a fatal configuration error. */
	public static ProfileStore open(Path file, KeySource keySource)
	{
		return open(file, keySource, SystemParameters.getInstance().keyDerivationIterations);
	}
	
	public static ProfileStore open(Path file, KeySource keySource, int iterations)
	{
		CryptoProvider crypto = CryptoProvider.getInstance();
		byte[] raw = null;
		try
		{
			if(Files.exists(file) == true) { raw = Files.readAllBytes(file); }
		}
		catch(IOException e) { throw Errors.config("cannot read profile store " + file + ": " + e.getMessage(), e); }
		
		if(raw == null || raw.length == 0)
		{
			byte[] salt = crypto.randomBytes(CryptoProvider.SALT_BYTES);
			return new ProfileStore(file, derive(keySource, file, salt, iterations), salt, new Document());
		}
		
		if(raw.length < HEADER_BYTES || Arrays.equals(Arrays.copyOfRange(raw, 0, MAGIC.length), MAGIC) == false)
		{
			throw Errors.config("profile store " + file + " is not a valid store file");
		}
		if(raw[MAGIC.length] != VERSION)
		{
			throw Errors.config("profile store " + file + " has unsupported version " + raw[MAGIC.length]);
		}
		
		int off = MAGIC.length + 1;
		byte[] salt = Arrays.copyOfRange(raw, off, off + CryptoProvider.SALT_BYTES);
		off += CryptoProvider.SALT_BYTES;
		byte[] nonce = Arrays.copyOfRange(raw, off, off + CryptoProvider.NONCE_BYTES);
		byte[] header = Arrays.copyOfRange(raw, 0, HEADER_BYTES);
		byte[] ciphertext = Arrays.copyOfRange(raw, HEADER_BYTES, raw.length);
		
		SecretKey key = derive(keySource, file, salt, iterations);
		byte[] plain;
		try { plain = crypto.decrypt(key, nonce, header, ciphertext); }
		catch(GeneralSecurityException e)
		{
			throw Errors.config("cannot decrypt profile store " + file + " (wrong key or corrupted file)", e);
		}
		
		try
		{
			Document d = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).readValue(plain, Document.class);
			if(d.profiles == null) { d.profiles = new TreeMap<String, Profile>(); }
			ProfileStore ret = new ProfileStore(file, key, salt, d);
			ret.normalizeDefault();
			return ret;
		}
		catch(IOException e) { throw Errors.config("profile store " + file + " is corrupted: " + e.getClass().getSimpleName(), e); }
		finally { Arrays.fill(plain, (byte)0); }
	}
	
	private static SecretKey derive(KeySource keySource, Path file, byte[] salt, int iterations)
	{
		char[] secret = keySource.secretFor(file);
		try { return CryptoProvider.getInstance().deriveKey(secret, salt, iterations); }
		catch(GeneralSecurityException e) { throw Errors.config("cannot derive the profile store key: " + e.getMessage(), e); }
		finally { Arrays.fill(secret, '\0'); }
	}
	
	public Path getFile() { return file; }
	
	public List<String> profileNames() { return new ArrayList<String>(doc.profiles.keySet()); }
	
	/** Returns a copy of the named profile, or null. */
	public Profile getProfile(String name)
	{
		Profile p = doc.profiles.get(name);
		return (p == null) ? null : p.copy();
	}
	
	public boolean hasProfile(String name) { return doc.profiles.containsKey(name); }
	
	/** Returns a copy of the named profile or fails with a configuration error listing the known names. */
	public Profile requireProfile(String name)
	{
		Profile p = getProfile(name);
		if(p == null) { throw Errors.config("unknown profile '" + name + "'" + availableHint()); }
		return p;
	}
	
	public String availableHint()
	{
		return doc.profiles.isEmpty() ? " (no profiles configured)" : " (available: " + String.join(", ", doc.profiles.keySet()) + ")";
	}
	
	public void saveProfile(String name, Profile profile, boolean makeDefault)
	{
		validateName(name);
		if(profile.getProvider() == null) { throw Errors.config("profile '" + name + "' has no provider"); }
		doc.profiles.put(name, profile.copy());
		if(makeDefault == true) { doc.defaultProfile = name; }
		persist();
		log.append("[PS] saved profile " + name + " " + profile, Log.INFO);
	}
	
	public void deleteProfile(String name)
	{
		if(doc.profiles.remove(name) == null) { throw Errors.config("unknown profile '" + name + "'" + availableHint()); }
		normalizeDefault();
		persist();
		log.append("[PS] deleted profile " + name, Log.INFO);
	}
	
	/** Points the default at {@code name}; null clears it. */
	public void setDefault(String name)
	{
		if(name != null && doc.profiles.containsKey(name) == false) 
		{ 
			throw Errors.config("unknown profile '" + name + "'" + availableHint()); 
		}
		doc.defaultProfile = name;
		persist();
	}
	
	public String defaultProfile() { return doc.defaultProfile; }
	
	public boolean isDefault(String name) { return name != null && name.equals(doc.defaultProfile); }
	
	/** Returns the temporary config when present and unexpired, else null. */
	public TemporaryConfig getTemporary(Instant now)
	{
		TemporaryConfig t = doc.temporary;
		if(t == null || t.getProfile() == null || t.isExpired(now) == true) { return null; }
		return t;
	}
	
	public void setTemporary(TemporaryConfig t)
	{
		if(t.getProfile() == null || t.getProfile().getProvider() == null) { throw Errors.config("temporary config has no provider"); }
		doc.temporary = t;
		persist();
	}
	
	/** Removes the temporary config; returns false when there was none. */
	public boolean clearTemporary()
	{
		if(doc.temporary == null) { return false; }
		doc.temporary = null;
		persist();
		return true;
	}
	
	private void normalizeDefault()
	{
		if(doc.defaultProfile != null && doc.profiles.containsKey(doc.defaultProfile) == false) { doc.defaultProfile = null; }
	}
	
	private void validateName(String name)
	{
		if(name == null || name.trim().isEmpty() == true) { throw Errors.config("profile name must not be empty"); }
		if(name.equals(name.trim()) == false) { throw Errors.config("profile name must not start or end with whitespace"); }
	}
	
	/** Serializes, encrypts and atomically replaces the store file. */
	protected void persist()
	{
		byte[] plain = null;
		Path temp = null;
		try
		{
			plain = mapper.writeValueAsBytes(doc);
			byte[] nonce = crypto.randomBytes(CryptoProvider.NONCE_BYTES);
			ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
			header.put(MAGIC).put(VERSION).put(salt).put(nonce);
			byte[] headerBytes = header.array();
			byte[] ciphertext = crypto.encrypt(key, nonce, headerBytes, plain);
			
			Path dir = file.toAbsolutePath().getParent();
			if(dir != null && Files.isDirectory(dir) == false)
			{
				Files.createDirectories(dir);
				restrict(dir, OWNER_ONLY_DIR);
			}
			
			temp = file.resolveSibling("." + file.getFileName() + ".tmp-" + UUID.randomUUID());
			try(FileChannel ch = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))
			{
				restrict(temp, OWNER_ONLY);
				writeFully(ch, ByteBuffer.wrap(headerBytes));
				writeFully(ch, ByteBuffer.wrap(ciphertext));
				ch.force(true);
			}
			
			if(Files.exists(file) == true)
			{
				Path backup = file.resolveSibling(file.getFileName() + ".bak");
				Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
				restrict(backup, OWNER_ONLY);
			}
			
			try { Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING); }
			catch(AtomicMoveNotSupportedException e) { Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING); }
			temp = null;
			log.append("[PS] wrote profile store " + file, Log.TRACE);
		}
		catch(IOException e) { throw Errors.config("cannot write profile store " + file + ": " + e.getMessage(), e); }
		catch(GeneralSecurityException e) { throw Errors.config("cannot encrypt profile store: " + e.getMessage(), e); }
		finally
		{
			if(plain != null) { Arrays.fill(plain, (byte)0); }
			if(temp != null)
			{
				try { Files.deleteIfExists(temp); }
				catch(IOException e) { log.append("[PS] could not remove " + temp + ": " + e.getMessage(), Log.WARNING); }
			}
		}
	}
	
	/** Writes every remaining byte of {@code buf}; a channel may accept fewer bytes per call. */
	static void writeFully(WritableByteChannel ch, ByteBuffer buf) throws IOException
	{
		while(buf.hasRemaining() == true) { ch.write(buf); }
	}
	
	private static void restrict(Path p, Set<PosixFilePermission> perms) throws IOException
	{
		if(FileSystems.getDefault().supportedFileAttributeViews().contains("posix") == true)
		{
			Files.setPosixFilePermissions(p, perms);
		}
	}
}
