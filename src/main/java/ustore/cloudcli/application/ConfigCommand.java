package ustore.cloudcli.application;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import ustore.cloudcli.artifacts.SystemParameters;
import ustore.cloudcli.config.ConfigField;
import ustore.cloudcli.config.EffectiveConfig;
import ustore.cloudcli.config.Profile;
import ustore.cloudcli.config.ProfileStore;
import ustore.cloudcli.config.TemporaryConfig;
import ustore.cloudcli.utils.ErrorKind;
import ustore.cloudcli.utils.Errors;
import ustore.cloudcli.utils.StorageException;

/**
 * Implements {@code config}: management of the encrypted profile store.
 */
@Command(name = "config", description = "Manage storage profiles.",
	subcommands = { ConfigCommand.Create.class, ConfigCommand.ListProfiles.class, ConfigCommand.Show.class,
		ConfigCommand.SetDefault.class, ConfigCommand.Delete.class, ConfigCommand.Temp.class })
public class ConfigCommand implements Callable<Integer>
{
	private static final Pattern TTL = Pattern.compile("(\\d+)([smhd]?)");
	
	@ParentCommand
	protected CloudCli root;
	
	@Override
	public Integer call() 
	{
		CommandLine.usage(this, root.getOut());
		return 0;
	}
	
	ProfileStore store() { return root.store(); }
	
	PrintStream out() { return root.getOut(); }
	
	/** Parses {@code 90s}, {@code 30m}, {@code 12h}, {@code 2d}; a bare number is seconds. */
	static Duration parseTtl(String raw)
	{
		Matcher m = TTL.matcher(raw.trim().toLowerCase(Locale.ROOT));
		if(m.matches() == false) { throw Errors.invalidArgument(raw, "malformed duration (expected e.g. 90s, 30m, 12h or 2d)"); }
		long n = Long.parseLong(m.group(1));
		Duration ret;
		switch(m.group(2))
		{
		case "m": ret = Duration.ofMinutes(n); break;
		case "h": ret = Duration.ofHours(n); break;
		case "d": ret = Duration.ofDays(n); break;
		default: ret = Duration.ofSeconds(n); break;
		}
		if(ret.isZero() == true) { throw Errors.invalidArgument(raw, "duration must be positive"); }
		return ret;
	}
	
	/** Prints the fields of a profile; credentials are masked unless {@code showSecrets}. */
	static void printProfile(Profile p, boolean showSecrets, PrintStream out)
	{
		out.println("provider: " + p.getProvider());
		for(ConfigField f : ConfigField.values())
		{
			String v = p.get(f);
			if(v != null) { out.println(f.getLabel() + ": " + mask(f, v, showSecrets)); }
		}
		if(p.isAnonymous() == true) { out.println("anonymous: true"); }
	}
	
	static String mask(ConfigField f, String value, boolean showSecrets)
	{
		if(showSecrets == true) { return value; }
		if(f == ConfigField.ACCESS_KEY_SECRET) { return "****"; }
		if(f == ConfigField.ACCESS_KEY_ID) { return (value.length() <= 4) ? "****" : value.substring(0, 4) + "****"; }
		return value;
	}
	
	@Command(name = "create", description = "Create or replace a profile.")
	public static class Create implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Parameters(index = "0", paramLabel = "NAME")
		String name;
		
		@Mixin
		ProfileOptions options;
		
		@Option(names = "--default", description = "Make it the default profile.")
		boolean makeDefault;
		
		@Override
		public Integer call() 
		{
			ProfileStore store = config.store();
			store.saveProfile(name, options.toProfile(), makeDefault);
			config.out().println("Profile '" + name + "' saved to " + store.getFile());
			if(store.isDefault(name) == true) { config.out().println("'" + name + "' marked as default."); }
			return 0;
		}
	}
	
	@Command(name = "list", description = "List the profiles.")
	public static class ListProfiles implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Override
		public Integer call() 
		{
			ProfileStore store = config.store();
			PrintStream out = config.out();
			List<String> names = store.profileNames();
			if(names.isEmpty() == true) { out.println("No profiles configured."); }
			else
			{
				out.println("Profiles (default: " + (store.defaultProfile() == null ? "none" : store.defaultProfile()) + "):");
				for(String n : names)
				{
					Profile p = store.getProfile(n);
					String where = (p.get(ConfigField.BUCKET) != null) ? p.get(ConfigField.BUCKET) : p.get(ConfigField.ROOT_PATH);
					out.println("  " + (store.isDefault(n) ? "* " : "  ") + n + ": " + p.getProvider() + (where == null ? "" : " " + where));
				}
			}
			TemporaryConfig t = store.getTemporary(config.root.now());
			if(t != null) { out.println("Temporary config (" + t.getProfile().getProvider() + ") active until " + t.getExpiresAt()); }
			return 0;
		}
	}
	
	@Command(name = "show", description = "Show a profile, the default profile or the effective configuration.")
	public static class Show implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Parameters(index = "0", arity = "0..1", paramLabel = "NAME")
		String name;
		
		@Option(names = "--default", description = "Show the default profile.")
		boolean showDefault;
		
		@Option(names = "--show-secrets", description = "Print credentials in clear.")
		boolean showSecrets;
		
		@Override
		public Integer call() 
		{
			ProfileStore store = config.store();
			PrintStream out = config.out();
			if(name != null && showDefault == true) { throw Errors.invalidArgument("give a profile name or --default, not both"); }
			
			if(name != null || showDefault == true)
			{
				String selected = name;
				if(selected == null)
				{
					selected = store.defaultProfile();
					if(selected == null) { throw Errors.config("no default profile" + store.availableHint()); }
				}
				out.println("# Configuration source: " + (name == null ? "default profile '" : "profile '") + selected + "'");
				printProfile(store.requireProfile(selected), showSecrets, out);
				return 0;
			}
			
			EffectiveConfig cfg = config.root.resolve();
			out.println("# Configuration source: " + cfg.getSource().getDescription() 
					+ (cfg.getProfileName() == null ? "" : " '" + cfg.getProfileName() + "'"));
			out.println("provider: " + cfg.getProvider());
			for(ConfigField f : ConfigField.values())
			{
				String v = cfg.get(f);
				if(v == null) { continue; }
				String origin = cfg.originOf(f);
				out.println(f.getLabel() + ": " + mask(f, v, showSecrets) + (origin == null ? "" : "  (" + origin + ")"));
			}
			if(cfg.isAnonymous() == true) { out.println("anonymous: true"); }
			return 0;
		}
	}
	
	@Command(name = "set", description = "Set or clear the default profile.")
	public static class SetDefault implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Parameters(index = "0", arity = "0..1", paramLabel = "NAME")
		String name;
		
		@Option(names = "--clear", description = "Remove the default; STORAGE_PROVIDER and friends take over.")
		boolean clear;
		
		@Override
		public Integer call() 
		{
			if((name == null) == (clear == false)) { throw Errors.invalidArgument("give either a profile name or --clear"); }
			config.store().setDefault(clear ? null : name);
			config.out().println(clear ? "Default profile cleared" : "Default profile set to '" + name + "'");
			return 0;
		}
	}
	
	@Command(name = "delete", description = "Delete a profile.")
	public static class Delete implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Parameters(index = "0", paramLabel = "NAME")
		String name;
		
		@Option(names = { "-f", "--force" }, description = "Do not ask for confirmation.")
		boolean force;
		
		@Override
		public Integer call() 
		{
			ProfileStore store = config.store();
			store.requireProfile(name);
			if(force == false && config.root.getConfirmation().confirm("delete profile '" + name + "'?") == false)
			{
				throw new StorageException(ErrorKind.INTERRUPTED, name, "cancelled by user");
			}
			boolean wasDefault = store.isDefault(name);
			store.deleteProfile(name);
			config.out().println("Profile '" + name + "' deleted from " + store.getFile());
			if(wasDefault == true) { config.out().println("It was the default profile; no default is set now."); }
			return 0;
		}
	}
	
	@Command(name = "temp", description = "Manage the temporary configuration.",
		subcommands = { TempSet.class, TempClear.class })
	public static class Temp implements Callable<Integer>
	{
		@ParentCommand
		ConfigCommand config;
		
		@Override
		public Integer call() 
		{
			CommandLine.usage(this, config.out());
			return 0;
		}
	}
	
	@Command(name = "set", description = "Set a temporary configuration that overrides the profiles until it expires.")
	public static class TempSet implements Callable<Integer>
	{
		@ParentCommand
		Temp temp;
		
		@Mixin
		ProfileOptions options;
		
		@Option(names = "--ttl", paramLabel = "DURATION", description = "Lifetime, e.g. 30m, 12h, 2d (default: 24h).")
		String ttl;
		
		@Override
		public Integer call() 
		{
			ConfigCommand config = temp.config;
			Duration life = (ttl == null) ? Duration.ofSeconds(SystemParameters.getInstance().temporaryConfigTtlSeconds) : parseTtl(ttl);
			TemporaryConfig t = new TemporaryConfig(options.toProfile(), config.root.now(), life);
			config.store().setTemporary(t);
			config.out().println("Temporary config set until " + t.getExpiresAt());
			return 0;
		}
	}
	
	@Command(name = "clear", description = "Remove the temporary configuration.")
	public static class TempClear implements Callable<Integer>
	{
		@ParentCommand
		Temp temp;
		
		@Override
		public Integer call() 
		{
			boolean removed = temp.config.store().clearTemporary();
			temp.config.out().println(removed ? "Temporary config cleared" : "No temporary config set");
			return 0;
		}
	}
}
