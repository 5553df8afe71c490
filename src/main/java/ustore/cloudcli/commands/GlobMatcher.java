package ustore.cloudcli.commands;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import ustore.cloudcli.utils.Errors;

/**
 * Implements glob matching over slash separated paths.
 * <p><p>
 * {@code **} matches any number of segments (including none when followed by {@code /}), {@code *} and {@code ?}
 * stay inside one segment, {@code [...]} is a character class and {@code {a,b}} an alternation.
 */
public class GlobMatcher 
{
	private final String glob;
	private final Pattern pattern;
	
	public GlobMatcher(String g)
	{
		if(g == null || g.isEmpty() == true) { throw Errors.invalidArgument("glob pattern must not be empty"); }
		glob = g;
		try { pattern = Pattern.compile(toRegex(g)); }
		catch(PatternSyntaxException e) { throw Errors.invalidArgument(g, "malformed glob"); }
	}
	
	public String getGlob() { return glob; }
	
	public Pattern getPattern() { return pattern; }
	
	/** Tests the whole key, relative to the storage root and without a trailing separator. */
	public boolean matches(String key) { return pattern.matcher(key).matches(); }
	
	static String toRegex(String g)
	{
		StringBuilder sb = new StringBuilder();
		int braces = 0;
		boolean inClass = false;
		for(int i = 0; i < g.length(); i++)
		{
			char c = g.charAt(i);
			if(inClass == true)
			{
				if(c == ']') { inClass = false; sb.append(']'); }
				else if(c == '\\') { sb.append("\\\\"); }
				else if(c == '[') { sb.append("\\["); }
				else { sb.append(c); }
				continue;
			}
			switch(c)
			{
			case '*':
				if(i + 1 < g.length() && g.charAt(i + 1) == '*')
				{
					boolean slashAfter = (i + 2 < g.length() && g.charAt(i + 2) == '/');
					if(slashAfter == true) { sb.append("(?:.*/)?"); i += 2; }
					else { sb.append(".*"); i += 1; }
				}
				else { sb.append("[^/]*"); }
				break;
			case '?': sb.append("[^/]"); break;
			case '[':
				inClass = true;
				sb.append('[');
				if(i + 1 < g.length() && (g.charAt(i + 1) == '!' || g.charAt(i + 1) == '^')) { sb.append('^'); i++; }
				break;
			case '{': braces++; sb.append("(?:"); break;
			case '}':
				if(braces == 0) { throw Errors.invalidArgument(g, "unbalanced '}' in glob"); }
				braces--; sb.append(')');
				break;
			case ',': sb.append(braces > 0 ? "|" : ","); break;
			case '\\':
				if(i + 1 >= g.length()) { throw Errors.invalidArgument(g, "dangling escape in glob"); }
				sb.append(Pattern.quote(String.valueOf(g.charAt(++i))));
				break;
			default:
				if(".()+|^$@%".indexOf(c) >= 0) { sb.append('\\'); }
				sb.append(c);
			}
		}
		if(inClass == true) { throw Errors.invalidArgument(g, "unterminated '[' in glob"); }
		if(braces != 0) { throw Errors.invalidArgument(g, "unbalanced '{' in glob"); }
		return sb.toString();
	}
}
