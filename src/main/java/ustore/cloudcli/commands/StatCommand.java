package ustore.cloudcli.commands;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ustore.cloudcli.data.Entry;
import ustore.cloudcli.data.VirtualPath;
import ustore.cloudcli.interfaces.ExternalStorageInterface;
import ustore.cloudcli.utils.Errors;

/**
 * Implements {@code stat}: one metadata lookup rendered as text, JSON or {@code key=value} lines.
 */
public class StatCommand extends AbstractCommand 
{
	public enum Format { HUMAN, JSON, RAW };
	
	private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	
	public StatCommand(ExternalStorageInterface s) { super(s); }
	
	public Entry stat(VirtualPath path) { return storage.stat(path); }
	
	/** Collects the fields of an entry in display order; absent values are left out. */
	public Map<String, Object> fields(Entry e)
	{
		Map<String, Object> ret = new LinkedHashMap<String, Object>();
		ret.put("path", e.getPath().toString());
		ret.put("type", e.getKind().name().toLowerCase(Locale.ROOT));
		if(e.getSize() != null) { ret.put("size", e.getSize()); }
		if(e.getModifiedAt() != null) { ret.put("last_modified", DateTimeFormatter.ISO_INSTANT.format(e.getModifiedAt())); }
		if(e.getEtag() != null) { ret.put("etag", e.getEtag()); }
		if(e.getContentType() != null) { ret.put("content_type", e.getContentType()); }
		ret.put("backend", storage.getName());
		return ret;
	}
	
	public void render(Entry e, Format format, PrintStream out)
	{
		Map<String, Object> f = fields(e);
		switch(format)
		{
		case JSON:
			try { out.println(mapper.writeValueAsString(f)); }
			catch(JsonProcessingException ex) { throw Errors.provider(e.getPath(), "cannot render " + e.getPath() + " as JSON", ex); }
			break;
		case RAW:
			for(Map.Entry<String, Object> kv : f.entrySet()) { out.println(kv.getKey() + "=" + kv.getValue()); }
			break;
		default:
			for(Map.Entry<String, Object> kv : f.entrySet()) 
			{ 
				String label = kv.getKey().replace('_', ' ');
				out.println(String.format("%-14s %s", label + ":", kv.getValue())); 
			}
		}
	}
}
