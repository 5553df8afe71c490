package ustore.cloudcli.artifacts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Implements the logging facade used throughout the client.
 * <p><p>
 * Messages are forwarded to SLF4J; the console appender writes to stderr so that command output on stdout stays clean.
 * <p>
 * <h4>Implementation notes:</h4>
 * <ul>
 * <li>Uses the <a href="https://en.wikipedia.org/wiki/Singleton_pattern">Singleton</a> design pattern.</li>
 * </ul>
 */
public class Log 
{
	public static final int ERROR = 0;
	public static final int WARNING = 1;
	public static final int INFO = 2;
	public static final int TRACE = 3;
	
	private static final String ROOT_LOGGER = "ustore.cloudcli";
	
	private static final Log instance = new Log();
	
	private Logger logger = LoggerFactory.getLogger(ROOT_LOGGER);
	
	private Log() {}
	
	public static Log getInstance() { return instance; }
	
	public void append(String msg, int level)
	{
		switch(level)
		{
		case ERROR: logger.error(msg); break;
		case WARNING: logger.warn(msg); break;
		case INFO: logger.info(msg); break;
		default: logger.trace(msg); break;
		}
	}
	
	public void append(String msg, Throwable t)
	{
		logger.debug(msg, t);
	}
	
	public boolean isTraceEnabled() { return logger.isTraceEnabled(); }
	
	/** Lowers the console threshold, used by the global --verbose switch. */
	public void setVerbose(boolean verbose)
	{
		org.slf4j.Logger l = LoggerFactory.getLogger(ROOT_LOGGER);
		if(l instanceof ch.qos.logback.classic.Logger)
		{
			((ch.qos.logback.classic.Logger)l).setLevel(verbose == true ? Level.TRACE : Level.WARN);
		}
	}
}
