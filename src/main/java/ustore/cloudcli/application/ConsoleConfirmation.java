package ustore.cloudcli.application;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import ustore.cloudcli.artifacts.Log;
import ustore.cloudcli.interfaces.Confirmation;

/**
 * Implements a yes/no prompt on the terminal. Anything but {@code y} or {@code yes} declines, as does end of input.
 */
public class ConsoleConfirmation implements Confirmation 
{
	private Log log = Log.getInstance();
	
	private final BufferedReader reader;
	private final PrintStream prompt;
	
	public ConsoleConfirmation(InputStream in, PrintStream p) 
	{ 
		reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		prompt = p;
	}
	
	@Override
	public boolean confirm(String question) 
	{
		prompt.print(question + " [y/N] ");
		prompt.flush();
		try
		{
			String answer = reader.readLine();
			if(answer == null) { return false; }
			answer = answer.trim().toLowerCase(Locale.ROOT);
			return answer.equals("y") || answer.equals("yes");
		}
		catch(IOException e)
		{
			log.append("[CL] cannot read confirmation: " + e.getMessage(), Log.WARNING);
			return false;
		}
	}
}
