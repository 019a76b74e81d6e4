package com.teaglu.dnsclient;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.eclipse.jdt.annotation.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.teaglu.dnsclient.config.ClientConfig;
import com.teaglu.dnsclient.config.exception.ConfigException;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.cloudflare.CloudflareDnsClient;
import com.teaglu.dnsclient.dns.cloudflare.CloudflareDnsClientImpl;
import com.teaglu.dnsclient.dns.exception.DnsException;
import com.teaglu.dnsclient.util.JsonSerializer;

/**
 * Main
 * 
 * Command line entry point.
 * 
 *   list <name> [type]
 *   create <name> <content> [type] [ttl] [priority]
 *   delete <name> [type]
 * 
 * Credentials come from a JSON file given with --config, or else from the CLOUDFLARE_EMAIL and
 * CLOUDFLARE_API_KEY environment variables.  Results are printed as a JSON array.
 */
public class Main {
    private static final Logger log= LoggerFactory.getLogger(Main.class);
    
    static final int EXIT_OK= 0;
    static final int EXIT_FAILED= 1;
    static final int EXIT_USAGE= 2;
    
    private static final Gson gson= new GsonBuilder().setPrettyPrinting().create();
    
    public static void main(String args[]) {
    	int status= run(args, System.getenv(), System.out, System.err);
    	System.exit(status);
    }
    
    /**
     * run
     * 
     * Run one command and return the process exit status.
     */
    static int run(
    		String[] args,
    		@NonNull Map<String, String> environment,
    		@NonNull PrintStream out,
    		@NonNull PrintStream err)
    {
    	List<String> arguments= new ArrayList<>();
    	String configPath= null;
    	
    	for (int i= 0; i < args.length; i++) {
    		if (args[i].equals("--config")) {
    			if (i + 1 >= args.length) {
    				return usage(err, "--config needs a file name");
    			}
    			configPath= args[++i];
    		} else if (args[i].equals("--version")) {
    			out.println(getVersion());
    			return EXIT_OK;
    		} else {
    			arguments.add(args[i]);
    		}
    	}
    	
    	if (arguments.isEmpty()) {
    		return usage(err, "No command given");
    	}
    	
    	ClientConfig config;
    	try {
    		config= loadConfig(configPath, environment);
    	} catch (ConfigException | IOException e) {
    		err.println("Configuration error: " + e.getMessage());
    		return EXIT_USAGE;
    	}
    	
    	log.debug("Cloudflare DNS client " + getVersion() + " using " + config);
    	
    	return execute(CloudflareDnsClientImpl.Create(config), arguments, out, err);
    }
    
    static int execute(
    		@NonNull CloudflareDnsClient client,
    		@NonNull List<String> arguments,
    		@NonNull PrintStream out,
    		@NonNull PrintStream err)
    {
    	String command= arguments.get(0);
    	List<String> operands= arguments.subList(1, arguments.size());
    	
    	try {
    		List<@NonNull DnsRecord> records;
    		
    		switch (command) {
    		case "list":
    			if (operands.isEmpty() || (operands.size() > 2)) {
    				return usage(err, "list <name> [type]");
    			}
    			records= client.listRecords(operands.get(0), optional(operands, 1));
    			break;
    			
    		case "create":
    			if ((operands.size() < 2) || (operands.size() > 5)) {
    				return usage(err, "create <name> <content> [type] [ttl] [priority]");
    			}
    			
    			String type= optional(operands, 2);
    			int ttl= DnsRecord.AUTOMATIC_TTL;
    			int priority= 0;
    			try {
    				String ttlText= optional(operands, 3);
    				if (ttlText != null) {
    					ttl= Integer.parseInt(ttlText);
    				}
    				String priorityText= optional(operands, 4);
    				if (priorityText != null) {
    					priority= Integer.parseInt(priorityText);
    				}
    			} catch (NumberFormatException formatException) {
    				return usage(err, "TTL and priority must be numbers");
    			}
    			
    			records= client.createRecord(
    					operands.get(0),
    					operands.get(1),
    					(type != null) ? type : CloudflareDnsClient.DEFAULT_TYPE,
    					ttl,
    					priority);
    			break;
    			
    		case "delete":
    			if (operands.isEmpty() || (operands.size() > 2)) {
    				return usage(err, "delete <name> [type]");
    			}
    			records= client.deleteRecords(operands.get(0), optional(operands, 1));
    			break;
    			
    		default:
    			return usage(err, "Unknown command " + command);
    		}
    		
    		out.println(gson.toJson(JsonSerializer.serialize(records)));
    		return EXIT_OK;
    	} catch (DnsException dnsException) {
    		log.debug("Command " + command + " failed", dnsException);
    		
    		err.println(gson.toJson(JsonSerializer.serialize(dnsException)));
    		return EXIT_FAILED;
    	}
    }
    
    private static @NonNull ClientConfig loadConfig(
    		String configPath,
    		@NonNull Map<String, String> environment) throws ConfigException, IOException
    {
    	if (configPath == null) {
    		return ClientConfig.CreateFromEnvironment(environment);
    	}
    	
    	Path path= Paths.get(configPath);
    	return ClientConfig.ParseAndClose(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }
    
    private static String optional(@NonNull List<String> operands, int index) {
    	return (operands.size() > index) ? operands.get(index) : null;
    }
    
    private static int usage(@NonNull PrintStream err, @NonNull String problem) {
    	err.println(problem);
    	err.println("Usage: [--config file] list <name> [type]");
    	err.println("       [--config file] create <name> <content> [type] [ttl] [priority]");
    	err.println("       [--config file] delete <name> [type]");
    	return EXIT_USAGE;
    }
    
    static @NonNull String getVersion() {
    	String version= null;
    	
    	ClassLoader classLoader= Main.class.getClassLoader();
    	
    	final Properties properties= new Properties();
    	try (InputStream stream= classLoader.getResourceAsStream("version.properties")) {
    		if (stream != null) {
    			properties.load(stream);
    			version= properties.getProperty("version");
    		}
    	} catch (IOException ioException) {
    		log.error(
    				"Unable to read version from properties file",
    				ioException);
    	}
    	
    	return (version != null) ? version : "UNKNOWN";
    }
}
