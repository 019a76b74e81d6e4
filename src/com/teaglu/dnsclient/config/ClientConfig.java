package com.teaglu.dnsclient.config;

import java.io.IOException;
import java.io.Reader;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.teaglu.dnsclient.config.exception.ConfigException;

/**
 * ClientConfig
 * 
 * Endpoint and credentials for the legacy Cloudflare client API.  The credentials are an account
 * email and the global API key, which travel in every query string as "email" and "tkn".
 */
public class ClientConfig {
	public static final @NonNull String DEFAULT_ENDPOINT= "https://www.cloudflare.com/api_json.html";
	
	// Upper bound on pages fetched for one listing
	public static final int DEFAULT_MAX_PAGES= 100;
	
	public static final @NonNull String ENV_ENDPOINT= "CLOUDFLARE_ENDPOINT";
	public static final @NonNull String ENV_EMAIL= "CLOUDFLARE_EMAIL";
	public static final @NonNull String ENV_API_KEY= "CLOUDFLARE_API_KEY";
	public static final @NonNull String ENV_MAX_PAGES= "CLOUDFLARE_MAX_PAGES";
	
	private final @NonNull String endpoint;
	private final @NonNull String authEmail;
	private final @NonNull String authKey;
	private final int maxPages;
	
	private ClientConfig(
			@NonNull String endpoint,
			@NonNull String authEmail,
			@NonNull String authKey,
			int maxPages) throws ConfigException
	{
		if (endpoint.isBlank()) {
			throw new ConfigException("API endpoint cannot be blank");
		}
		if (authEmail.isBlank()) {
			throw new ConfigException("Authentication email cannot be blank");
		}
		if (authKey.isBlank()) {
			throw new ConfigException("Authentication key cannot be blank");
		}
		if (maxPages < 1) {
			throw new ConfigException("Page limit must be at least 1, not " + maxPages);
		}
		
		this.endpoint= endpoint;
		this.authEmail= authEmail;
		this.authKey= authKey;
		this.maxPages= maxPages;
	}
	
	public static @NonNull ClientConfig Create(
			@NonNull String endpoint,
			@NonNull String authEmail,
			@NonNull String authKey) throws ConfigException
	{
		return new ClientConfig(endpoint, authEmail, authKey, DEFAULT_MAX_PAGES);
	}
	
	public static @NonNull ClientConfig Create(
			@NonNull String endpoint,
			@NonNull String authEmail,
			@NonNull String authKey,
			int maxPages) throws ConfigException
	{
		return new ClientConfig(endpoint, authEmail, authKey, maxPages);
	}
	
	/**
	 * CreateFromEnvironment
	 * 
	 * Build a configuration from environment variables.  The endpoint and page limit are
	 * optional; the email and key are required.
	 * 
	 * @param environment				Usually System.getenv()
	 * @return							Configuration
	 * 
	 * @throws ConfigException			Missing or malformed variable
	 */
	public static @NonNull ClientConfig CreateFromEnvironment(
			@NonNull Map<String, String> environment) throws ConfigException
	{
		String endpoint= environment.get(ENV_ENDPOINT);
		if ((endpoint == null) || endpoint.isBlank()) {
			endpoint= DEFAULT_ENDPOINT;
		}
		
		String maxPagesText= environment.get(ENV_MAX_PAGES);
		int maxPages= DEFAULT_MAX_PAGES;
		if ((maxPagesText != null) && !maxPagesText.isBlank()) {
			try {
				maxPages= Integer.parseInt(maxPagesText.trim());
			} catch (NumberFormatException formatException) {
				throw new ConfigException(
						ENV_MAX_PAGES + " is not a number: " + maxPagesText, formatException);
			}
		}
		
		return new ClientConfig(
				endpoint,
				getRequired(environment, ENV_EMAIL),
				getRequired(environment, ENV_API_KEY),
				maxPages);
	}
	
	/**
	 * Parse
	 * 
	 * Read a configuration from a JSON object with the members endpoint, authEmail, authKey
	 * and maxPages.  Only authEmail and authKey are required.
	 * 
	 * @param reader					Source of the JSON text
	 * @return							Configuration
	 * 
	 * @throws ConfigException			Unreadable file or missing member
	 */
	public static @NonNull ClientConfig Parse(
			@NonNull Reader reader) throws ConfigException
	{
		JsonObject spec;
		try {
			JsonElement element= JsonParser.parseReader(reader);
			if (!element.isJsonObject()) {
				throw new ConfigException("Configuration must be a JSON object");
			}
			spec= element.getAsJsonObject();
		} catch (JsonParseException parseException) {
			throw new ConfigException("Unable to parse configuration", parseException);
		}
		
		String endpoint= getOptionalString(spec, "endpoint");
		if (endpoint == null) {
			endpoint= DEFAULT_ENDPOINT;
		}
		
		int maxPages= DEFAULT_MAX_PAGES;
		if (spec.has("maxPages")) {
			try {
				maxPages= spec.get("maxPages").getAsInt();
			} catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
				throw new ConfigException("Configuration member maxPages must be a number", e);
			}
		}
		
		String authEmail= getOptionalString(spec, "authEmail");
		if (authEmail == null) {
			throw new ConfigException("Configuration member authEmail is required");
		}
		String authKey= getOptionalString(spec, "authKey");
		if (authKey == null) {
			throw new ConfigException("Configuration member authKey is required");
		}
		
		return new ClientConfig(endpoint, authEmail, authKey, maxPages);
	}
	
	/**
	 * ParseAndClose
	 * 
	 * Same as Parse, but closes the reader afterwards.
	 */
	public static @NonNull ClientConfig ParseAndClose(
			@NonNull Reader reader) throws ConfigException, IOException
	{
		try (Reader closing= reader) {
			return Parse(closing);
		}
	}

	private static @NonNull String getRequired(
			@NonNull Map<String, String> environment,
			@NonNull String key) throws ConfigException
	{
		String value= environment.get(key);
		if ((value == null) || value.isBlank()) {
			throw new ConfigException("Environment variable " + key + " is required");
		}
		return value;
	}
	
	private static @Nullable String getOptionalString(
			@NonNull JsonObject spec,
			@NonNull String key) throws ConfigException
	{
		JsonElement element= spec.get(key);
		if ((element == null) || element.isJsonNull()) {
			return null;
		}
		if (!element.isJsonPrimitive()) {
			throw new ConfigException("Configuration member " + key + " must be a string");
		}
		return element.getAsString();
	}
	
	public @NonNull String getEndpoint() {
		return endpoint;
	}
	
	public @NonNull String getAuthEmail() {
		return authEmail;
	}
	
	public @NonNull String getAuthKey() {
		return authKey;
	}
	
	public int getMaxPages() {
		return maxPages;
	}
	
	// Never include the key
	@Override
	public String toString() {
		return "ClientConfig(" + endpoint + ", " + authEmail + ", maxPages=" + maxPages + ")";
	}
}
