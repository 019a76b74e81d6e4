package com.teaglu.dnsclient.dns.cloudflare;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.teaglu.dnsclient.config.ClientConfig;
import com.teaglu.dnsclient.dns.exception.DnsException;

public class CloudflareAccountImpl implements CloudflareAccount {
	private static final Logger log= LoggerFactory.getLogger(CloudflareAccountImpl.class);
	
	private final @NonNull String authEmail;
	private final @NonNull String authKey;
	private final @NonNull CloudflareTransport transport;
	
	CloudflareAccountImpl(
			@NonNull ClientConfig config,
			@NonNull CloudflareTransport transport)
	{
		this.authEmail= config.getAuthEmail();
		this.authKey= config.getAuthKey();
		this.transport= transport;
	}
	
	public static @NonNull CloudflareAccount Create(
			@NonNull ClientConfig config,
			@NonNull CloudflareTransport transport)
	{
		return new CloudflareAccountImpl(config, transport);
	}
	
	@Override
	public @NonNull JsonObject call(
			@NonNull String action,
			@NonNull String zone,
			@Nullable Map<@NonNull String, @Nullable String> parameters) throws DnsException
	{
		// Action, credentials and zone lead every query
		Map<@NonNull String, @Nullable String> query= new LinkedHashMap<>();
		query.put("a", action);
		query.put("tkn", authKey);
		query.put("email", authEmail);
		query.put("z", zone);
		if (parameters != null) {
			query.putAll(parameters);
		}
		
		if (log.isDebugEnabled()) {
			log.debug("Calling " + action + " for zone " + zone +
					((parameters != null) ? " with " + parameters.keySet() : ""));
		}
		
		String body= transport.sendRequest(QueryString.build(query));
		
		return ResponseInterpreter.interpret(body);
	}
}
