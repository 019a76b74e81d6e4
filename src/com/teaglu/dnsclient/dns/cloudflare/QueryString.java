package com.teaglu.dnsclient.dns.cloudflare;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

/**
 * QueryString
 * 
 * Builds "?key=value&key=value" from a parameter map, in the map's iteration order.  A null value
 * is sent as an empty value.
 */
final class QueryString {
	private QueryString() {}
	
	static @NonNull String build(
			@NonNull Map<@NonNull String, @Nullable String> parameters)
	{
		StringBuilder path= new StringBuilder();
		
		boolean first= true;
		for (Map.Entry<@NonNull String, @Nullable String> parameter : parameters.entrySet()) {
			if (first) {
				path.append("?");
				first= false;
			} else {
				path.append("&");
			}
			
			path.append(URLEncoder.encode(parameter.getKey(), StandardCharsets.UTF_8));
			path.append("=");
			
			String value= parameter.getValue();
			if (value != null) {
				path.append(URLEncoder.encode(value, StandardCharsets.UTF_8));
			}
		}
		
		return path.toString();
	}
}
