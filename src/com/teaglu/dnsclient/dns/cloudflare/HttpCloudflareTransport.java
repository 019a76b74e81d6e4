package com.teaglu.dnsclient.dns.cloudflare;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsTransportException;

/**
 * HttpCloudflareTransport
 * 
 * CloudflareTransport over HttpURLConnection
 */
public class HttpCloudflareTransport implements CloudflareTransport {
	private static final Logger log= LoggerFactory.getLogger(HttpCloudflareTransport.class);
	
	private static final String USER_AGENT= "Teaglu-DNS-Client";
	
	// Error bodies are only kept for the log, so don't hold on to huge ones
	private static final int MAX_ERROR_TEXT= 2048;
	
	private final @NonNull String endpoint;
	
	private HttpCloudflareTransport(@NonNull String endpoint) {
		this.endpoint= endpoint;
	}
	
	public static @NonNull CloudflareTransport Create(@NonNull String endpoint) {
		return new HttpCloudflareTransport(endpoint);
	}

	@Override
	public @NonNull String sendRequest(
			@NonNull String queryString) throws DnsTransportException, DnsApiException
	{
		URL url= null;
		try {
			url= new URL(endpoint + queryString);
		} catch (MalformedURLException e) {
			throw new DnsApiException("URL build error for endpoint " + endpoint, e);
		}
		
		HttpURLConnection connection= null;
		try {
			connection= (HttpURLConnection)url.openConnection();
			connection.setRequestProperty("User-Agent", USER_AGENT);
			connection.setRequestMethod("GET");
			connection.setConnectTimeout(TIMEOUT_MILLIS);
			connection.setReadTimeout(TIMEOUT_MILLIS);
			connection.setDoInput(true);
			
			int responseCode= connection.getResponseCode();
			if ((responseCode >= 200) && (responseCode < 300)) {
				return readFully(connection.getInputStream(), Integer.MAX_VALUE);
			}
			
			// Check ErrorStream first, some implementations only supply one or the other
			InputStream inputStream= connection.getErrorStream();
			if (inputStream == null) {
				try {
					inputStream= connection.getInputStream();
				} catch (IOException e) {
					log.debug("No response body with HTTP status " + responseCode, e);
				}
			}
			
			if (inputStream != null) {
				log.warn("API returned status " + responseCode + ": " +
						readFully(inputStream, MAX_ERROR_TEXT));
			}
			
			throw new DnsApiException("API returned HTTP status " + responseCode);
		} catch (IOException ioException) {
			throw new DnsTransportException(
					"Unable to reach API endpoint " + endpoint, ioException);
		} finally {
			if (connection != null) {
				connection.disconnect();
			}
		}
	}
	
	private static @NonNull String readFully(
			@Nullable InputStream inputStream,
			int limit) throws IOException
	{
		StringBuilder responseText= new StringBuilder();
		if (inputStream == null) {
			return "";
		}
		
		try (InputStreamReader isr= new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
			char[] responseBuffer= new char[2048];
			
			while (responseText.length() < limit) {
				int bytesRead= isr.read(responseBuffer);
				if (bytesRead == -1) {
					break;
				} else {
					responseText.append(responseBuffer, 0, bytesRead);
				}
			}
		}
		
		String rval= responseText.toString();
		if (rval.length() > limit) {
			rval= rval.substring(0, limit);
		}
		return rval;
	}
}
