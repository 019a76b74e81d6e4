package com.teaglu.dnsclient.dns.cloudflare;

import org.eclipse.jdt.annotation.NonNull;

import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsTransportException;

/**
 * CloudflareTransport
 * 
 * Sends one request to the legacy API endpoint and hands back the body without interpreting it.
 * Every action is a GET with its parameters in the query string.
 */
public interface CloudflareTransport {
	/**
	 * Fixed timeout for connecting and for reading the response
	 */
	public static final int TIMEOUT_MILLIS= 10_000;
	
	/**
	 * sendRequest
	 * 
	 * @param queryString				Encoded query string including the leading "?"
	 * @return							Raw response body
	 * 
	 * @throws DnsTransportException	Network error or timeout
	 * @throws DnsApiException			Endpoint answered with an HTTP error status
	 */
	public @NonNull String sendRequest(
			@NonNull String queryString) throws DnsTransportException, DnsApiException;
}
