package com.teaglu.dnsclient.dns.cloudflare;

import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonObject;
import com.teaglu.dnsclient.dns.exception.DnsException;

/**
 * CloudflareAccount
 * 
 * One set of legacy API credentials.  Each call runs a single action against a zone and returns
 * the "response" payload of the answer.
 */
public interface CloudflareAccount {
	public static final String ACTION_LOAD_ALL= "rec_load_all";
	public static final String ACTION_NEW= "rec_new";
	public static final String ACTION_DELETE= "rec_delete";
	
	public @NonNull JsonObject call(
			@NonNull String action,
			@NonNull String zone,
			@Nullable Map<@NonNull String, @Nullable String> parameters) throws DnsException;
}
