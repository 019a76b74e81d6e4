package com.teaglu.dnsclient.dns.cloudflare;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsAuthenticationException;
import com.teaglu.dnsclient.dns.exception.DnsInvalidInputException;
import com.teaglu.dnsclient.dns.exception.DnsRateLimitException;

/**
 * ResponseInterpreter
 * 
 * Decodes the envelope the legacy API wraps around every answer:
 * 
 * {"result":"success","msg":null,"response":{...}}
 * {"result":"error","msg":"...","err_code":"E_UNAUTH"}
 * 
 * and turns error envelopes into the matching exception.
 */
public final class ResponseInterpreter {
	public static final String RESULT_SUCCESS= "success";
	
	public static final String ERROR_UNAUTHORIZED= "E_UNAUTH";
	public static final String ERROR_INVALID_INPUT= "E_INVLDINPUT";
	public static final String ERROR_MAX_API= "E_MAXAPI";
	
	// How much of an undecodable body goes into the exception message
	private static final int MAX_BODY_SUMMARY= 200;
	
	private ResponseInterpreter() {}
	
	/**
	 * interpret
	 * 
	 * @param body						Raw response body
	 * @return							The "response" payload of a successful call
	 * 
	 * @throws DnsApiException			Error envelope or undecodable body
	 */
	public static @NonNull JsonObject interpret(
			@NonNull String body) throws DnsApiException
	{
		JsonObject envelope= parseEnvelope(body);
		
		String result= getOptionalString(envelope, "result");
		String message= getOptionalString(envelope, "msg");
		
		if (!RESULT_SUCCESS.equals(result)) {
			throw createError(result, message, getOptionalString(envelope, "err_code"));
		}
		
		JsonElement response= envelope.get("response");
		if ((response == null) || !response.isJsonObject()) {
			throw new DnsApiException(result,
					"Successful API response without a response object: " + summarize(body));
		}
		
		return response.getAsJsonObject();
	}
	
	/**
	 * createError
	 * 
	 * Map an error code to the exception for it.  A missing or unknown code is a generic API
	 * failure.
	 * 
	 * @param result					Result marker from the envelope
	 * @param message					Message text from the envelope
	 * @param errorCode					err_code from the envelope
	 * 
	 * @return							Exception to throw
	 */
	public static @NonNull DnsApiException createError(
			@Nullable String result,
			@Nullable String message,
			@Nullable String errorCode)
	{
		String text= (message != null) ? message : "API call failed without a message";
		
		if (errorCode != null) {
			switch (errorCode) {
			case ERROR_UNAUTHORIZED:
				return new DnsAuthenticationException(result, text);
				
			case ERROR_INVALID_INPUT:
				return new DnsInvalidInputException(result, text);
				
			case ERROR_MAX_API:
				return new DnsRateLimitException(result, text);
				
			default:
				break;
			}
		}
		
		return new DnsApiException(result, text);
	}
	
	private static @NonNull JsonObject parseEnvelope(
			@NonNull String body) throws DnsApiException
	{
		JsonElement element;
		try {
			element= JsonParser.parseString(body);
		} catch (JsonParseException parseException) {
			throw new DnsApiException(
					"API returned invalid JSON: " + summarize(body), parseException);
		}
		
		if (!element.isJsonObject()) {
			throw new DnsApiException("API returned something other than an object: " +
					summarize(body));
		}
		
		return element.getAsJsonObject();
	}
	
	static @Nullable String getOptionalString(
			@NonNull JsonObject object,
			@NonNull String key)
	{
		JsonElement element= object.get(key);
		if ((element == null) || element.isJsonNull() || !element.isJsonPrimitive()) {
			return null;
		}
		return element.getAsString();
	}
	
	private static @NonNull String summarize(@NonNull String body) {
		if (body.length() <= MAX_BODY_SUMMARY) {
			return body;
		}
		return body.substring(0, MAX_BODY_SUMMARY) + "...";
	}
}
