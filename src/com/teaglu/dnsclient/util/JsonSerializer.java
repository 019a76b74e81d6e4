package com.teaglu.dnsclient.util;

import org.eclipse.jdt.annotation.NonNull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsException;

/**
 * JsonSerializer
 *
 * Converts records and failures into JSON objects for output
 */
public final class JsonSerializer {
	private JsonSerializer() {}
	
	/**
	 * serialize
	 * 
	 * @param records					Records
	 * @return							Array with one object per record
	 */
	public static @NonNull JsonArray serialize(
			@NonNull Iterable<@NonNull DnsRecord> records)
	{
		JsonArray array= new JsonArray();
		for (DnsRecord record : records) {
			array.add(serialize(record));
		}
		return array;
	}
	
	public static @NonNull JsonObject serialize(
			@NonNull DnsRecord record)
	{
		JsonObject obj= new JsonObject();
		obj.addProperty("rec_id", record.getId());
		obj.addProperty("type", record.getType().name());
		obj.addProperty("name", record.getName());
		obj.addProperty("ttl", record.getTtl());
		
		String content= record.getContent();
		if (content != null) {
			obj.addProperty("content", content);
		}
		
		Integer priority= record.getPriority();
		if (priority != null) {
			obj.addProperty("prio", priority);
		}
		
		return obj;
	}
	
	/**
	 * serialize
	 * 
	 * Serialize an exception with its error kind and, for provider errors, the result marker.
	 * Causes are nested under "cause".
	 * 
	 * @param exception					Exception / error
	 * @return							JSON object
	 */
	public static @NonNull JsonObject serialize(
			@NonNull Throwable exception)
	{
		JsonObject obj= new JsonObject();
		
		String exceptionClass= exception.getClass().getSimpleName();
		
		String message= exception.getMessage();
		if (message == null) {
			message= "Exception without message: " + exceptionClass;
		}
		
		obj.addProperty("message", message);
		obj.addProperty("exceptionClass", exceptionClass);
		
		if (exception instanceof DnsException) {
			obj.addProperty("kind", ((DnsException)exception).getKind().name());
		}
		if (exception instanceof DnsApiException) {
			String result= ((DnsApiException)exception).getResult();
			if (result != null) {
				obj.addProperty("result", result);
			}
		}

		Throwable cause= exception.getCause();
		if (cause != null) {
			obj.add("cause", serialize(cause));
		}
		
		return obj;
	}
}
