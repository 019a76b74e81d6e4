package com.teaglu.dnsclient.dns.cloudflare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Address;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.teaglu.dnsclient.config.ClientConfig;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.DnsRecordType;
import com.teaglu.dnsclient.dns.DomainNameParser;
import com.teaglu.dnsclient.dns.RecordFilter;
import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsException;
import com.teaglu.dnsclient.dns.exception.DnsInvalidInputException;

public class CloudflareDnsClientImpl implements CloudflareDnsClient {
	private static final Logger log= LoggerFactory.getLogger(CloudflareDnsClientImpl.class);
	
	private final @NonNull CloudflareAccount account;
	private final int maxPages;
	
	private CloudflareDnsClientImpl(
			@NonNull CloudflareAccount account,
			int maxPages)
	{
		this.account= account;
		this.maxPages= maxPages;
	}
	
	public static @NonNull CloudflareDnsClient Create(
			@NonNull ClientConfig config)
	{
		return Create(config, HttpCloudflareTransport.Create(config.getEndpoint()));
	}
	
	public static @NonNull CloudflareDnsClient Create(
			@NonNull ClientConfig config,
			@NonNull CloudflareTransport transport)
	{
		return new CloudflareDnsClientImpl(
				CloudflareAccountImpl.Create(config, transport), config.getMaxPages());
	}

	@Override
	public @NonNull List<@NonNull DnsRecord> listRecords(
			@NonNull String domainOrSubdomain,
			@Nullable String recordType) throws DnsException
	{
		DnsRecordType type= DnsRecordType.parseOptional(recordType);
		
		String zone= DomainNameParser.extractDomain(domainOrSubdomain);
		RecordAccumulator accumulator= new RecordAccumulator(
				RecordFilter.Create(domainOrSubdomain, type));
		
		int offset= 0;
		for (int page= 1; ; page++) {
			Map<@NonNull String, @Nullable String> parameters= null;
			if (offset > 0) {
				parameters= new LinkedHashMap<>();
				parameters.put("o", String.valueOf(offset));
			}
			
			JsonObject response= account.call(CloudflareAccount.ACTION_LOAD_ALL, zone, parameters);
			JsonObject recs= getRequiredObject(response, "recs");
			JsonArray objects= getRequiredArray(recs, "objs");
			
			accumulator.addPage(objects);
			
			if (!getOptionalBoolean(recs, "has_more")) {
				break;
			}
			
			int count= getOptionalInteger(recs, "count", objects.size());
			if (count <= 0) {
				throw new DnsApiException(
						"API reported more records for " + zone + " but returned none");
			}
			if (page >= maxPages) {
				throw new DnsApiException(
						"Listing " + zone + " needs more than " + maxPages + " pages");
			}
			
			offset+= count;
		}
		
		if (log.isDebugEnabled()) {
			log.debug("Found " + accumulator.size() + " records for " + domainOrSubdomain +
					((type != null) ? " of type " + type : ""));
		}
		
		return accumulator.getRecords();
	}

	@Override
	public @NonNull List<@NonNull DnsRecord> createRecord(
			@NonNull String recordName,
			@NonNull String content,
			@NonNull String recordType,
			int ttl,
			int priority) throws DnsException
	{
		if (recordName.isEmpty() || content.isEmpty()) {
			throw new DnsInvalidInputException(
					"Record name or content (IP address) is missing");
		}
		
		DnsRecordType type= DnsRecordType.parse(recordType);
		
		String zone= DomainNameParser.extractDomain(recordName).toLowerCase(Locale.ROOT);
		String subdomain= DomainNameParser.extractSubdomain(recordName).toLowerCase(Locale.ROOT);
		
		// Applies to every type, including ones whose content is not an address
		if (!isAddressLiteral(content)) {
			throw new DnsInvalidInputException(
					"The new record does not have a valid IP address: " + content);
		}
		
		Map<@NonNull String, @Nullable String> parameters= new LinkedHashMap<>();
		parameters.put("type", type.name());
		parameters.put("name", subdomain);
		parameters.put("content", content);
		parameters.put("ttl", String.valueOf(ttl));
		if (priority != 0) {
			parameters.put("prio", String.valueOf(priority));
		}
		
		log.info("Creating " + type + " record " + recordName + " -> " + content);
		account.call(CloudflareAccount.ACTION_NEW, zone, parameters);
		
		return listRecords(recordName);
	}

	@Override
	public @NonNull List<@NonNull DnsRecord> deleteRecords(
			@NonNull String domainOrSubdomain,
			@Nullable String recordType) throws DnsException
	{
		DnsRecordType type= DnsRecordType.parseOptional(recordType);
		
		// Apex A records have to be removed through the Cloudflare console
		String zone= DomainNameParser.extractDomain(domainOrSubdomain);
		if (zone.equalsIgnoreCase(domainOrSubdomain) &&
				((type == null) || (type == DnsRecordType.A)))
		{
			throw new DnsInvalidInputException(
					"Deleting the A record of a main domain is not allowed. " +
					"Select a subdomain or another record type.");
		}
		
		List<@NonNull DnsRecord> records= listRecords(
				domainOrSubdomain, (type != null) ? type.name() : null);
		
		for (DnsRecord record : records) {
			Map<@NonNull String, @Nullable String> parameters= new LinkedHashMap<>();
			parameters.put("id", record.getId());
			
			log.info("Deleting " + record.getType() + " record " + record.getName() +
					" [" + record.getId() + "]");
			account.call(CloudflareAccount.ACTION_DELETE, zone, parameters);
		}
		
		return Collections.emptyList();
	}
	
	/**
	 * isAddressLiteral
	 * 
	 * True if the value is an IPv4 or IPv6 address literal.  No name lookup is done.
	 */
	static boolean isAddressLiteral(@NonNull String value) {
		return (Address.toByteArray(value, Address.IPv4) != null) ||
				(Address.toByteArray(value, Address.IPv6) != null);
	}
	
	private static @NonNull JsonObject getRequiredObject(
			@NonNull JsonObject object,
			@NonNull String key) throws DnsApiException
	{
		JsonElement element= object.get(key);
		if ((element == null) || !element.isJsonObject()) {
			throw new DnsApiException("API response is missing object " + key);
		}
		return element.getAsJsonObject();
	}
	
	private static @NonNull JsonArray getRequiredArray(
			@NonNull JsonObject object,
			@NonNull String key) throws DnsApiException
	{
		JsonElement element= object.get(key);
		if ((element == null) || !element.isJsonArray()) {
			throw new DnsApiException("API response is missing array " + key);
		}
		return element.getAsJsonArray();
	}
	
	private static boolean getOptionalBoolean(
			@NonNull JsonObject object,
			@NonNull String key) throws DnsApiException
	{
		JsonElement element= object.get(key);
		if ((element == null) || element.isJsonNull()) {
			return false;
		}
		if (!element.isJsonPrimitive()) {
			throw new DnsApiException("API response member " + key + " is not a boolean");
		}
		
		// Accepts both true and "true"
		return Boolean.parseBoolean(element.getAsString());
	}
	
	private static int getOptionalInteger(
			@NonNull JsonObject object,
			@NonNull String key,
			int defaultValue) throws DnsApiException
	{
		String text= ResponseInterpreter.getOptionalString(object, key);
		if (text == null) {
			return defaultValue;
		}
		
		try {
			return Integer.parseInt(text);
		} catch (NumberFormatException formatException) {
			throw new DnsApiException(
					"API response member " + key + " is not a number: " + text, formatException);
		}
	}
}
