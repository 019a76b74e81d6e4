package com.teaglu.dnsclient.dns.cloudflare;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.DnsRecordType;
import com.teaglu.dnsclient.dns.RecordFilter;
import com.teaglu.dnsclient.dns.exception.DnsApiException;
import com.teaglu.dnsclient.dns.exception.DnsInvalidInputException;

/**
 * RecordAccumulator
 * 
 * Collects the records of one listing across all of its pages.  Records are keyed by name and
 * kept in the order they were first seen; once a name is present, later records with the same
 * name are ignored even if they have a different type.
 * 
 * An accumulator belongs to a single listing and is not thread safe.
 */
public class RecordAccumulator {
	private static final Logger log= LoggerFactory.getLogger(RecordAccumulator.class);
	
	private final @NonNull RecordFilter filter;
	private final @NonNull Map<@NonNull String, @NonNull DnsRecord> records= new LinkedHashMap<>();
	
	public RecordAccumulator(@NonNull RecordFilter filter) {
		this.filter= filter;
	}
	
	/**
	 * addPage
	 * 
	 * Run the raw record objects of one page through the filter and keep the ones that qualify.
	 * 
	 * @param objects					The recs.objs array of a rec_load_all response
	 * @return							Number of records kept from this page
	 * 
	 * @throws DnsApiException			A qualifying record is missing a required member
	 */
	public int addPage(@NonNull JsonArray objects) throws DnsApiException {
		int kept= 0;
		
		for (JsonElement element : objects) {
			if (!element.isJsonObject()) {
				throw new DnsApiException("Record list contains a non-object entry: " + element);
			}
			JsonObject object= element.getAsJsonObject();
			
			String name= requireString(object, "name");
			String type= requireString(object, "type");
			
			if (records.containsKey(name)) {
				continue;
			}
			if (!filter.matchesName(name) || !filter.matchesType(type)) {
				continue;
			}
			
			DnsRecordType recordType;
			try {
				recordType= DnsRecordType.parse(type);
			} catch (DnsInvalidInputException unknownType) {
				log.warn("Skipping record " + name + " with unsupported type " + type);
				continue;
			}
			
			records.put(name, decode(object, name, recordType));
			kept++;
		}
		
		return kept;
	}
	
	public boolean contains(@NonNull String name) {
		return records.containsKey(name);
	}
	
	public int size() {
		return records.size();
	}
	
	/**
	 * getRecords
	 * 
	 * @return							Snapshot of the records in the order they were first seen
	 */
	public @NonNull List<@NonNull DnsRecord> getRecords() {
		return new ArrayList<>(records.values());
	}
	
	private static @NonNull DnsRecord decode(
			@NonNull JsonObject object,
			@NonNull String name,
			@NonNull DnsRecordType type) throws DnsApiException
	{
		String id= requireString(object, "rec_id");
		
		int ttl= DnsRecord.AUTOMATIC_TTL;
		String ttlText= ResponseInterpreter.getOptionalString(object, "ttl");
		if (ttlText != null) {
			try {
				ttl= Integer.parseInt(ttlText);
			} catch (NumberFormatException formatException) {
				throw new DnsApiException(
						"Record " + name + " has a non-numeric TTL " + ttlText, formatException);
			}
		}
		
		Integer priority= null;
		String priorityText= ResponseInterpreter.getOptionalString(object, "prio");
		if ((priorityText != null) && !priorityText.isEmpty()) {
			try {
				priority= Integer.valueOf(priorityText);
			} catch (NumberFormatException formatException) {
				log.warn("Ignoring non-numeric priority " + priorityText + " on " + name);
			}
		}
		
		return DnsRecord.Create(
				id,
				type,
				name,
				ttl,
				ResponseInterpreter.getOptionalString(object, "content"),
				priority);
	}
	
	private static @NonNull String requireString(
			@NonNull JsonObject object,
			@NonNull String key) throws DnsApiException
	{
		String value= ResponseInterpreter.getOptionalString(object, key);
		if (value == null) {
			throw new DnsApiException("Record in API response is missing " + key);
		}
		return value;
	}
}
