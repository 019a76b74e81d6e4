package com.teaglu.dnsclient.dns;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

/**
 * RecordFilter
 * 
 * Which records a listing keeps: those whose name contains the requested name, and optionally
 * only one type.
 * 
 * The name test is a plain substring test, so a filter for contoso.com also accepts
 * notcontoso.com if the provider returns it.  It is case sensitive; the provider returns names
 * in lower case.
 */
public class RecordFilter {
	private final @NonNull String domainOrSubdomain;
	private final @Nullable DnsRecordType recordType;
	
	private RecordFilter(
			@NonNull String domainOrSubdomain,
			@Nullable DnsRecordType recordType)
	{
		this.domainOrSubdomain= domainOrSubdomain;
		this.recordType= recordType;
	}
	
	public static @NonNull RecordFilter Create(
			@NonNull String domainOrSubdomain,
			@Nullable DnsRecordType recordType)
	{
		return new RecordFilter(domainOrSubdomain, recordType);
	}
	
	public @NonNull String getDomainOrSubdomain() {
		return domainOrSubdomain;
	}
	
	public @Nullable DnsRecordType getRecordType() {
		return recordType;
	}
	
	public boolean matchesName(@NonNull String name) {
		return name.contains(domainOrSubdomain);
	}
	
	public boolean matchesType(@NonNull String type) {
		return (recordType == null) || recordType.name().equals(type);
	}
}
