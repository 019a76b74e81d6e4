package com.teaglu.dnsclient.dns.cloudflare;

import java.util.List;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

import com.teaglu.dnsclient.dns.DnsRecord;
import com.teaglu.dnsclient.dns.exception.DnsException;

/**
 * CloudflareDnsClient
 * 
 * List, create and delete DNS records through the legacy Cloudflare client API.  Record types are
 * given as names (A, CNAME, MX, TXT, SPF, AAAA, NS, SRV, LOC) in any case; anything else fails
 * with an INVALID_INPUT error before a request is sent.
 * 
 * Every method either succeeds completely or throws exactly one DnsException, whose getKind()
 * tells what went wrong.  Nothing is retried.
 */
public interface CloudflareDnsClient {
	/**
	 * Default type for new records
	 */
	public static final String DEFAULT_TYPE= "A";
	
	/**
	 * listRecords
	 * 
	 * Return the records of the zone whose name contains the given name.  Passing the bare
	 * domain returns the domain and all of its subdomains.  Only the first record seen for a
	 * given name is returned.
	 * 
	 * @param domainOrSubdomain			Domain or subdomain, i.e. www.contoso.com
	 * @param recordType				Only return this type, or null for all types
	 * 
	 * @return							Records in the order the provider returned them
	 * 
	 * @throws DnsException
	 */
	public @NonNull List<@NonNull DnsRecord> listRecords(
			@NonNull String domainOrSubdomain,
			@Nullable String recordType) throws DnsException;
	
	public default @NonNull List<@NonNull DnsRecord> listRecords(
			@NonNull String domainOrSubdomain) throws DnsException
	{
		return listRecords(domainOrSubdomain, null);
	}
	
	/**
	 * createRecord
	 * 
	 * Create a record and return the listing for its name afterwards.
	 * 
	 * The content has to be an IPv4 or IPv6 literal whatever the type is, so CNAME or TXT
	 * records can't be created through this call.
	 * 
	 * @param recordName				Fully qualified name of the new record
	 * @param content					Address the record points to
	 * @param recordType				Record type
	 * @param ttl						TTL in seconds, 1 for automatic
	 * @param priority					Priority, only sent if it isn't zero
	 * 
	 * @return							Records for recordName after the create
	 * 
	 * @throws DnsException
	 */
	public @NonNull List<@NonNull DnsRecord> createRecord(
			@NonNull String recordName,
			@NonNull String content,
			@NonNull String recordType,
			int ttl,
			int priority) throws DnsException;
	
	public default @NonNull List<@NonNull DnsRecord> createRecord(
			@NonNull String recordName,
			@NonNull String content) throws DnsException
	{
		return createRecord(recordName, content, DEFAULT_TYPE, DnsRecord.AUTOMATIC_TTL, 0);
	}
	
	/**
	 * deleteRecords
	 * 
	 * Delete every record the matching listing returns, one request per record, stopping at
	 * the first failure.  Deleting the A record (or all records) of a bare domain is refused.
	 * 
	 * The provider may take a while to apply deletes, so an immediate listing can still show
	 * the deleted records.
	 * 
	 * @param domainOrSubdomain			Domain or subdomain
	 * @param recordType				Only delete this type, or null for all types
	 * 
	 * @return							Always an empty list
	 * 
	 * @throws DnsException
	 */
	public @NonNull List<@NonNull DnsRecord> deleteRecords(
			@NonNull String domainOrSubdomain,
			@Nullable String recordType) throws DnsException;
	
	public default @NonNull List<@NonNull DnsRecord> deleteRecords(
			@NonNull String domainOrSubdomain) throws DnsException
	{
		return deleteRecords(domainOrSubdomain, null);
	}
}
