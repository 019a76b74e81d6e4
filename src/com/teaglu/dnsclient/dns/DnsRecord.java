package com.teaglu.dnsclient.dns;

import org.eclipse.jdt.annotation.NonNull;
import org.eclipse.jdt.annotation.Nullable;

/**
 * DnsRecord
 * 
 * Immutable copy of one provider-side record, as returned by a listing.
 */
public class DnsRecord {
	/**
	 * TTL value the provider uses to mean "automatic"
	 */
	public static final int AUTOMATIC_TTL= 1;
	
	private final @NonNull String id;
	private final @NonNull DnsRecordType type;
	private final @NonNull String name;
	private final int ttl;
	private final @Nullable String content;
	private final @Nullable Integer priority;
	
	private DnsRecord(
			@NonNull String id,
			@NonNull DnsRecordType type,
			@NonNull String name,
			int ttl,
			@Nullable String content,
			@Nullable Integer priority)
	{
		this.id= id;
		this.type= type;
		this.name= name;
		this.ttl= ttl;
		this.content= content;
		this.priority= priority;
	}
	
	public static @NonNull DnsRecord Create(
			@NonNull String id,
			@NonNull DnsRecordType type,
			@NonNull String name,
			int ttl,
			@Nullable String content,
			@Nullable Integer priority)
	{
		// An empty content string is treated the same as no content
		String storedContent= ((content == null) || content.isEmpty()) ? null : content;
		
		return new DnsRecord(id, type, name, ttl, storedContent, priority);
	}
	
	/**
	 * getId
	 * 
	 * Provider identifier, needed to delete the record.
	 * 
	 * @return							Record ID
	 */
	public @NonNull String getId() {
		return id;
	}
	
	public @NonNull DnsRecordType getType() {
		return type;
	}
	
	/**
	 * getName
	 * 
	 * Fully qualified name, i.e. www.contoso.com
	 * 
	 * @return							Name
	 */
	public @NonNull String getName() {
		return name;
	}
	
	public int getTtl() {
		return ttl;
	}
	
	public boolean isAutomaticTtl() {
		return ttl == AUTOMATIC_TTL;
	}
	
	/**
	 * getContent
	 * 
	 * Record value (address, target host, text), or null if the provider didn't return one.
	 * 
	 * @return							Content
	 */
	public @Nullable String getContent() {
		return content;
	}
	
	public @Nullable Integer getPriority() {
		return priority;
	}
	
	@Override
	public String toString() {
		StringBuilder builder= new StringBuilder();
		builder.append(name);
		builder.append(" ");
		builder.append(type);
		builder.append(" ttl=");
		builder.append(isAutomaticTtl() ? "auto" : String.valueOf(ttl));
		if (content != null) {
			builder.append(" ");
			builder.append(content);
		}
		builder.append(" [");
		builder.append(id);
		builder.append("]");
		
		return builder.toString();
	}
}
