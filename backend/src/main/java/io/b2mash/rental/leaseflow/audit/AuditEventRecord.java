package io.b2mash.rental.leaseflow.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in source and request metadata.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "contract", "invitation")
 * @param entityId ID of the affected entity
 * @param contractId contract whose history this entry belongs to
 * @param actorId party id of the acting party; null for system-initiated events
 * @param actorType LANDLORD, TENANT, GUARANTOR or SYSTEM
 * @param source origin of the action: API, INTERNAL, SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field changes; values are stored as strings
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID contractId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
