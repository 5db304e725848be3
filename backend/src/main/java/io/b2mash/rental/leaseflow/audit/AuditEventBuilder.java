package io.b2mash.rental.leaseflow.audit;

import io.b2mash.rental.leaseflow.contract.Actor;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates source, IP address, and user
 * agent from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}, {@code contractId}.
 * Without an {@link #actor(Actor)} the event is recorded as a SYSTEM action.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("contract.status_changed")
 *     .entityType("contract")
 *     .entityId(contract.getId())
 *     .contractId(contract.getId())
 *     .actor(actor)
 *     .detail("from", "DRAFT")
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  public static final String SYSTEM_ACTOR = "SYSTEM";

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID contractId;
  private UUID actorId;
  private String actorType = SYSTEM_ACTOR;
  private String source;
  private final Map<String, Object> details = new LinkedHashMap<>();

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder contractId(UUID contractId) {
    this.contractId = contractId;
    return this;
  }

  /** Records the acting party. A null actor leaves the event attributed to the system. */
  public AuditEventBuilder actor(Actor actor) {
    if (actor != null) {
      this.actorId = actor.partyId();
      this.actorType = actor.role().name();
    }
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  /** Adds one detail entry. Null values are skipped. */
  public AuditEventBuilder detail(String key, Object value) {
    if (value != null) {
      this.details.put(key, value);
    }
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    if (details != null) {
      details.forEach(this::detail);
    }
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}. {@code source} defaults to "API" inside an HTTP request
   * and "INTERNAL" otherwise.
   */
  public AuditEventRecord build() {
    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = this.source;
    if (resolvedSource == null) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        contractId,
        actorId,
        actorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        Map.copyOf(details));
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
