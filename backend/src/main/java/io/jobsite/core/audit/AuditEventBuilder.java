package io.jobsite.core.audit;

import io.jobsite.core.security.JwtClaims;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor and source from the
 * current security and request context when they are not set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("approval_request.created")
 *     .entityType("approval_request")
 *     .entityId(request.getId())
 *     .details(Map.of("workflow_id", workflowId.toString()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String source;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

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

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. {@code actorId} falls back to the authenticated JWT subject, {@code
   * actorType} is USER when an actor is known and SYSTEM otherwise, and {@code source} is API
   * inside an HTTP request and INTERNAL outside one unless set explicitly.
   */
  public AuditEventRecord build() {
    UUID resolvedActorId = actorIdExplicitlySet ? this.actorId : currentSubject();
    String resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";

    String resolvedSource = this.source;
    if (resolvedSource == null) {
      resolvedSource =
          RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes
              ? "API"
              : "INTERNAL";
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        details);
  }

  private static UUID currentSubject() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof JwtAuthenticationToken jwtAuth) {
      return JwtClaims.memberIdOrNull(jwtAuth.getToken());
    }
    return null;
  }
}
