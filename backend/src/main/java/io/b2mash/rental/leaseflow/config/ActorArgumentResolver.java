package io.b2mash.rental.leaseflow.config;

import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.exception.InvalidStateException;
import java.util.Locale;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link Actor} controller parameters from the {@code X-Actor-Role} and {@code
 * X-Actor-Id} headers. The workflow never reads identity from anywhere else.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

  public static final String ROLE_HEADER = "X-Actor-Role";
  public static final String ID_HEADER = "X-Actor-Id";

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return Actor.class.equals(parameter.getParameterType());
  }

  @Override
  public Actor resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    return new Actor(
        parseRole(webRequest.getHeader(ROLE_HEADER)), parseId(webRequest.getHeader(ID_HEADER)));
  }

  private static PartyRole parseRole(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidStateException("Missing actor", ROLE_HEADER + " header is required");
    }
    try {
      return PartyRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid actor", "Unknown actor role: " + value);
    }
  }

  private static UUID parseId(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidStateException("Missing actor", ID_HEADER + " header is required");
    }
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid actor", ID_HEADER + " must be a UUID");
    }
  }
}
