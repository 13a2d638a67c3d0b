package io.intellixity.restquery.examples.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the caller's roles from {@value #ROLES_HEADER} (comma separated) into the
 * {@value #ROLES_ATTRIBUTE} request attribute. Requests to {@code /api/} without roles are rejected.
 */
@Component
public final class CallerRolesFilter extends OncePerRequestFilter {
  public static final String ROLES_HEADER = "X-User-Roles";
  public static final String ROLES_ATTRIBUTE = "restquery.roles";

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    List<String> roles = parseRoles(request.getHeader(ROLES_HEADER));
    if (roles.isEmpty()) {
      response.sendError(401, "Missing required header: " + ROLES_HEADER);
      return;
    }
    request.setAttribute(ROLES_ATTRIBUTE, roles);
    filterChain.doFilter(request, response);
  }

  static List<String> parseRoles(String raw) {
    if (raw == null || raw.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String r : raw.split(",")) {
      String t = r.trim();
      if (!t.isEmpty() && !out.contains(t)) out.add(t);
    }
    return List.copyOf(out);
  }
}
