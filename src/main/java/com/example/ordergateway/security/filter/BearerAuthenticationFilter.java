package com.example.ordergateway.security.filter;

import com.example.ordergateway.security.AuthGuard;
import com.example.ordergateway.security.GuardFailure;
import com.example.ordergateway.security.GuardResult;
import com.example.ordergateway.web.rest.errors.ErrorResponses;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates protected requests from the {@code Authorization: Bearer} header.
 * All decisions are delegated to {@link AuthGuard}; rejected requests never reach a controller.
 *
 * Not a Spring bean: it is only installed in the protected filter chain.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerAuthenticationFilter extends OncePerRequestFilter {

  private final AuthGuard authGuard;
  private final ObjectMapper objectMapper;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    GuardResult result = authGuard.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));

    if (result.isAuthenticated()) {
      SecurityContextHolder.getContext().setAuthentication(
          UsernamePasswordAuthenticationToken.authenticated(result.user(), null, List.of()));
      log.trace("Authenticated {} for {}", result.user().username(), request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }

    SecurityContextHolder.clearContext();
    if (result.failure() == GuardFailure.FORBIDDEN) {
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, ErrorResponses.INACTIVE_USER);
    } else {
      response.setHeader(HttpHeaders.WWW_AUTHENTICATE, ErrorResponses.BEARER_CHALLENGE);
      writeError(response, HttpServletResponse.SC_UNAUTHORIZED, ErrorResponses.INVALID_CREDENTIALS);
    }
  }

  private void writeError(HttpServletResponse response, int status, String detail) throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), ErrorResponses.body(detail));
  }
}
