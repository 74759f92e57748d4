package com.example.translator.security.filter;

import static com.example.translator.util.RequestUtil.maskToken;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.exception.AuthException;
import com.example.translator.service.AuthService;
import com.example.translator.util.RequestUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying an {@code Authorization: Bearer <token>} header.
 * A resolved session puts an {@link AuthenticatedUser} principal into the security context;
 * otherwise the context stays empty and the entry point answers 401 with the reason recorded
 * under {@link #AUTH_ERROR_ATTRIBUTE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  public static final String AUTH_ERROR_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".ERROR";
  public static final String MISSING_TOKEN = "Missing auth token";

  private final AuthService authService;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Optional<String> token = RequestUtil.getBearerToken(request);

    if (token.isEmpty()) {
      request.setAttribute(AUTH_ERROR_ATTRIBUTE, MISSING_TOKEN);
    } else {
      try {
        Optional<AuthenticatedUser> user = authService.authenticate(token.get());
        if (user.isPresent()) {
          UsernamePasswordAuthenticationToken authentication =
              new UsernamePasswordAuthenticationToken(user.get(), null, Collections.emptyList());
          SecurityContext context = SecurityContextHolder.createEmptyContext();
          context.setAuthentication(authentication);
          SecurityContextHolder.setContext(context);
          log.trace("Authenticated session {} for user {}", maskToken(token.get()), user.get().username());
        } else {
          log.debug("Rejected bearer token {}", maskToken(token.get()));
          request.setAttribute(AUTH_ERROR_ATTRIBUTE, AuthException.INVALID_SESSION);
        }
      } catch (Exception e) {
        log.error("An unexpected error occurred during session authentication.", e);
        request.setAttribute(AUTH_ERROR_ATTRIBUTE, AuthException.INVALID_SESSION);
      }
    }

    filterChain.doFilter(request, response);
  }
}
