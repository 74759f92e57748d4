package com.example.translator.security.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.translator.domain.entity.AuthenticatedUser;
import com.example.translator.exception.AuthException;
import com.example.translator.service.AuthService;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class SessionAuthenticationFilterTest {

  private final AuthService authService = mock(AuthService.class);
  private final SessionAuthenticationFilter filter = new SessionAuthenticationFilter(authService);

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validTokenAuthenticatesRequest() throws Exception {
    AuthenticatedUser user = new AuthenticatedUser("mara", "token-123456", "blob");
    when(authService.authenticate("token-123456")).thenReturn(Optional.of(user));
    MockHttpServletRequest request = request("Bearer token-123456");
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication.getPrincipal()).isEqualTo(user);
    assertThat(authentication.isAuthenticated()).isTrue();
    assertThat(chain.getRequest()).isSameAs(request);
  }

  @Test
  void missingHeaderRecordsReasonAndContinues() throws Exception {
    MockHttpServletRequest request = request(null);
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(request.getAttribute(SessionAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
        .isEqualTo(SessionAuthenticationFilter.MISSING_TOKEN);
    assertThat(chain.getRequest()).isSameAs(request);
  }

  @Test
  void unresolvedTokenIsReportedAsInvalidSession() throws Exception {
    when(authService.authenticate("stale")).thenReturn(Optional.empty());
    MockHttpServletRequest request = request("Bearer stale");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(request.getAttribute(SessionAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
        .isEqualTo(AuthException.INVALID_SESSION);
  }

  @Test
  void storeFailureIsTreatedAsInvalidSession() throws Exception {
    when(authService.authenticate("token")).thenThrow(new IllegalStateException("redis down"));
    MockHttpServletRequest request = request("Bearer token");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(request.getAttribute(SessionAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
        .isEqualTo(AuthException.INVALID_SESSION);
  }

  @Test
  void nonBearerSchemeCountsAsMissing() throws Exception {
    MockHttpServletRequest request = request("Basic bWFyYTpwdw==");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(request.getAttribute(SessionAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
        .isEqualTo(SessionAuthenticationFilter.MISSING_TOKEN);
  }

  private static MockHttpServletRequest request(String authorization) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
    if (authorization != null) {
      request.addHeader("Authorization", authorization);
    }
    return request;
  }
}
