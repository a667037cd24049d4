package com.quickdeploy.back.session.service;

import com.quickdeploy.back.session.model.LoginState;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.model.SessionState;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class SessionCookieServiceTest {

    private final SessionStateCodec codec = new SessionStateCodec();
    private final SessionCookieService cookies = new SessionCookieService(codec);

    @Test
    void opensEmptySessionWithoutCookie() {
        SessionContext session = cookies.open(new MockHttpServletRequest());

        assertThat(session.getState()).isEqualTo(SessionState.empty());
        assertThat(session.isModified()).isFalse();
    }

    @Test
    void opensSessionFromCookie() {
        SessionState state = SessionState.empty();
        state.setLogin(new LoginState("gho_abc", null));
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionCookieService.SESSION_COOKIE, codec.encode(state)));

        assertThat(cookies.open(request).getLogin().getGithubToken()).isEqualTo("gho_abc");
    }

    @Test
    void picksSessionCookieAmongOthers() {
        SessionState state = SessionState.empty();
        state.setLogin(new LoginState("gho_xyz", null));
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("_ga", "GA1.1.123"),
                new Cookie(SessionCookieService.RETURN_TO_COOKIE, "/deploy"),
                new Cookie(SessionCookieService.SESSION_COOKIE, codec.encode(state)));

        assertThat(cookies.open(request).getLogin().getGithubToken()).isEqualTo("gho_xyz");
        assertThat(cookies.returnLocation(request)).isEqualTo("/deploy");
    }

    @Test
    void sessionCookieIsSecureAndHttpOnly() {
        String header = cookies.sessionCookie(new SessionContext(SessionState.empty()));

        assertThat(header)
                .startsWith(SessionCookieService.SESSION_COOKIE + "=")
                .contains("Path=/", "Secure", "HttpOnly");
    }

    @Test
    void returnLocationOnlyAcceptsLocalPaths() {
        assertThat(cookies.returnLocation(withReturnTo("/fastly/starter"))).isEqualTo("/fastly/starter");
        assertThat(cookies.returnLocation(withReturnTo("https://evil.example"))).isEqualTo("/");
        assertThat(cookies.returnLocation(withReturnTo("//evil.example"))).isEqualTo("/");
        assertThat(cookies.returnLocation(new MockHttpServletRequest())).isEqualTo("/");
    }

    private static MockHttpServletRequest withReturnTo(String value) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie(SessionCookieService.RETURN_TO_COOKIE, value));
        return request;
    }
}
