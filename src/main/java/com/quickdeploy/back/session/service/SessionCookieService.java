package com.quickdeploy.back.session.service;

import com.quickdeploy.back.session.model.SessionContext;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;
import org.springframework.web.util.WebUtils;

/**
 * Reads the session and return-location cookies and builds their Set-Cookie values.
 */
@Service
@RequiredArgsConstructor
public class SessionCookieService {

    public static final String SESSION_COOKIE = "__Secure-QD-Session";

    /** Page the user goes back to after an OAuth round trip */
    public static final String RETURN_TO_COOKIE = "Return-To";

    private final SessionStateCodec codec;

    public SessionContext open(HttpServletRequest request) {
        return new SessionContext(codec.decode(readCookie(request, SESSION_COOKIE)));
    }

    public String returnLocation(HttpServletRequest request) {
        String location = readCookie(request, RETURN_TO_COOKIE);
        // only local paths, never an absolute URL
        if (location == null || !location.startsWith("/") || location.startsWith("//")) {
            return "/";
        }
        return location;
    }

    public String sessionCookie(SessionContext context) {
        return cookie(SESSION_COOKIE, codec.encode(context.getState()));
    }

    public String returnToCookie(String path) {
        return cookie(RETURN_TO_COOKIE, path);
    }

    private String cookie(String name, String value) {
        return ResponseCookie.from(name, value)
                .secure(true)
                .httpOnly(true)
                .path("/")
                .build()
                .toString();
    }

    private static String readCookie(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        return cookie == null ? null : cookie.getValue();
    }
}
