package com.quickdeploy.back.auth.controller;

import com.quickdeploy.back.auth.model.OAuthProvider;
import com.quickdeploy.back.auth.service.AuthCoordinator;
import com.quickdeploy.back.common.error.ErrorResponse;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.service.SessionCookieService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * Sign-in routes for GitHub and Fastly
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthCoordinator authCoordinator;
    private final SessionCookieService sessionCookies;

    /**
     * GET /oauth/{provider}
     */
    @GetMapping("/oauth/{provider}")
    public ResponseEntity<Void> authorize(@PathVariable String provider) {
        String location = authCoordinator.authorizeUrl(OAuthProvider.fromPath(provider));
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }

    /**
     * GET /oauth/{provider}/callback?code=...
     */
    @GetMapping("/oauth/{provider}/callback")
    public ResponseEntity<?> callback(@PathVariable String provider,
                                      @RequestParam(required = false) String code,
                                      HttpServletRequest request) {
        if (code == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("BAD_REQUEST", "No auth 'code' param provided"));
        }
        log.info(">> [AuthController] OAuth callback from {}", provider);

        SessionContext session = sessionCookies.open(request);
        authCoordinator.completeAuthorization(OAuthProvider.fromPath(provider), code, session);

        return redirectBack(request, session);
    }

    /**
     * POST /auth/fastly
     * Sign in to Fastly with a pasted API token
     */
    @PostMapping("/auth/fastly")
    public ResponseEntity<?> fastlyToken(@RequestParam String token, HttpServletRequest request) {
        log.info(">> [AuthController] Fastly token sign-in");

        SessionContext session = sessionCookies.open(request);
        authCoordinator.authenticateFastlyToken(token, session);

        return redirectBack(request, session);
    }

    /**
     * POST /auth/reset
     */
    @PostMapping("/auth/reset")
    public ResponseEntity<?> reset(HttpServletRequest request) {
        log.info(">> [AuthController] Signing out");

        SessionContext session = sessionCookies.open(request);
        authCoordinator.resetLogin(session);

        return redirectBack(request, session);
    }

    private ResponseEntity<Void> redirectBack(HttpServletRequest request, SessionContext session) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(sessionCookies.returnLocation(request)))
                .header(HttpHeaders.SET_COOKIE, sessionCookies.sessionCookie(session))
                .build();
    }
}
