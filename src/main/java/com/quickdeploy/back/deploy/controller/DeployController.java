package com.quickdeploy.back.deploy.controller;

import com.quickdeploy.back.deploy.model.DeployPageResponse;
import com.quickdeploy.back.deploy.model.DeployStatusResponse;
import com.quickdeploy.back.deploy.model.DeploySuccessResponse;
import com.quickdeploy.back.deploy.model.IndexResponse;
import com.quickdeploy.back.deploy.service.DeploymentService;
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
import java.util.Map;

/**
 * Deploy wizard routes. Each handler opens the session from its cookie, works on it,
 * and sends it back only when it changed.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DeployController {

    private final DeploymentService deploymentService;
    private final SessionCookieService sessionCookies;

    /**
     * GET /
     */
    @GetMapping("/")
    public ResponseEntity<IndexResponse> index(@RequestParam(required = false) String repository) {
        return ResponseEntity.ok(new IndexResponse(repository));
    }

    /**
     * GET /{owner}/{repo}
     * Deploy wizard page
     */
    @GetMapping("/{owner}/{repo}")
    public ResponseEntity<DeployPageResponse> deployPage(@PathVariable String owner,
                                                         @PathVariable String repo,
                                                         HttpServletRequest request) {
        String srcNwo = owner + "/" + repo;
        log.info(">> [DeployController] Deploy page for {}", srcNwo);

        SessionContext session = sessionCookies.open(request);
        DeployPageResponse page = deploymentService.viewDeployPage(session, srcNwo);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.returnToCookie("/" + srcNwo));
        return withSession(response, session).body(page);
    }

    /**
     * POST /fork
     */
    @PostMapping("/fork")
    public ResponseEntity<Void> fork(@RequestParam String repository,
                                     @RequestParam(required = false) String name,
                                     HttpServletRequest request) {
        log.info(">> [DeployController] Forking {}", repository);

        SessionContext session = sessionCookies.open(request);
        deploymentService.fork(session, repository, name);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create("/" + repository));
        return withSession(response, session).build();
    }

    /**
     * POST /deploy
     */
    @PostMapping("/deploy")
    public ResponseEntity<DeploySuccessResponse> deploy(@RequestParam String repository,
                                                        @RequestParam(name = "service_name", required = false) String serviceName,
                                                        @RequestParam Map<String, String> form,
                                                        HttpServletRequest request) {
        log.info(">> [DeployController] Deploying {}", repository);

        SessionContext session = sessionCookies.open(request);
        DeploySuccessResponse result = deploymentService.deploy(session, repository, serviceName, form);

        return withSession(ResponseEntity.ok(), session).body(result);
    }

    /**
     * GET /deploy/status
     * Deployment status, polled by the front end
     */
    @GetMapping("/deploy/status")
    public ResponseEntity<DeployStatusResponse> status(HttpServletRequest request) {
        log.debug(">> [DeployController] Status check");

        SessionContext session = sessionCookies.open(request);
        DeployStatusResponse status = deploymentService.checkStatus(session);

        return withSession(ResponseEntity.ok(), session).body(status);
    }

    /**
     * POST /deploy/reset
     */
    @PostMapping("/deploy/reset")
    public ResponseEntity<Void> reset(HttpServletRequest request) {
        log.info(">> [DeployController] Resetting deployment");

        SessionContext session = sessionCookies.open(request);
        deploymentService.reset(session);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(sessionCookies.returnLocation(request)));
        return withSession(response, session).build();
    }

    private ResponseEntity.BodyBuilder withSession(ResponseEntity.BodyBuilder response, SessionContext session) {
        if (session.isModified()) {
            response.header(HttpHeaders.SET_COOKIE, sessionCookies.sessionCookie(session));
        }
        return response;
    }
}
