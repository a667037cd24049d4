package com.quickdeploy.back.deploy.controller;

import com.quickdeploy.back.common.error.ExternalApiException;
import com.quickdeploy.back.common.error.GlobalExceptionHandler;
import com.quickdeploy.back.common.error.MissingValueException;
import com.quickdeploy.back.common.error.PreconditionException;
import com.quickdeploy.back.deploy.model.DeployPageResponse;
import com.quickdeploy.back.deploy.model.DeployStatusResponse;
import com.quickdeploy.back.deploy.model.DeploySuccessResponse;
import com.quickdeploy.back.deploy.service.DeploymentService;
import com.quickdeploy.back.manifest.model.BackendSpec;
import com.quickdeploy.back.manifest.model.DeployConfigSpec;
import com.quickdeploy.back.manifest.model.DictionaryItemSpec;
import com.quickdeploy.back.manifest.model.DictionarySpec;
import com.quickdeploy.back.session.model.DeploymentState;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.model.SessionState;
import com.quickdeploy.back.session.model.WorkflowStage;
import com.quickdeploy.back.session.service.SessionCookieService;
import com.quickdeploy.back.session.service.SessionStateCodec;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DeployControllerTest {

    private static final String SRC = "fastly/starter";

    private final SessionStateCodec codec = new SessionStateCodec();
    private DeploymentService deployments;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        deployments = mock(DeploymentService.class);
        mvc = MockMvcBuilders.standaloneSetup(new DeployController(deployments, new SessionCookieService(codec)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void indexEchoesRequestedRepository() throws Exception {
        mvc.perform(get("/").param("repository", SRC))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buttonNwo").value(SRC));
    }

    @Test
    void deployPageSetsReturnToAndSessionCookies() throws Exception {
        when(deployments.viewDeployPage(any(), eq(SRC))).thenAnswer(invocation -> {
            SessionContext session = invocation.getArgument(0);
            session.updateDeployment(DeploymentState.builder().src(SRC).build());
            return DeployPageResponse.builder().stage(WorkflowStage.SOURCE_SELECTED).canFork(true).build();
        });

        MvcResult result = mvc.perform(get("/fastly/starter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("SOURCE_SELECTED"))
                .andExpect(jsonPath("$.canFork").value(true))
                .andReturn();

        List<String> cookies = result.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        assertThat(cookies).anySatisfy(c -> assertThat(c).startsWith("Return-To=/fastly/starter;"));
        assertThat(sessionFrom(cookies).getDeployment().getSrc()).isEqualTo(SRC);
    }

    @Test
    void deployPageRendersRequestedResources() throws Exception {
        DeployConfigSpec spec = new DeployConfigSpec(
                List.of(new BackendSpec("origin", "example.com", null, "Origin host")),
                List.of(new DictionarySpec("config", null,
                        List.of(new DictionaryItemSpec("greeting", "string", "Greeting", "hello")))));
        when(deployments.viewDeployPage(any(), eq(SRC)))
                .thenReturn(DeployPageResponse.builder().configSpec(spec).build());

        mvc.perform(get("/fastly/starter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configSpec.backends[0].name").value("origin"))
                .andExpect(jsonPath("$.configSpec.backends[0].address").value("example.com"))
                .andExpect(jsonPath("$.configSpec.dictionaries[0].items[0].key").value("greeting"))
                .andExpect(jsonPath("$.configSpec.dictionaries[0].items[0].input_type").value("string"));
    }

    @Test
    void unchangedSessionIsNotResent() throws Exception {
        when(deployments.viewDeployPage(any(), eq(SRC))).thenReturn(DeployPageResponse.builder().build());

        MvcResult result = mvc.perform(get("/fastly/starter")).andExpect(status().isOk()).andReturn();

        assertThat(result.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .noneMatch(c -> c.startsWith(SessionCookieService.SESSION_COOKIE));
    }

    @Test
    void forkRedirectsToSourcePage() throws Exception {
        when(deployments.fork(any(), eq(SRC), isNull())).thenAnswer(invocation -> {
            SessionContext session = invocation.getArgument(0);
            session.updateDeployment(DeploymentState.builder().src(SRC).dest("octocat/starter").build());
            return "octocat/starter";
        });

        MvcResult result = mvc.perform(post("/fork").param("repository", SRC))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/fastly/starter"))
                .andReturn();

        assertThat(sessionFrom(result.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .getDeployment().getDest()).isEqualTo("octocat/starter");
    }

    @Test
    void deployPassesFormFields() throws Exception {
        when(deployments.deploy(any(), eq(SRC), eq("my-app"), anyMap())).thenReturn(DeploySuccessResponse.builder()
                .applicationUrl("https://my-app.edgecompute.app")
                .actionsUrl("https://github.com/octocat/starter/actions")
                .repoNwo("octocat/starter")
                .serviceId("svc-1")
                .build());

        mvc.perform(post("/deploy")
                        .param("repository", SRC)
                        .param("service_name", "my-app")
                        .param("dict.config.greeting", "hi"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applicationUrl").value("https://my-app.edgecompute.app"))
                .andExpect(jsonPath("$.serviceId").value("svc-1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> form = ArgumentCaptor.forClass(Map.class);
        verify(deployments).deploy(any(), eq(SRC), eq("my-app"), form.capture());
        assertThat(form.getValue()).containsEntry("dict.config.greeting", "hi");
    }

    @Test
    void missingDictionaryValueIsUnprocessable() throws Exception {
        when(deployments.deploy(any(), eq(SRC), isNull(), anyMap())).thenThrow(new MissingValueException("greeting"));

        mvc.perform(post("/deploy").param("repository", SRC))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("No value provided for dictionary key greeting"));
    }

    @Test
    void providerFailureIsBadGateway() throws Exception {
        when(deployments.deploy(any(), eq(SRC), isNull(), anyMap()))
                .thenThrow(new ExternalApiException("Fastly", 400, "Unable to create domain x: taken"));

        mvc.perform(post("/deploy").param("repository", SRC))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("EXTERNAL_API_ERROR"))
                .andExpect(jsonPath("$.message").value("Unable to create domain x: taken"));
    }

    @Test
    void statusWithoutServiceIsConflict() throws Exception {
        when(deployments.checkStatus(any())).thenThrow(new PreconditionException("No service has been provisioned"));

        mvc.perform(get("/deploy/status"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("No service has been provisioned"));
    }

    @Test
    void statusReportsActiveService() throws Exception {
        when(deployments.checkStatus(any())).thenReturn(DeployStatusResponse.builder()
                .serviceId("svc-1").active(true).applicationUrl("https://my-app.edgecompute.app").build());

        mvc.perform(get("/deploy/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void resetReturnsToLastPage() throws Exception {
        SessionState state = new SessionState();
        state.setDeployment(DeploymentState.builder().src(SRC).dest("octocat/starter").build());

        mvc.perform(post("/deploy/reset")
                        .cookie(new Cookie(SessionCookieService.SESSION_COOKIE, codec.encode(state)),
                                new Cookie(SessionCookieService.RETURN_TO_COOKIE, "/fastly/starter")))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/fastly/starter"));

        ArgumentCaptor<SessionContext> session = ArgumentCaptor.forClass(SessionContext.class);
        verify(deployments).reset(session.capture());
        assertThat(session.getValue().getDeployment().getDest()).isEqualTo("octocat/starter");
    }

    private SessionState sessionFrom(List<String> setCookies) {
        String header = setCookies.stream()
                .filter(c -> c.startsWith(SessionCookieService.SESSION_COOKIE + "="))
                .findFirst()
                .orElseThrow();
        return codec.decode(header.substring(header.indexOf('=') + 1, header.indexOf(';')));
    }
}
