package com.quickdeploy.back.deploy.service;

import com.quickdeploy.back.auth.model.IdentityView;
import com.quickdeploy.back.auth.service.AuthCoordinator;
import com.quickdeploy.back.client.github.GitHubApi;
import com.quickdeploy.back.client.github.GitHubFile;
import com.quickdeploy.back.client.github.GitHubRepository;
import com.quickdeploy.back.common.error.NotATemplateException;
import com.quickdeploy.back.common.error.PreconditionException;
import com.quickdeploy.back.common.error.ResourceNotFoundException;
import com.quickdeploy.back.deploy.model.CreatedService;
import com.quickdeploy.back.deploy.model.DeployPageResponse;
import com.quickdeploy.back.deploy.model.DeployStatusResponse;
import com.quickdeploy.back.deploy.model.DeploySuccessResponse;
import com.quickdeploy.back.deploy.model.ProvisioningRequest;
import com.quickdeploy.back.manifest.model.DeployConfigSpec;
import com.quickdeploy.back.manifest.model.EditableManifest;
import com.quickdeploy.back.manifest.service.ManifestSpecParser;
import com.quickdeploy.back.session.model.DeploymentState;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.model.WorkflowStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Business logic behind the wizard routes. Every method works on the request's {@link SessionContext};
 * the caller writes the context back to the client.
 */
@Slf4j
@Service
public class DeploymentService {

    /** Prefix of form fields carrying dictionary values: dict.&lt;dictionary&gt;.&lt;key&gt; */
    public static final String DICTIONARY_FIELD_PREFIX = "dict.";

    private final GitHubApi github;
    private final AuthCoordinator auth;
    private final ManifestSpecParser parser;
    private final ProvisioningPipeline pipeline;
    private final DeploymentStatusPoller poller;
    private final DeploymentWorkflow workflow;

    private final String manifestPath;
    private final boolean requireTemplate;

    public DeploymentService(GitHubApi github,
                             AuthCoordinator auth,
                             ManifestSpecParser parser,
                             ProvisioningPipeline pipeline,
                             DeploymentStatusPoller poller,
                             DeploymentWorkflow workflow,
                             @Value("${quickdeploy.github.manifest-path:fastly.toml}") String manifestPath,
                             @Value("${quickdeploy.github.require-template:true}") boolean requireTemplate) {
        this.github = github;
        this.auth = auth;
        this.parser = parser;
        this.pipeline = pipeline;
        this.poller = poller;
        this.workflow = workflow;
        this.manifestPath = manifestPath;
        this.requireTemplate = requireTemplate;
    }

    /**
     * Wizard view for a source repository. Also records it as the selected source.
     */
    public DeployPageResponse viewDeployPage(SessionContext session, String srcNwo) {
        IdentityView identities = auth.resolveIdentities(session);

        // anonymous lookup, only public templates can be deployed
        GitHubRepository repo = github.fetchRepository(null, srcNwo)
                .orElseThrow(() -> new ResourceNotFoundException("No repository was found at github.com/" + srcNwo));

        DeployConfigSpec spec = github.getFile(null, srcNwo, manifestPath)
                .map(file -> parser.parseSpec(file.getContent()))
                .orElse(null);

        workflow.selectSource(session, srcNwo);
        Optional<String> dest = session.getDeployment().resolveDestination(srcNwo);
        WorkflowStage stage = workflow.stage(session, srcNwo);

        return DeployPageResponse.builder()
                .src(repo)
                .destNwo(dest.orElse(null))
                .githubUser(identities.getGithubUser())
                .fastlyUser(identities.getFastlyUser())
                .canFork(identities.isGithubAuthenticated() && dest.isEmpty())
                .canDeploy(identities.isGithubAuthenticated() && identities.isFastlyAuthenticated()
                        && stage == WorkflowStage.FORKED)
                .stage(stage)
                .configSpec(spec)
                .build();
    }

    /**
     * Creates the user's copy of the source repository.
     *
     * @param name destination repository name, defaults to the source's name
     * @return the created repository's nwo
     */
    public String fork(SessionContext session, String srcNwo, String name) {
        String token = auth.requireGitHubToken(session);
        workflow.requireForkable(session, srcNwo);

        GitHubRepository src = github.fetchRepository(token, srcNwo)
                .orElseThrow(() -> new ResourceNotFoundException("No repository was found at github.com/" + srcNwo));
        String destName = name == null || name.isBlank() ? src.getName() : name.trim();

        GitHubRepository dest;
        if (src.isTemplate()) {
            dest = github.generateFromTemplate(token, srcNwo, destName);
        } else if (requireTemplate) {
            throw new NotATemplateException(srcNwo);
        } else {
            dest = github.forkRepository(token, srcNwo, destName);
        }

        workflow.recordFork(session, srcNwo, dest.getNwo());
        log.info("✅ Created {} from {}", dest.getNwo(), srcNwo);
        return dest.getNwo();
    }

    /**
     * Provisions a service for the fork of {@code srcNwo}.
     *
     * @param form submitted form fields; dict.* fields override dictionary defaults
     */
    public DeploySuccessResponse deploy(SessionContext session, String srcNwo, String serviceName,
                                        Map<String, String> form) {
        String githubToken = auth.requireGitHubToken(session);
        String fastlyToken = auth.requireFastlyToken(session);
        String dest = workflow.requireDeployable(session, srcNwo);

        GitHubFile manifestFile = github.getFile(githubToken, dest, manifestPath)
                .orElseThrow(() -> new PreconditionException("The repository " + dest + " does not contain a "
                        + manifestPath + " file, so cannot be deployed via Quick Deploy"));
        log.info("Fetched manifest from {}", dest);

        EditableManifest manifest = parser.loadManifest(manifestFile.getContent());
        DeployConfigSpec spec = parser.parseSpec(manifestFile.getContent());

        CreatedService service = pipeline.provision(ProvisioningRequest.builder()
                .destination(dest)
                .manifestFile(manifestFile)
                .manifest(manifest)
                .spec(spec)
                .overrides(dictionaryOverrides(form))
                .githubToken(githubToken)
                .fastlyToken(fastlyToken)
                .serviceName(serviceName)
                .build());

        workflow.recordProvisioned(session, service);

        return DeploySuccessResponse.builder()
                .applicationUrl("https://" + service.getDomain())
                .actionsUrl("https://github.com/" + dest + "/actions")
                .repoNwo(dest)
                .serviceId(service.getId())
                .build();
    }

    /**
     * One poll. When the service is live the deployment is finished and its state cleared.
     */
    public DeployStatusResponse checkStatus(SessionContext session) {
        String serviceId = workflow.requireServiceId(session);
        String fastlyToken = auth.requireFastlyToken(session);
        DeploymentState deployment = session.getDeployment();
        String applicationUrl = deployment.getDomain() == null ? null : "https://" + deployment.getDomain();

        boolean active = poller.isActive(fastlyToken, serviceId);
        if (active) {
            log.info("✅ Service {} is active", serviceId);
            workflow.reset(session);
        }
        return DeployStatusResponse.builder()
                .serviceId(serviceId)
                .active(active)
                .applicationUrl(applicationUrl)
                .build();
    }

    public void reset(SessionContext session) {
        workflow.reset(session);
    }

    /**
     * dict.&lt;dictionary&gt;.&lt;key&gt; form fields, keyed by &lt;dictionary&gt;.&lt;key&gt;
     */
    static Map<String, String> dictionaryOverrides(Map<String, String> form) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (form == null) {
            return overrides;
        }
        form.forEach((field, value) -> {
            if (field.startsWith(DICTIONARY_FIELD_PREFIX) && value != null) {
                overrides.put(field.substring(DICTIONARY_FIELD_PREFIX.length()), value);
            }
        });
        return overrides;
    }
}
