package com.quickdeploy.back.deploy.service;

import com.quickdeploy.back.client.fastly.DictionaryItemOperation;
import com.quickdeploy.back.client.fastly.FastlyApi;
import com.quickdeploy.back.client.fastly.FastlyBackend;
import com.quickdeploy.back.client.fastly.FastlyDictionary;
import com.quickdeploy.back.client.fastly.FastlyDomain;
import com.quickdeploy.back.client.fastly.FastlyService;
import com.quickdeploy.back.client.github.GitHubApi;
import com.quickdeploy.back.client.github.GitHubFile;
import com.quickdeploy.back.client.github.RepositoryPublicKey;
import com.quickdeploy.back.common.error.ManifestConflictException;
import com.quickdeploy.back.common.error.MissingValueException;
import com.quickdeploy.back.crypto.SealedBox;
import com.quickdeploy.back.deploy.model.CreatedService;
import com.quickdeploy.back.deploy.model.ProvisioningRequest;
import com.quickdeploy.back.deploy.model.ProvisioningRun;
import com.quickdeploy.back.deploy.model.ProvisioningStep;
import com.quickdeploy.back.manifest.model.BackendSpec;
import com.quickdeploy.back.manifest.model.DictionaryItemSpec;
import com.quickdeploy.back.manifest.model.DictionarySpec;
import com.quickdeploy.back.manifest.model.EditableManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns a forked repository and its deploy configuration into a live Fastly service.
 * <p>
 * Steps run once each in {@link ProvisioningStep} order. The first failure aborts the run and is
 * rethrown unchanged; resources created by earlier steps are not rolled back.
 */
@Slf4j
@Service
public class ProvisioningPipeline {

    public static final int INITIAL_VERSION = 1;

    /** Used when the template declares no backends, so the service can always be activated */
    public static final BackendSpec LOOPBACK_BACKEND = new BackendSpec("127.0.0.1", "127.0.0.1", null, null);

    private final FastlyApi fastly;
    private final GitHubApi github;
    private final ServiceNameGenerator names;

    private final String domainSuffix;
    private final String workflow;
    private final String secretName;
    private final String commitMessage;

    private final Map<ProvisioningStep, Consumer<ProvisioningRun>> steps = new EnumMap<>(ProvisioningStep.class);

    public ProvisioningPipeline(FastlyApi fastly,
                                GitHubApi github,
                                ServiceNameGenerator names,
                                @Value("${quickdeploy.fastly.domain-suffix:edgecompute.app}") String domainSuffix,
                                @Value("${quickdeploy.github.workflow:deploy.yml}") String workflow,
                                @Value("${quickdeploy.github.secret-name:FASTLY_API_TOKEN}") String secretName,
                                @Value("${quickdeploy.github.commit-message:Service provisioning via Quick Deploy}") String commitMessage) {
        this.fastly = fastly;
        this.github = github;
        this.names = names;
        this.domainSuffix = domainSuffix;
        this.workflow = workflow;
        this.secretName = secretName;
        this.commitMessage = commitMessage;

        steps.put(ProvisioningStep.NAME_SERVICE, this::nameService);
        steps.put(ProvisioningStep.CREATE_SERVICE, this::createService);
        steps.put(ProvisioningStep.CREATE_DOMAIN, this::createDomain);
        steps.put(ProvisioningStep.CREATE_BACKENDS, this::createBackends);
        steps.put(ProvisioningStep.CREATE_DICTIONARIES, this::createDictionaries);
        steps.put(ProvisioningStep.ENABLE_WORKFLOW, this::enableWorkflow);
        steps.put(ProvisioningStep.CREATE_SECRET, this::createSecret);
        steps.put(ProvisioningStep.PUSH_MANIFEST, this::pushManifest);
    }

    public List<ProvisioningStep> steps() {
        return List.copyOf(steps.keySet());
    }

    public CreatedService provision(ProvisioningRequest request) {
        log.info(">> Provisioning service for {}", request.getDestination());
        ProvisioningRun run = new ProvisioningRun(request);

        for (Map.Entry<ProvisioningStep, Consumer<ProvisioningRun>> step : steps.entrySet()) {
            try {
                step.getValue().accept(run);
            } catch (RuntimeException e) {
                log.error("❌ Provisioning of {} aborted at {} after {} (service {}, left in place): {}",
                        request.getDestination(), step.getKey(), run.getCompletedSteps(),
                        run.getServiceId(), e.getMessage());
                throw e;
            }
            run.getCompletedSteps().add(step.getKey());
        }

        log.info("✅ Service {} provisioned for {} at {}", run.getServiceId(), request.getDestination(), run.getDomain());
        return new CreatedService(run.getServiceId(), run.getDomain());
    }

    private void nameService(ProvisioningRun run) {
        String requested = run.getRequest().getServiceName();
        run.setServiceName(requested == null || requested.isBlank() ? names.generate() : names.sanitize(requested));
        log.info("Service name: {}", run.getServiceName());
    }

    private void createService(ProvisioningRun run) {
        FastlyService service = fastly.createService(fastlyToken(run), run.getServiceName() + " via Quick Deploy");
        run.setServiceId(service.getId());
        log.info("✅ Created service {}", service.getId());
    }

    private void createDomain(ProvisioningRun run) {
        String name = run.getServiceName() + "." + domainSuffix;
        FastlyDomain domain = fastly.createDomain(fastlyToken(run), run.getServiceId(), INITIAL_VERSION, name);
        run.setDomain(domain.getName() == null ? name : domain.getName());
        log.info("✅ Created domain {}", run.getDomain());
    }

    private void createBackends(ProvisioningRun run) {
        List<BackendSpec> backends = run.getRequest().getSpec().getBackends();
        if (backends.isEmpty()) {
            backends = List.of(LOOPBACK_BACKEND);
        }
        for (BackendSpec backend : backends) {
            fastly.createBackend(fastlyToken(run), run.getServiceId(), INITIAL_VERSION, FastlyBackend.builder()
                    .name(backend.getName())
                    .address(backend.getAddress())
                    .port(backend.portOrDefault())
                    .build());
            run.getBackends().add(backend.getName());
            log.info("✅ Created backend {}", backend.getName());
        }
    }

    /**
     * Each dictionary is created before its item values are resolved, so a missing value
     * leaves the new dictionary empty.
     */
    private void createDictionaries(ProvisioningRun run) {
        Map<String, String> overrides = run.getRequest().getOverrides() == null
                ? Map.of()
                : run.getRequest().getOverrides();

        for (DictionarySpec dictionary : run.getRequest().getSpec().getDictionaries()) {
            FastlyDictionary created = fastly.createDictionary(
                    fastlyToken(run), run.getServiceId(), INITIAL_VERSION, dictionary.getName());
            run.getDictionaryIds().put(dictionary.getName(), created.getId());
            log.info("✅ Created dictionary {}", dictionary.getName());

            List<DictionaryItemOperation> items = new ArrayList<>();
            for (DictionaryItemSpec item : dictionary.getItems()) {
                items.add(DictionaryItemOperation.create(item.getKey(), resolveValue(dictionary, item, overrides)));
            }
            if (items.isEmpty()) {
                continue;
            }
            fastly.updateDictionaryItems(fastlyToken(run), run.getServiceId(), created.getId(), items);
            log.info("✅ Populated dictionary {} with {} items", dictionary.getName(), items.size());
        }
    }

    /**
     * Submitted value first, then the declared default. A blank submission counts as no submission.
     */
    static String resolveValue(DictionarySpec dictionary, DictionaryItemSpec item, Map<String, String> overrides) {
        String override = overrides.get(dictionary.getName() + "." + item.getKey());
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (item.getValue() != null) {
            return item.getValue();
        }
        throw new MissingValueException(item.getKey());
    }

    private void enableWorkflow(ProvisioningRun run) {
        github.enableWorkflow(githubToken(run), run.getRequest().getDestination(), workflow);
        log.info("✅ Enabled workflow {} in {}", workflow, run.getRequest().getDestination());
    }

    private void createSecret(ProvisioningRun run) {
        String destination = run.getRequest().getDestination();
        RepositoryPublicKey publicKey = github.getRepositoryPublicKey(githubToken(run), destination);
        run.setPublicKeyId(publicKey.getKeyId());

        byte[] sealed = SealedBox.seal(fastlyToken(run).getBytes(StandardCharsets.UTF_8),
                Base64.getDecoder().decode(publicKey.getKey()));
        github.putSecret(githubToken(run), destination, secretName, publicKey.getKeyId(),
                Base64.getEncoder().encodeToString(sealed));
        log.info("✅ Created {} repository secret", secretName);
    }

    /**
     * Written last, and only if the file still has the sha it had when it was read.
     */
    private void pushManifest(ProvisioningRun run) {
        ProvisioningRequest request = run.getRequest();
        GitHubFile original = request.getManifestFile();
        EditableManifest manifest = request.getManifest();
        manifest.setServiceId(run.getServiceId());

        Optional<GitHubFile> current = github.getFile(githubToken(run), request.getDestination(), original.getPath());
        String currentSha = current.map(GitHubFile::getSha).orElse(null);
        if (!original.getSha().equals(currentSha)) {
            throw new ManifestConflictException(original.getPath(), original.getSha(), currentSha);
        }

        github.updateFile(githubToken(run), request.getDestination(), original.getPath(),
                manifest.render(), original.getSha(), commitMessage);
        log.info("✅ Manifest pushed to {}", request.getDestination());
    }

    private static String fastlyToken(ProvisioningRun run) {
        return run.getRequest().getFastlyToken();
    }

    private static String githubToken(ProvisioningRun run) {
        return run.getRequest().getGithubToken();
    }
}
