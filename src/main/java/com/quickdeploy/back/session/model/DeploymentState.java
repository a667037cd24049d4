package com.quickdeploy.back.session.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Progress of the deployment of one source repository.
 * {@code dest} is only valid for the {@code src} it was forked from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeploymentState {
    /** Source repository nwo (owner/name) */
    private String src;
    /** Repository created from {@code src} */
    private String dest;
    private String serviceId;
    private String domain;

    /**
     * Destination for the given source, empty when the recorded fork belongs to another source.
     */
    public Optional<String> resolveDestination(String srcNwo) {
        if (dest == null || src == null || !src.equals(srcNwo)) {
            return Optional.empty();
        }
        return Optional.of(dest);
    }

    public WorkflowStage stageFor(String srcNwo) {
        if (resolveDestination(srcNwo).isPresent()) {
            return serviceId == null ? WorkflowStage.FORKED : WorkflowStage.PROVISIONED;
        }
        if (srcNwo != null && srcNwo.equals(src)) {
            return WorkflowStage.SOURCE_SELECTED;
        }
        return WorkflowStage.IDLE;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return src == null && dest == null && serviceId == null && domain == null;
    }
}
