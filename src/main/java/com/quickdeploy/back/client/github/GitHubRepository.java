package com.quickdeploy.back.client.github;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of the GitHub repository resource used by the deploy wizard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubRepository {
    private String name;

    @JsonProperty("full_name")
    private String fullName;

    private String description;

    @JsonProperty("default_branch")
    private String defaultBranch;

    private GitHubUser owner;

    @JsonProperty("forks_count")
    private int forksCount;

    @JsonProperty("stargazers_count")
    private int stargazersCount;

    @JsonProperty("is_template")
    private boolean template;

    /**
     * owner/name
     */
    @JsonIgnore
    public String getNwo() {
        if (fullName != null) {
            return fullName;
        }
        return owner == null ? name : owner.getLogin() + "/" + name;
    }
}
