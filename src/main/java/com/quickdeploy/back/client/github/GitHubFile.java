package com.quickdeploy.back.client.github;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A repository file with its decoded content and the blob sha needed to update it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GitHubFile {
    private String path;
    private String sha;
    private String content;
}
