package com.quickdeploy.back.client.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Key used to encrypt Actions secrets for one repository. {@code key} is Base64.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepositoryPublicKey {
    @JsonProperty("key_id")
    private String keyId;
    private String key;
}
