package com.quickdeploy.back.session.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Bearer credentials for the two providers. Either may be absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginState {
    @ToString.Exclude
    private String githubToken;
    @ToString.Exclude
    private String fastlyToken;

    @JsonIgnore
    public boolean isEmpty() {
        return githubToken == null && fastlyToken == null;
    }
}
