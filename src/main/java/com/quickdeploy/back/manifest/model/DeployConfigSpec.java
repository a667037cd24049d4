package com.quickdeploy.back.manifest.model;

import lombok.Value;

import java.util.List;

/**
 * Resources a template asks for, read from the [setup] table of its manifest.
 */
@Value
public class DeployConfigSpec {

    List<BackendSpec> backends;
    List<DictionarySpec> dictionaries;

    public DeployConfigSpec(List<BackendSpec> backends, List<DictionarySpec> dictionaries) {
        this.backends = backends == null ? List.of() : List.copyOf(backends);
        this.dictionaries = dictionaries == null ? List.of() : List.copyOf(dictionaries);
    }

    public static DeployConfigSpec empty() {
        return new DeployConfigSpec(List.of(), List.of());
    }
}
