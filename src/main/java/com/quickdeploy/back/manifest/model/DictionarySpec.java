package com.quickdeploy.back.manifest.model;

import lombok.Value;

import java.util.List;

@Value
public class DictionarySpec {

    String name;
    String prompt;
    List<DictionaryItemSpec> items;

    public DictionarySpec(String name, String prompt, List<DictionaryItemSpec> items) {
        this.name = name;
        this.prompt = prompt;
        this.items = items == null ? List.of() : List.copyOf(items);
    }
}
