package com.quickdeploy.back.manifest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * An item of a [[setup.dictionaries]] entry. {@code value} is the declared default, may be null.
 */
@Value
public class DictionaryItemSpec {

    String key;

    @JsonProperty("input_type")
    String inputType;

    String prompt;
    String value;
}
