package com.quickdeploy.back.client.fastly;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a dictionary bulk update (PATCH /service/{id}/dictionary/{id}/items)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DictionaryItemOperation {
    private String op;

    @JsonProperty("item_key")
    private String itemKey;

    @JsonProperty("item_value")
    private String itemValue;

    public static DictionaryItemOperation create(String key, String value) {
        return new DictionaryItemOperation("create", key, value);
    }
}
