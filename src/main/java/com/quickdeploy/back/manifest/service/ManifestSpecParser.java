package com.quickdeploy.back.manifest.service;

import com.quickdeploy.back.common.error.SpecParseException;
import com.quickdeploy.back.manifest.model.BackendSpec;
import com.quickdeploy.back.manifest.model.DeployConfigSpec;
import com.quickdeploy.back.manifest.model.DictionaryItemSpec;
import com.quickdeploy.back.manifest.model.DictionarySpec;
import com.quickdeploy.back.manifest.model.EditableManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the [setup] deploy configuration out of a fastly.toml and opens the manifest for editing.
 */
@Slf4j
@Component
public class ManifestSpecParser {

    public static final String SETUP_TABLE = "setup";

    /**
     * A manifest without a [setup] table, or with an empty one, declares no resources.
     */
    public DeployConfigSpec parseSpec(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new SpecParseException("Unable to parse deploy configuration: " + result.errors().get(0).toString());
        }

        Object setup = result.get(List.of(SETUP_TABLE));
        if (setup == null) {
            return DeployConfigSpec.empty();
        }
        if (!(setup instanceof TomlTable)) {
            throw new SpecParseException("'" + SETUP_TABLE + "' must be a table");
        }
        TomlTable table = (TomlTable) setup;

        List<BackendSpec> backends = new ArrayList<>();
        for (TomlTable backend : tables(table, "backends", SETUP_TABLE + ".backends")) {
            backends.add(backend(backend));
        }

        List<DictionarySpec> dictionaries = new ArrayList<>();
        for (TomlTable dictionary : tables(table, "dictionaries", SETUP_TABLE + ".dictionaries")) {
            dictionaries.add(dictionary(dictionary));
        }

        log.debug("Parsed deploy configuration: {} backends, {} dictionaries", backends.size(), dictionaries.size());
        return new DeployConfigSpec(backends, dictionaries);
    }

    public EditableManifest loadManifest(String text) {
        return new EditableManifest(text);
    }

    private BackendSpec backend(TomlTable table) {
        String name = requiredString(table, "name", "backends");
        String address = requiredString(table, "address", "backends");
        Integer port = null;
        Object rawPort = table.get(List.of("port"));
        if (rawPort != null) {
            if (!(rawPort instanceof Long) || (Long) rawPort < 1 || (Long) rawPort > 65535) {
                throw new SpecParseException("Backend " + name + " has an invalid port: " + rawPort);
            }
            port = ((Long) rawPort).intValue();
        }
        return new BackendSpec(name, address, port, optionalString(table, "prompt", "backends"));
    }

    private DictionarySpec dictionary(TomlTable table) {
        String name = requiredString(table, "name", "dictionaries");
        String path = "dictionaries." + name + ".items";
        List<DictionaryItemSpec> items = new ArrayList<>();
        for (TomlTable item : tables(table, "items", path)) {
            items.add(new DictionaryItemSpec(
                    requiredString(item, "key", path),
                    requiredString(item, "input_type", path),
                    optionalString(item, "prompt", path),
                    scalar(item, "value", path)));
        }
        return new DictionarySpec(name, optionalString(table, "prompt", "dictionaries"), items);
    }

    private static List<TomlTable> tables(TomlTable parent, String key, String path) {
        Object value = parent.get(List.of(key));
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof TomlArray) || !((TomlArray) value).containsTables() && !((TomlArray) value).isEmpty()) {
            throw new SpecParseException("'" + path + "' must be an array of tables");
        }
        TomlArray array = (TomlArray) value;
        List<TomlTable> tables = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            tables.add(array.getTable(i));
        }
        return tables;
    }

    private static String requiredString(TomlTable table, String key, String path) {
        String value = optionalString(table, key, path);
        if (value == null) {
            throw new SpecParseException("Missing '" + key + "' in " + path);
        }
        return value;
    }

    private static String optionalString(TomlTable table, String key, String path) {
        Object value = table.get(List.of(key));
        if (value != null && !(value instanceof String)) {
            throw new SpecParseException("'" + key + "' in " + path + " must be a string");
        }
        return (String) value;
    }

    /**
     * Default values may be written as any TOML scalar, they are stored as text.
     */
    private static String scalar(TomlTable table, String key, String path) {
        Object value = table.get(List.of(key));
        if (value == null) {
            return null;
        }
        if (value instanceof TomlTable || value instanceof TomlArray) {
            throw new SpecParseException("'" + key + "' in " + path + " must be a scalar value");
        }
        return value.toString();
    }
}
