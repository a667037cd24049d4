package com.quickdeploy.back.deploy.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates readable two-word slugs for new services, e.g. {@code sunny-comet}.
 */
@Component
public class ServiceNameGenerator {

    private static final List<String> ADJECTIVES = List.of(
            "amber", "brave", "breezy", "bright", "calm", "clever", "cosmic", "crisp",
            "dapper", "eager", "fancy", "fuzzy", "gentle", "glowing", "happy", "jolly",
            "lively", "lucky", "mellow", "merry", "nimble", "peppy", "plucky", "quick",
            "quiet", "rapid", "shiny", "snappy", "sparkly", "sunny", "swift", "witty");

    private static final List<String> NOUNS = List.of(
            "badger", "beacon", "breeze", "canyon", "comet", "coral", "falcon", "fern",
            "glacier", "harbor", "heron", "lantern", "meadow", "meteor", "nebula", "otter",
            "panda", "pebble", "pine", "planet", "quasar", "river", "rocket", "sparrow",
            "summit", "thunder", "tiger", "tulip", "valley", "walrus", "willow", "zephyr");

    public String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
                + "-" + NOUNS.get(random.nextInt(NOUNS.size()));
    }

    /**
     * Lower-cases a user supplied name and strips anything that is not valid in a hostname label.
     */
    public String sanitize(String name) {
        String sanitized = name.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]+", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-|-$", "");
        return sanitized.isEmpty() ? generate() : sanitized;
    }
}
