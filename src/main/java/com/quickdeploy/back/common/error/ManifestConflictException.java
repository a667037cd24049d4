package com.quickdeploy.back.common.error;

/**
 * The manifest changed in the repository between reading it and writing it back.
 */
public class ManifestConflictException extends PreconditionException {

    public ManifestConflictException(String path, String expectedSha, String actualSha) {
        super(String.format("%s was modified since it was read (expected sha %s, found %s)",
                path, expectedSha, actualSha));
    }

    @Override
    public String getErrorCode() {
        return "MANIFEST_CONFLICT";
    }
}
