package com.quickdeploy.back.manifest.model;

import com.quickdeploy.back.common.error.ManifestParseException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditableManifestTest {

    @Test
    void rewritesOnlyTheServiceIdLine() throws IOException {
        String original = fixture("starter-kit.toml");
        EditableManifest manifest = new EditableManifest(original);

        manifest.setServiceId("SU1Z0isxPaozGVKXdv0eY");

        String expected = original.replace(
                "service_id = \"\"   # filled in on deploy",
                "service_id = \"SU1Z0isxPaozGVKXdv0eY\"   # filled in on deploy");
        assertThat(manifest.render()).isEqualTo(expected);
        assertThat(manifest.getServiceId()).isEqualTo("SU1Z0isxPaozGVKXdv0eY");
    }

    @Test
    void insertsServiceIdBeforeFirstTable() {
        String original = "# comment\nname = \"app\"\n\n[setup]\n  # keep me\n";
        EditableManifest manifest = new EditableManifest(original);

        manifest.setServiceId("svc-1");

        assertThat(manifest.render())
                .isEqualTo("# comment\nname = \"app\"\n\nservice_id = \"svc-1\"\n[setup]\n  # keep me\n");
    }

    @Test
    void appendsServiceIdWhenThereAreNoTables() {
        EditableManifest manifest = new EditableManifest("name = \"app\"");

        manifest.setServiceId("svc-1");

        assertThat(manifest.render()).isEqualTo("name = \"app\"\nservice_id = \"svc-1\"\n");
    }

    @Test
    void ignoresBracketsInsideMultilineStrings() {
        String original = "description = \"\"\"\n[not a table]\n\"\"\"\n[scripts]\nbuild = \"make\"\n";
        EditableManifest manifest = new EditableManifest(original);

        manifest.setServiceId("svc-1");

        assertThat(manifest.render()).isEqualTo(
                "description = \"\"\"\n[not a table]\n\"\"\"\nservice_id = \"svc-1\"\n[scripts]\nbuild = \"make\"\n");
    }

    @Test
    void ignoresBracketsInsideMultilineArrays() {
        EditableManifest manifest = new EditableManifest("name = \"app\"\nauthors = [\n  [\"a\", \"b\"],\n]\n[setup]\n");

        manifest.setServiceId("svc-1");

        assertThat(manifest.render())
                .isEqualTo("name = \"app\"\nauthors = [\n  [\"a\", \"b\"],\n]\nservice_id = \"svc-1\"\n[setup]\n");
    }

    @Test
    void ignoresBracketsInCommentsAndInlineTables() {
        EditableManifest manifest = new EditableManifest(
                "# [not a table]\nowner = { names = [\"x\"] }\nports = [\n  # [80]\n  8080,\n]\n\n[scripts]\nbuild = \"npm run build\"\n");

        manifest.setServiceId("svc-2");

        assertThat(manifest.render()).isEqualTo(
                "# [not a table]\nowner = { names = [\"x\"] }\nports = [\n  # [80]\n  8080,\n]\n\nservice_id = \"svc-2\"\n[scripts]\nbuild = \"npm run build\"\n");
    }

    @Test
    void keepsWindowsLineEndings() {
        EditableManifest manifest = new EditableManifest("name = \"app\"\r\nservice_id = \"old\"\r\n[setup]\r\n");

        manifest.setServiceId("new");

        assertThat(manifest.render()).isEqualTo("name = \"app\"\r\nservice_id = \"new\"\r\n[setup]\r\n");
    }

    @Test
    void leavesTableScopedServiceIdAlone() {
        EditableManifest manifest = new EditableManifest("name = \"app\"\n[local_server]\nservice_id = \"local\"\n");

        manifest.setServiceId("svc-1");

        assertThat(manifest.render())
                .isEqualTo("name = \"app\"\nservice_id = \"svc-1\"\n[local_server]\nservice_id = \"local\"\n");
    }

    @Test
    void rejectsInvalidToml() {
        assertThatThrownBy(() -> new EditableManifest("name = \"unterminated"))
                .isInstanceOf(ManifestParseException.class)
                .hasMessageStartingWith("Unable to parse manifest");
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = EditableManifestTest.class.getResourceAsStream("/manifests/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
