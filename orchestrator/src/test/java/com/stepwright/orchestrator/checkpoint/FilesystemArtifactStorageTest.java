package com.stepwright.orchestrator.checkpoint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilesystemArtifactStorageTest {

    @TempDir Path root;

    @Test
    void write_createsParentsAndReadsBack() {
        FilesystemArtifactStorage storage = new FilesystemArtifactStorage(root);

        storage.write("job-1/checkpoints/step-0001/attempt-0001.patch", "diff".getBytes(StandardCharsets.UTF_8));

        assertThat(storage.exists("job-1/checkpoints/step-0001/attempt-0001.patch")).isTrue();
        assertThat(storage.read("job-1/checkpoints/step-0001/attempt-0001.patch")).asString(StandardCharsets.UTF_8)
                .isEqualTo("diff");
        assertThat(Files.isRegularFile(root.resolve("job-1/checkpoints/step-0001/attempt-0001.patch"))).isTrue();
    }

    @Test
    void write_overwritesWithoutLeavingTempFiles() throws Exception {
        FilesystemArtifactStorage storage = new FilesystemArtifactStorage(root);
        storage.write("a/b.json", "{}".getBytes(StandardCharsets.UTF_8));

        storage.write("a/b.json", "{\"v\":2}".getBytes(StandardCharsets.UTF_8));

        assertThat(storage.read("a/b.json")).asString(StandardCharsets.UTF_8).isEqualTo("{\"v\":2}");
        try (Stream<Path> files = Files.list(root.resolve("a"))) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("b.json");
        }
    }

    @Test
    void read_missingArtifact_throws() {
        FilesystemArtifactStorage storage = new FilesystemArtifactStorage(root);

        assertThatThrownBy(() -> storage.read("nope.patch"))
                .isInstanceOf(ArtifactStorageException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void paths_escapingRoot_rejected() {
        FilesystemArtifactStorage storage = new FilesystemArtifactStorage(root);

        assertThatThrownBy(() -> storage.write("../outside.txt", new byte[0]))
                .isInstanceOf(ArtifactStorageException.class);
        assertThatThrownBy(() -> storage.read("a/../../outside.txt"))
                .isInstanceOf(ArtifactStorageException.class);
        assertThatThrownBy(() -> storage.exists(" "))
                .isInstanceOf(ArtifactStorageException.class);
    }
}
