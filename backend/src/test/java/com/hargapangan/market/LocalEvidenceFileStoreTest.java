package com.hargapangan.market;

import com.hargapangan.market.config.StorageProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalEvidenceFileStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void resolveKeepsOnlyTheFileName() {
        Path root = tempDir.toAbsolutePath().normalize();

        assertThat(LocalEvidenceFileStore.resolve(root, "/uploads/market-images/a.jpg")).isEqualTo(root.resolve("a.jpg"));
        assertThat(LocalEvidenceFileStore.resolve(root, "..\\..\\etc\\passwd")).isEqualTo(root.resolve("passwd"));
        assertThat(LocalEvidenceFileStore.resolve(root, "img/..")).isNull();
        assertThat(LocalEvidenceFileStore.resolve(root, "img/")).isNull();
    }

    @Test
    void deleteAllRemovesFilesAndIgnoresMissingOnes() throws IOException {
        Path uploads = Files.createDirectories(tempDir.resolve("uploads"));
        Path a = Files.writeString(uploads.resolve("a.jpg"), "a");
        Path b = Files.writeString(uploads.resolve("b.jpg"), "b");
        Path outside = Files.writeString(tempDir.resolve("keep.jpg"), "k");
        StorageProperties properties = new StorageProperties();
        properties.setUploadDir(uploads.toString());

        new LocalEvidenceFileStore(properties).deleteAll(Arrays.asList("a.jpg", "market-images/b.jpg", "missing.jpg", null, " "));

        assertThat(a).doesNotExist();
        assertThat(b).doesNotExist();
        assertThat(outside).exists();
    }

    @Test
    void nullReferencesAreIgnored() {
        StorageProperties properties = new StorageProperties();
        properties.setUploadDir(tempDir.toString());

        new LocalEvidenceFileStore(properties).deleteAll(null);
        new LocalEvidenceFileStore(properties).deleteAll(List.of());

        assertThat(tempDir).isEmptyDirectory();
    }
}
