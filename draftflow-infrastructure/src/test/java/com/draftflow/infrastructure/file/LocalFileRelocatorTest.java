package com.draftflow.infrastructure.file;

import com.draftflow.domain.exception.RelocationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalFileRelocatorTest {

    private final LocalFileRelocator relocator = new LocalFileRelocator();

    @TempDir
    Path root;

    @Test
    void testCopyKeepsSourceAndOverwritesTarget() throws IOException {
        Path source = Files.writeString(root.resolve("A-101.pdf"), "rev B");
        Path targetDir = root.resolve("1-Engineer Review");
        Files.createDirectories(targetDir);
        Files.writeString(targetDir.resolve("A-101.pdf"), "rev A");

        Path copied = relocator.copyInto(source, targetDir);

        assertThat(copied).isEqualTo(targetDir.resolve("A-101.pdf"));
        assertThat(Files.readString(copied)).isEqualTo("rev B");
        assertThat(source).exists();
    }

    @Test
    void testCopyCreatesMissingTargetDirectory() throws IOException {
        Path source = Files.writeString(root.resolve("A-102.pdf"), "x");

        Path copied = relocator.copyInto(source, root.resolve("2-Engineering QC Review"));

        assertThat(copied).exists();
    }

    @Test
    void testMissingSourceIsReported() {
        Path missing = root.resolve("gone.pdf");

        assertThatThrownBy(() -> relocator.copyInto(missing, root.resolve("out")))
            .isInstanceOf(RelocationException.class)
            .satisfies(e -> assertThat(((RelocationException) e).getSource()).isEqualTo(missing));
    }

    @Test
    void testCreateDirectories() {
        Path a = root.resolve("PP-Print Packages/0-Drafting-Print Package");
        Path b = root.resolve("PP-Print Packages/1-Engineer Review");

        relocator.createDirectories(Arrays.asList(a, b));

        assertThat(a).isDirectory();
        assertThat(b).isDirectory();
    }
}
