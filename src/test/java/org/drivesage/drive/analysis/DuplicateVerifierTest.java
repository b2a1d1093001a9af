package org.drivesage.drive.analysis;

import org.drivesage.drive.dto.analysis.DuplicateRecord;
import org.drivesage.drive.dto.analysis.DuplicateVerification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateVerifierTest {

    @TempDir
    Path root;

    @Test
    void verify_splitsCandidatesByContent() throws IOException {
        Path original = write("a/photo.jpg", "same-bytes");
        Path copy = write("b/photo.jpg", "same-bytes");
        Path impostor = write("c/photo.jpg", "diff-bytes");

        DuplicateRecord same = record(original, copy);
        DuplicateRecord different = record(original, impostor);

        DuplicateVerification result = new DuplicateVerifier(1024).verify(List.of(same, different));

        assertThat(result.confirmed()).containsExactly(same);
        assertThat(result.mismatched()).containsExactly(different);
        assertThat(result.unverified()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void verify_leavesOversizedAndMissingFilesUnverified() throws IOException {
        Path original = write("a/big.bin", "0123456789");
        Path copy = write("b/big.bin", "0123456789");
        Path gone = root.resolve("c/big.bin");

        DuplicateRecord oversized = record(original, copy);
        DuplicateVerification small = new DuplicateVerifier(5).verify(List.of(oversized));
        assertThat(small.unverified()).containsExactly(oversized);
        assertThat(small.warnings()).hasSize(1);
        assertThat(small.warnings().get(0)).contains("未复核");

        DuplicateRecord missing = record(original, gone);
        DuplicateVerification result = new DuplicateVerifier(1024).verify(List.of(missing));
        assertThat(result.unverified()).containsExactly(missing);
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("复核失败");
    }

    private DuplicateRecord record(Path original, Path duplicate) {
        return new DuplicateRecord(original.toString(), duplicate.toString(),
                root.relativize(duplicate).toString(), 10, Instant.now());
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
