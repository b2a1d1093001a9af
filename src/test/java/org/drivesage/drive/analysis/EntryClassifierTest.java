package org.drivesage.drive.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntryClassifierTest {

    @Test
    void isLargeFile_strictlyGreaterThanThreshold() {
        long threshold = EntryClassifier.LARGE_FILE_THRESHOLD_BYTES;

        assertThat(EntryClassifier.isLargeFile(threshold)).isFalse();
        assertThat(EntryClassifier.isLargeFile(threshold + 1)).isTrue();
        assertThat(EntryClassifier.isLargeFile(150L * 1024 * 1024)).isTrue();
        assertThat(EntryClassifier.isLargeFile(0)).isFalse();
        assertThat(EntryClassifier.isLargeFile(11, 10)).isTrue();
        assertThat(EntryClassifier.isLargeFile(10, 10)).isFalse();
    }

    @Test
    void isSystemFile_exactCaseSensitiveNames() {
        assertThat(EntryClassifier.isSystemFile(".DS_Store")).isTrue();
        assertThat(EntryClassifier.isSystemFile("Thumbs.db")).isTrue();
        assertThat(EntryClassifier.isSystemFile(".Spotlight-V100")).isTrue();
        assertThat(EntryClassifier.isSystemFile(".fseventsd")).isTrue();

        assertThat(EntryClassifier.isSystemFile("thumbs.db")).isFalse();
        assertThat(EntryClassifier.isSystemFile("my.DS_Store")).isFalse();
        assertThat(EntryClassifier.isSystemFile(null)).isFalse();
    }

    @Test
    void protectedMatch_isCaseInsensitiveSubstring() {
        List<String> patterns = EntryClassifier.DEFAULT_PROTECTED_PATTERNS;

        assertThat(EntryClassifier.isProtectedFile("my-code-notes.txt", patterns)).isTrue();
        assertThat(EntryClassifier.isProtectedFile("Gemini-Export.json", patterns)).isTrue();
        assertThat(EntryClassifier.isProtectedFile("holiday.jpg", patterns)).isFalse();

        // 子串匹配会多报
        assertThat(EntryClassifier.matchProtectedPattern("aircraft.png", patterns)).contains("ai");
    }

    @Test
    void protectedMatch_returnsFirstMatchingPatternAndSkipsBlank() {
        assertThat(EntryClassifier.matchProtectedPattern("project-code.zip", List.of(" ", "code", "project")))
                .contains("code");
        assertThat(EntryClassifier.matchProtectedPattern("anything", List.of())).isEmpty();
        assertThat(EntryClassifier.matchProtectedPattern("anything", null)).isEmpty();
        assertThat(EntryClassifier.matchProtectedPattern(null, List.of("a"))).isEmpty();
    }
}
