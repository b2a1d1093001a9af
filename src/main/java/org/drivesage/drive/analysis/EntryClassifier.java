package org.drivesage.drive.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 文件分类规则（纯函数，不做 IO）。
 * <p>
 * 三类标记互不排斥：同一个文件可以既是大文件又是受保护文件。
 */
public final class EntryClassifier {

    public static final long LARGE_FILE_THRESHOLD_BYTES = 100L * 1024 * 1024;

    /**
     * 操作系统生成的杂项文件名（精确匹配，大小写敏感）。
     */
    public static final Set<String> SYSTEM_FILE_NAMES = Set.of(".DS_Store", "Thumbs.db", ".Spotlight-V100", ".fseventsd");

    public static final List<String> DEFAULT_PROTECTED_PATTERNS = List.of("gemini", "ai", "assistant", "code", "project");

    private EntryClassifier() {
    }

    public static boolean isLargeFile(long size) {
        return isLargeFile(size, LARGE_FILE_THRESHOLD_BYTES);
    }

    public static boolean isLargeFile(long size, long thresholdBytes) {
        return size > thresholdBytes;
    }

    public static boolean isSystemFile(String name) {
        return name != null && SYSTEM_FILE_NAMES.contains(name);
    }

    public static boolean isProtectedFile(String name, List<String> patterns) {
        return matchProtectedPattern(name, patterns).isPresent();
    }

    /**
     * 返回第一个命中的受保护关键字。
     * <p>
     * 这是子串匹配而不是按单词匹配：{@code aircraft.png} 会命中 {@code ai}。空白关键字忽略。
     */
    public static Optional<String> matchProtectedPattern(String name, List<String> patterns) {
        if (name == null || patterns == null || patterns.isEmpty()) {
            return Optional.empty();
        }
        String lowerName = name.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            if (lowerName.contains(pattern.toLowerCase(Locale.ROOT))) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
