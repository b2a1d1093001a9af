package org.drivesage.drive.analysis;

import java.util.List;

/**
 * 单次分析使用的设置，由调用方传入，分析过程中不会修改。
 *
 * @param protectedPatterns       受保护关键字（子串匹配，大小写不敏感）
 * @param largeFileThresholdBytes 大文件阈值（字节），严格大于才算大文件
 * @param followSymlinks          是否跟随符号链接
 */
public record AnalysisSettings(
        List<String> protectedPatterns,
        long largeFileThresholdBytes,
        boolean followSymlinks
) {
    public AnalysisSettings {
        protectedPatterns = (protectedPatterns == null) ? List.of() : List.copyOf(protectedPatterns);
        if (largeFileThresholdBytes < 0) {
            throw new IllegalArgumentException("大文件阈值不能为负数：" + largeFileThresholdBytes);
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(
                EntryClassifier.DEFAULT_PROTECTED_PATTERNS,
                EntryClassifier.LARGE_FILE_THRESHOLD_BYTES,
                false
        );
    }
}
