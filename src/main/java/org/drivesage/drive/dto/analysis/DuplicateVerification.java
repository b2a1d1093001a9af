package org.drivesage.drive.dto.analysis;

import java.util.List;

/**
 * 对疑似重复文件做内容哈希复核的结果。
 *
 * @param confirmed  内容一致（sha256 相同）
 * @param mismatched 名称与大小相同但内容不同
 * @param unverified 未能复核（文件过大、已被删除或读取失败）
 * @param warnings   未能复核的原因
 */
public record DuplicateVerification(
        List<DuplicateRecord> confirmed,
        List<DuplicateRecord> mismatched,
        List<DuplicateRecord> unverified,
        List<String> warnings
) {
    public DuplicateVerification {
        confirmed = List.copyOf(confirmed);
        mismatched = List.copyOf(mismatched);
        unverified = List.copyOf(unverified);
        warnings = List.copyOf(warnings);
    }
}
