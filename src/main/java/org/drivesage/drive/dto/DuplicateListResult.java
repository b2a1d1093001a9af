package org.drivesage.drive.dto;

import org.drivesage.drive.dto.analysis.DuplicateRecord;

import java.util.List;

/**
 * {@code drive_find_duplicates} 的返回结果。
 *
 * @param rootId     根目录标识
 * @param path       扫描目录（相对 root，统一使用 / 分隔）
 * @param duplicates 疑似重复文件（按“文件名 + 大小”判断）
 * @param warnings   非致命告警
 */
public record DuplicateListResult(
        String rootId,
        String path,
        List<DuplicateRecord> duplicates,
        List<String> warnings
) {
}
