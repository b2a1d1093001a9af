package org.drivesage.drive.dto.analysis;

import java.time.Instant;

/**
 * 被分类命中的文件（大文件 / 系统文件 / 受保护文件）。
 *
 * @param name         文件名
 * @param path         绝对路径
 * @param relativePath 相对扫描根目录的路径（统一使用 / 分隔）
 * @param size         文件大小（字节）
 * @param modified     最后修改时间
 * @param reason       分类原因（仅受保护文件有值，其余为 null）
 */
public record FileRecord(
        String name,
        String path,
        String relativePath,
        long size,
        Instant modified,
        String reason
) {
}
