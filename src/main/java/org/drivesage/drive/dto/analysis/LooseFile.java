package org.drivesage.drive.dto.analysis;

import java.time.Instant;

/**
 * 目录下的“散落文件”（直接位于该目录内，不在任何子目录中）。
 *
 * @param name     文件名
 * @param size     文件大小（字节）
 * @param modified 文件系统记录的最后修改时间
 */
public record LooseFile(
        String name,
        long size,
        Instant modified
) {
}
