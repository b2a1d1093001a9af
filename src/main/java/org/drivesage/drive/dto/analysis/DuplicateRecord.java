package org.drivesage.drive.dto.analysis;

import java.time.Instant;

/**
 * 疑似重复文件（按“文件名 + 大小”指纹判断，不比较内容）。
 *
 * @param original     同一指纹第一次出现的绝对路径
 * @param duplicate    之后再次出现的绝对路径
 * @param relativePath duplicate 相对扫描根目录的路径
 * @param size         文件大小（字节）
 * @param modified     duplicate 的最后修改时间
 */
public record DuplicateRecord(
        String original,
        String duplicate,
        String relativePath,
        long size,
        Instant modified
) {
}
