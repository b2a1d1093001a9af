package org.drivesage.drive.dto;

import org.drivesage.drive.dto.organize.OperationResult;

import java.time.Instant;

/**
 * {@code drive_prepare_operations} 的返回结果：演练结果 + 确认 token。
 *
 * @param token     用于 {@code drive_confirm_operations} 的 token；演练全部失败时为 null
 * @param preview   演练结果（不会修改文件系统）
 * @param expiresAt token 过期时间
 */
public record OperationPrepareResult(
        String token,
        OperationResult preview,
        Instant expiresAt
) {
}
