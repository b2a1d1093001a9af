package org.drivesage.drive.dto;

import org.drivesage.drive.dto.organize.OperationResult;

import java.time.Instant;

/**
 * {@code drive_confirm_operations} 的返回结果（确认/取消）。
 *
 * @param token      token
 * @param confirmed  是否确认（confirm=true）
 * @param result     实际执行结果；取消时为 null
 * @param executedAt 执行时间；取消时为 null
 */
public record OperationConfirmResult(
        String token,
        boolean confirmed,
        OperationResult result,
        Instant executedAt
) {
}
