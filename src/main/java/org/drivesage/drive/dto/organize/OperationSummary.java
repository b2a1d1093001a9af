package org.drivesage.drive.dto.organize;

/**
 * 操作统计，始终满足 {@code successful + failed == total}。
 *
 * @param total      输入操作数
 * @param successful 成功数
 * @param failed     失败数
 */
public record OperationSummary(int total, int successful, int failed) {
}
