package org.drivesage.drive.dto.organize;

/**
 * 单个操作的失败记录。
 *
 * @param operation 操作类型（move / delete / rename，或调用方传入的未知类型）
 * @param path      操作涉及的主路径（move 为 source，delete 为 path，rename 为 oldPath）
 * @param message   失败原因
 */
public record OperationError(String operation, String path, String message) {
}
