package org.drivesage.drive.dto.organize;

/**
 * 已执行（或演练）的移动。
 *
 * @param source      源路径
 * @param destination 目标路径
 */
public record MoveRecord(String source, String destination) {
}
