package org.drivesage.drive.dto.organize;

/**
 * 已执行（或演练）的重命名。
 *
 * @param oldPath 原路径
 * @param newPath 新路径
 */
public record RenameRecord(String oldPath, String newPath) {
}
