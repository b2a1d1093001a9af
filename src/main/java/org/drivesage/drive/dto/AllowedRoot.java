package org.drivesage.drive.dto;

/**
 * 允许分析/整理的根目录（云盘本地镜像目录）。
 *
 * @param id   根目录标识（root0、root1...）
 * @param path 根目录的绝对路径
 */
public record AllowedRoot(String id, String path) {
}
