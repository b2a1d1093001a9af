package org.drivesage.drive.dto.analysis;

/**
 * 扫描过程中无法读取的条目。
 *
 * @param path    条目绝对路径
 * @param message 失败原因
 */
public record ScanError(String path, String message) {
}
