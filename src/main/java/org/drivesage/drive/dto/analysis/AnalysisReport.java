package org.drivesage.drive.dto.analysis;

import java.time.Instant;
import java.util.List;

/**
 * 一次目录分析的完整结果。
 * <p>
 * 计数类字段覆盖整棵目录树；{@code folders} 按先序遍历顺序排列。
 *
 * @param drivePath      扫描根目录
 * @param scanTime       扫描开始时间
 * @param totalSize      所有文件大小之和
 * @param fileCount      成功读取属性的文件数
 * @param folderCount    成功建立画像的目录数（不含根目录本身）
 * @param folders        目录画像
 * @param largeFiles     大文件
 * @param systemFiles    系统生成的杂项文件
 * @param protectedFiles 文件名命中受保护关键字的文件
 * @param duplicates     疑似重复文件
 * @param errors         无法读取的条目
 * @param warnings       非致命告警（跳过的符号链接、疑似循环、重复检测中的读取失败等）
 */
public record AnalysisReport(
        String drivePath,
        Instant scanTime,
        long totalSize,
        int fileCount,
        int folderCount,
        List<FolderProfile> folders,
        List<FileRecord> largeFiles,
        List<FileRecord> systemFiles,
        List<FileRecord> protectedFiles,
        List<DuplicateRecord> duplicates,
        List<ScanError> errors,
        List<String> warnings
) {
    public AnalysisReport {
        folders = List.copyOf(folders);
        largeFiles = List.copyOf(largeFiles);
        systemFiles = List.copyOf(systemFiles);
        protectedFiles = List.copyOf(protectedFiles);
        duplicates = List.copyOf(duplicates);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
