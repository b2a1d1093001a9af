package org.drivesage.drive.dto.analysis;

import java.time.Instant;
import java.util.List;

/**
 * 单个目录的浅层画像（只统计直接子级，不递归）。
 *
 * @param name         目录名
 * @param path         绝对路径
 * @param relativePath 相对扫描根目录的路径（统一使用 / 分隔）
 * @param size         直接子文件大小之和（不含子目录内容）
 * @param fileCount    直接子文件数量
 * @param subfolders   直接子目录名称
 * @param looseFiles   直接子文件（整理候选）
 * @param lastModified 直接子文件中最晚的修改时间；没有子文件时为 null
 */
public record FolderProfile(
        String name,
        String path,
        String relativePath,
        long size,
        int fileCount,
        List<String> subfolders,
        List<LooseFile> looseFiles,
        Instant lastModified
) {
    public FolderProfile {
        subfolders = List.copyOf(subfolders);
        looseFiles = List.copyOf(looseFiles);
    }
}
