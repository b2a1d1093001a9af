package org.drivesage.drive.analysis;

import org.drivesage.drive.IoErrors;
import org.drivesage.drive.dto.analysis.FolderProfile;
import org.drivesage.drive.dto.analysis.LooseFile;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 目录画像：只看一层，不递归。
 * <p>
 * 画像是“全有或全无”的：列目录失败或任意一个子项读取属性失败，整个目录画像失败并抛出 {@link IOException}，
 * 由调用方记为该目录的一条错误。
 * <p>
 * 未跟随符号链接时，链接本身既不算文件也不算子目录。
 */
public class FolderProfiler {

    private final boolean followSymlinks;

    public FolderProfiler(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public FolderProfile profile(Path root, Path dir) throws IOException {
        return snapshot(root, dir).profile();
    }

    /**
     * 生成画像并保留本次读到的子项，目录树遍历直接复用，不必再列一次目录。
     */
    Snapshot snapshot(Path root, Path dir) throws IOException {
        List<Path> paths = DirectoryEntries.list(dir);
        List<Child> children = new ArrayList<>(paths.size());
        List<String> subfolders = new ArrayList<>();
        List<LooseFile> looseFiles = new ArrayList<>();
        long size = 0;
        Instant lastModified = null;

        for (Path path : paths) {
            BasicFileAttributes attrs;
            try {
                attrs = DirectoryEntries.stat(path, followSymlinks);
            } catch (IOException e) {
                throw new IOException("读取子项失败：" + IoErrors.describe(e), e);
            }
            Child child = new Child(path, DirectoryEntries.fileName(path), attrs);
            children.add(child);

            if (child.isDirectory()) {
                subfolders.add(child.name());
            } else if (child.isFile()) {
                Instant modified = attrs.lastModifiedTime().toInstant();
                looseFiles.add(new LooseFile(child.name(), attrs.size(), modified));
                size += attrs.size();
                if (lastModified == null || modified.isAfter(lastModified)) {
                    lastModified = modified;
                }
            }
        }

        FolderProfile profile = new FolderProfile(
                DirectoryEntries.fileName(dir),
                dir.toString(),
                DirectoryEntries.relativePath(root, dir),
                size,
                looseFiles.size(),
                subfolders,
                looseFiles,
                lastModified
        );
        return new Snapshot(profile, children);
    }

    record Snapshot(FolderProfile profile, List<Child> children) {
    }

    /**
     * 已读取属性的子项。符号链接只有在不跟随时才会出现（跟随时属性来自链接目标）。
     */
    record Child(Path path, String name, BasicFileAttributes attrs) {

        boolean isDirectory() {
            return attrs.isDirectory();
        }

        boolean isSymlink() {
            return attrs.isSymbolicLink();
        }

        boolean isFile() {
            return !attrs.isDirectory() && !attrs.isSymbolicLink();
        }
    }
}
