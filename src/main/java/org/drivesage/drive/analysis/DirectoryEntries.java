package org.drivesage.drive.analysis;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 目录遍历的公共部分：按名称排序列出子项、读取属性、计算相对路径。
 * <p>
 * 目录画像、目录树遍历与重复检测共用同一套排序，保证“第一次出现”在未变化的目录树上可重复。
 */
final class DirectoryEntries {

    private static final LinkOption[] NO_FOLLOW = {LinkOption.NOFOLLOW_LINKS};
    private static final LinkOption[] FOLLOW = {};

    private DirectoryEntries() {
    }

    static List<Path> list(Path dir) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                children.add(child);
            }
        }
        children.sort(Comparator.comparing(DirectoryEntries::fileName));
        return children;
    }

    static BasicFileAttributes stat(Path path, boolean followSymlinks) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class, followSymlinks ? FOLLOW : NO_FOLLOW);
    }

    static String fileName(Path path) {
        Path name = path.getFileName();
        return (name != null) ? name.toString() : path.toString();
    }

    static String relativePath(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
