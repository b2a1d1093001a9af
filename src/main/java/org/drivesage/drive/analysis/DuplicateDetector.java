package org.drivesage.drive.analysis;

import org.drivesage.drive.IoErrors;
import org.drivesage.drive.dto.analysis.DuplicateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 疑似重复文件检测。
 * <p>
 * 指纹是“文件名 + 大小”，不读文件内容：只用于快速找出明显的重复下载副本，需要准确结论时再对候选做
 * 内容哈希（见 {@link DuplicateVerifier}）。
 * <p>
 * 深度优先、按名称排序遍历；同一指纹第一次出现的路径永远是 original，后续出现的都指向它，不会链式传递。
 * 读取失败只写入告警，不中断遍历。
 */
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    public DuplicateScan detect(Path root, boolean followSymlinks) {
        Path base = root.toAbsolutePath().normalize();
        Scan scan = new Scan(base, followSymlinks);
        if (followSymlinks) {
            scan.markVisited(base);
        }
        scan.walk(base);
        log.info("重复检测完成：{}，疑似重复 {} 个", base, scan.duplicates.size());
        return new DuplicateScan(scan.duplicates, scan.warnings);
    }

    /**
     * @param duplicates 疑似重复文件
     * @param warnings   遍历中的读取失败等非致命告警
     */
    public record DuplicateScan(List<DuplicateRecord> duplicates, List<String> warnings) {
        public DuplicateScan {
            duplicates = List.copyOf(duplicates);
            warnings = List.copyOf(warnings);
        }
    }

    private record Fingerprint(String name, long size) {
    }

    private static final class Scan {

        private final Path root;
        private final boolean followSymlinks;
        private final Map<Fingerprint, Path> firstSeen = new HashMap<>();
        private final Set<Path> visitedRealDirs = new HashSet<>();
        private final List<DuplicateRecord> duplicates = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Scan(Path root, boolean followSymlinks) {
            this.root = root;
            this.followSymlinks = followSymlinks;
        }

        private void walk(Path dir) {
            List<Path> children;
            try {
                children = DirectoryEntries.list(dir);
            } catch (IOException e) {
                warn("重复检测时无法列出目录：" + dir + "（" + IoErrors.describe(e) + "）");
                return;
            }

            for (Path child : children) {
                BasicFileAttributes attrs;
                try {
                    attrs = DirectoryEntries.stat(child, followSymlinks);
                } catch (IOException e) {
                    warn("重复检测时无法读取：" + child + "（" + IoErrors.describe(e) + "）");
                    continue;
                }

                if (attrs.isDirectory()) {
                    if (followSymlinks && !markVisited(child)) {
                        continue;
                    }
                    walk(child);
                } else if (!attrs.isSymbolicLink()) {
                    record(child, attrs);
                }
            }
        }

        private void record(Path file, BasicFileAttributes attrs) {
            Fingerprint fingerprint = new Fingerprint(DirectoryEntries.fileName(file), attrs.size());
            Path original = firstSeen.putIfAbsent(fingerprint, file);
            if (original == null) {
                return;
            }
            duplicates.add(new DuplicateRecord(
                    original.toString(),
                    file.toString(),
                    DirectoryEntries.relativePath(root, file),
                    attrs.size(),
                    attrs.lastModifiedTime().toInstant()
            ));
        }

        private boolean markVisited(Path dir) {
            try {
                return visitedRealDirs.add(dir.toRealPath());
            } catch (IOException e) {
                warn("重复检测时目录无法解析，已跳过：" + dir + "（" + IoErrors.describe(e) + "）");
                return false;
            }
        }

        private void warn(String message) {
            log.warn(message);
            warnings.add(message);
        }
    }
}
