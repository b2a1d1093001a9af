package org.drivesage.drive.analysis;

import org.drivesage.drive.IoErrors;
import org.drivesage.drive.dto.analysis.AnalysisReport;
import org.drivesage.drive.dto.analysis.FileRecord;
import org.drivesage.drive.dto.analysis.FolderProfile;
import org.drivesage.drive.dto.analysis.ScanError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 目录分析：递归遍历整棵目录树，生成目录画像、分类结果，并合并重复检测结果。
 * <p>
 * 遍历规则（深度优先、先序、按名称排序）：
 * <ol>
 *   <li>列出当前目录子项；根目录列不出来直接失败，其余目录失败只记一条错误并跳过整个子树。</li>
 *   <li>逐个读取子项属性；单个失败只记错误并跳过该条目，不影响兄弟条目。</li>
 *   <li>子目录：先生成目录画像（一次列目录同时得到子项），成功后计数、加入 folders 并递归；画像失败记一条错误，不再进入。</li>
 *   <li>文件：计数、累加大小、分类（大文件 / 系统文件 / 受保护文件，可同时命中多类）。</li>
 * </ol>
 * <p>
 * 根目录本身不生成画像，也不计入 folderCount。
 * <p>
 * 不支持取消：调用方如需超时，请在外部控制并丢弃结果。
 */
public class DriveAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DriveAnalyzer.class);

    static final String PROTECTED_REASON_PREFIX = "文件名包含受保护关键字：";

    private final DuplicateDetector duplicateDetector;

    public DriveAnalyzer(DuplicateDetector duplicateDetector) {
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector");
    }

    public AnalysisReport analyze(Path drivePath, AnalysisSettings settings) {
        Objects.requireNonNull(drivePath, "drivePath");
        Objects.requireNonNull(settings, "settings");

        Path root = drivePath.toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("路径不存在：" + root);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("不是目录：" + root);
        }

        log.info("开始分析目录：{}", root);
        Instant scanTime = Instant.now();

        List<Path> rootChildren;
        try {
            rootChildren = DirectoryEntries.list(root);
        } catch (IOException e) {
            log.error("分析失败，根目录无法读取：{}", root, e);
            throw new IllegalStateException("读取失败：" + IoErrors.describe(e), e);
        }

        Walk walk = new Walk(root, settings);
        walk.markVisited(root);
        walk.visitChildren(walk.statEach(rootChildren));

        DuplicateDetector.DuplicateScan duplicateScan = duplicateDetector.detect(root, settings.followSymlinks());
        walk.warnings.addAll(duplicateScan.warnings());

        log.info("目录分析完成：{}，文件 {} 个，目录 {} 个，总大小 {} 字节，错误 {} 条",
                root, walk.fileCount, walk.folderCount, walk.totalSize, walk.errors.size());

        return new AnalysisReport(
                root.toString(),
                scanTime,
                walk.totalSize,
                walk.fileCount,
                walk.folderCount,
                walk.folders,
                walk.largeFiles,
                walk.systemFiles,
                walk.protectedFiles,
                duplicateScan.duplicates(),
                walk.errors,
                walk.warnings
        );
    }

    /**
     * 单次遍历的累加状态，不跨调用复用。
     */
    private static final class Walk {

        private final Path root;
        private final AnalysisSettings settings;
        private final FolderProfiler profiler;
        private final Set<Path> visitedRealDirs = new HashSet<>();

        private long totalSize;
        private int fileCount;
        private int folderCount;
        private final List<FolderProfile> folders = new ArrayList<>();
        private final List<FileRecord> largeFiles = new ArrayList<>();
        private final List<FileRecord> systemFiles = new ArrayList<>();
        private final List<FileRecord> protectedFiles = new ArrayList<>();
        private final List<ScanError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Walk(Path root, AnalysisSettings settings) {
            this.root = root;
            this.settings = settings;
            this.profiler = new FolderProfiler(settings.followSymlinks());
        }

        /**
         * 根目录的子项没有目录画像可复用，这里逐个读取属性，失败的条目只记错误。
         */
        private List<FolderProfiler.Child> statEach(List<Path> paths) {
            List<FolderProfiler.Child> children = new ArrayList<>(paths.size());
            for (Path path : paths) {
                try {
                    BasicFileAttributes attrs = DirectoryEntries.stat(path, settings.followSymlinks());
                    children.add(new FolderProfiler.Child(path, DirectoryEntries.fileName(path), attrs));
                } catch (IOException e) {
                    error(path, IoErrors.describe(e));
                }
            }
            return children;
        }

        private void visitChildren(List<FolderProfiler.Child> children) {
            for (FolderProfiler.Child child : children) {
                if (child.isDirectory()) {
                    visitDirectory(child);
                } else if (child.isSymlink()) {
                    warn("已跳过符号链接：" + DirectoryEntries.relativePath(root, child.path()));
                } else {
                    visitFile(child);
                }
            }
        }

        private void visitDirectory(FolderProfiler.Child child) {
            Path dir = child.path();
            if (!markVisited(dir)) {
                return;
            }

            FolderProfiler.Snapshot snapshot;
            try {
                snapshot = profiler.snapshot(root, dir);
            } catch (IOException e) {
                error(dir, IoErrors.describe(e));
                return;
            }

            folderCount++;
            folders.add(snapshot.profile());
            visitChildren(snapshot.children());
        }

        private void visitFile(FolderProfiler.Child child) {
            BasicFileAttributes attrs = child.attrs();
            long size = attrs.size();
            fileCount++;
            totalSize += size;

            if (EntryClassifier.isLargeFile(size, settings.largeFileThresholdBytes())) {
                largeFiles.add(toRecord(child, null));
            }
            if (EntryClassifier.isSystemFile(child.name())) {
                systemFiles.add(toRecord(child, null));
            }
            Optional<String> pattern = EntryClassifier.matchProtectedPattern(child.name(), settings.protectedPatterns());
            pattern.ifPresent(p -> protectedFiles.add(toRecord(child, PROTECTED_REASON_PREFIX + p)));
        }

        private FileRecord toRecord(FolderProfiler.Child child, String reason) {
            return new FileRecord(
                    child.name(),
                    child.path().toString(),
                    DirectoryEntries.relativePath(root, child.path()),
                    child.attrs().size(),
                    child.attrs().lastModifiedTime().toInstant(),
                    reason
            );
        }

        /**
         * 跟随符号链接时按真实路径去重，保证遇到循环链接也能结束。
         */
        private boolean markVisited(Path dir) {
            if (!settings.followSymlinks()) {
                return true;
            }
            Path real;
            try {
                real = dir.toRealPath();
            } catch (IOException e) {
                error(dir, IoErrors.describe(e));
                return false;
            }
            if (!visitedRealDirs.add(real)) {
                warn("疑似存在循环引用，已跳过目录：" + DirectoryEntries.relativePath(root, dir));
                return false;
            }
            return true;
        }

        private void error(Path path, String message) {
            log.warn("读取失败：{}（{}）", path, message);
            errors.add(new ScanError(path.toString(), message));
        }

        private void warn(String message) {
            log.debug(message);
            warnings.add(message);
        }
    }
}
