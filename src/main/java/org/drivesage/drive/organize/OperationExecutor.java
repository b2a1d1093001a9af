package org.drivesage.drive.organize;

import org.drivesage.drive.IoErrors;
import org.drivesage.drive.dto.organize.MoveRecord;
import org.drivesage.drive.dto.organize.OperationError;
import org.drivesage.drive.dto.organize.OperationResult;
import org.drivesage.drive.dto.organize.OperationSummary;
import org.drivesage.drive.dto.organize.RenameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 按输入顺序执行整理操作（移动 / 删除 / 重命名）。
 * <p>
 * 执行语义：
 * <ul>
 *   <li>严格按输入顺序，不重排、不合并：后面的操作可能依赖前面操作的结果。</li>
 *   <li>每个操作独立成败：失败只记录到 errors 并计入 failed，后续操作照常执行；不做整体回滚。</li>
 *   <li>演练（dryRun）只记录结果，不触碰文件系统。</li>
 * </ul>
 * <p>
 * 内部不加锁：调用方需保证不会对重叠路径并发执行两批操作。
 */
public class OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);

    public OperationResult execute(List<? extends Operation> operations, boolean dryRun) {
        Objects.requireNonNull(operations, "operations");
        Ledger ledger = new Ledger(dryRun);
        for (Operation operation : operations) {
            apply(operation, ledger);
        }
        return ledger.finish(operations.size());
    }

    /**
     * 执行调用方传入的原始操作：转换（类型/字段/路径校验）也在单个操作的失败隔离范围内。
     */
    public OperationResult executeRequests(List<OperationRequest> requests, boolean dryRun, Function<String, Path> pathMapper) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(pathMapper, "pathMapper");
        Ledger ledger = new Ledger(dryRun);
        for (OperationRequest request : requests) {
            if (request == null) {
                ledger.fail(null, null, "操作为空");
                continue;
            }
            Operation operation;
            try {
                operation = request.toOperation(pathMapper);
            } catch (RuntimeException e) {
                ledger.fail(request.type(), request.primaryPath(), message(e));
                continue;
            }
            apply(operation, ledger);
        }
        return ledger.finish(requests.size());
    }

    private void apply(Operation operation, Ledger ledger) {
        if (operation == null) {
            ledger.fail(null, null, "操作为空");
            return;
        }
        boolean dryRun = ledger.dryRun;
        try {
            if (operation instanceof Operation.Move move) {
                if (!dryRun) {
                    movePath(move.source(), move.destination());
                }
                ledger.moved.add(new MoveRecord(move.source().toString(), move.destination().toString()));
                log.info("{}移动：{} -> {}", prefix(dryRun), move.source(), move.destination());
            } else if (operation instanceof Operation.Delete delete) {
                if (!dryRun) {
                    deletePath(delete.path());
                }
                ledger.deleted.add(delete.path().toString());
                log.info("{}删除：{}", prefix(dryRun), delete.path());
            } else if (operation instanceof Operation.Rename rename) {
                if (!dryRun) {
                    movePath(rename.oldPath(), rename.newPath());
                }
                ledger.renamed.add(new RenameRecord(rename.oldPath().toString(), rename.newPath().toString()));
                log.info("{}重命名：{} -> {}", prefix(dryRun), rename.oldPath(), rename.newPath());
            } else {
                // Operation 是 sealed 接口，正常情况下不会走到这里
                throw new IllegalArgumentException("不支持的操作类型：" + operation.getClass().getName());
            }
            ledger.successful++;
        } catch (IOException e) {
            ledger.fail(operation.type(), String.valueOf(operation.primaryPath()), IoErrors.describe(e));
        } catch (RuntimeException e) {
            ledger.fail(operation.type(), String.valueOf(operation.primaryPath()), message(e));
        }
    }

    /**
     * 移动文件或目录：源必须存在，目标不能已存在（不覆盖），缺少的目标父目录会自动创建。
     */
    static void movePath(Path source, Path destination) throws IOException {
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(source.toString());
        }
        if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(destination.toString());
        }
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.move(source, destination);
    }

    /**
     * 删除文件或目录（目录递归删除）；符号链接只删除链接本身，不进入链接目标。
     */
    static void deletePath(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static String message(RuntimeException e) {
        return (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String prefix(boolean dryRun) {
        return dryRun ? "[演练] " : "";
    }

    /**
     * 单次执行的结果台账。
     */
    private static final class Ledger {

        private final boolean dryRun;
        private final List<MoveRecord> moved = new ArrayList<>();
        private final List<String> deleted = new ArrayList<>();
        private final List<RenameRecord> renamed = new ArrayList<>();
        private final List<OperationError> errors = new ArrayList<>();
        private int successful;
        private int failed;

        private Ledger(boolean dryRun) {
            this.dryRun = dryRun;
        }

        private void fail(String type, String path, String message) {
            failed++;
            errors.add(new OperationError(type, path, message));
            log.warn("{}操作失败：{} {}（{}）", prefix(dryRun), type, path, message);
        }

        private OperationResult finish(int total) {
            OperationSummary summary = new OperationSummary(total, successful, failed);
            log.info("{}操作执行完成：共 {}，成功 {}，失败 {}", prefix(dryRun), total, successful, failed);
            return new OperationResult(dryRun, moved, deleted, renamed, errors, summary);
        }
    }
}
