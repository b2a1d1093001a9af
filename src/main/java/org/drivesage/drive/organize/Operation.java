package org.drivesage.drive.organize;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 整理操作（只是数据，由 {@link OperationExecutor} 按顺序消费一次）。
 */
public sealed interface Operation permits Operation.Move, Operation.Delete, Operation.Rename {

    String MOVE = "move";
    String DELETE = "delete";
    String RENAME = "rename";

    /**
     * 操作类型，用于结果中的错误记录。
     */
    String type();

    /**
     * 错误记录中展示的主路径。
     */
    Path primaryPath();

    record Move(Path source, Path destination) implements Operation {
        public Move {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(destination, "destination");
        }

        @Override
        public String type() {
            return MOVE;
        }

        @Override
        public Path primaryPath() {
            return source;
        }
    }

    record Delete(Path path) implements Operation {
        public Delete {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String type() {
            return DELETE;
        }

        @Override
        public Path primaryPath() {
            return path;
        }
    }

    /**
     * 在文件系统层面与 {@link Move} 相同，只是结果中单独归类。
     */
    record Rename(Path oldPath, Path newPath) implements Operation {
        public Rename {
            Objects.requireNonNull(oldPath, "oldPath");
            Objects.requireNonNull(newPath, "newPath");
        }

        @Override
        public String type() {
            return RENAME;
        }

        @Override
        public Path primaryPath() {
            return oldPath;
        }
    }
}
