package org.drivesage.drive.organize;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/**
 * 调用方传入的操作（未校验的原始形式）。
 * <p>
 * 按 {@code type} 使用不同字段：
 * <ul>
 *   <li>{@code move}：source、destination</li>
 *   <li>{@code delete}：path</li>
 *   <li>{@code rename}：oldPath、newPath</li>
 * </ul>
 * 转换为 {@link Operation} 时，未知类型、缺少字段或路径不合法都会抛出 {@link IllegalArgumentException}，
 * 执行器把它记为这一条操作的失败。
 *
 * @param type        操作类型
 * @param source      move 的源路径
 * @param destination move 的目标路径
 * @param path        delete 的路径
 * @param oldPath     rename 的原路径
 * @param newPath     rename 的新路径
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationRequest(
        String type,
        String source,
        String destination,
        String path,
        String oldPath,
        String newPath
) {

    public static OperationRequest move(String source, String destination) {
        return new OperationRequest(Operation.MOVE, source, destination, null, null, null);
    }

    public static OperationRequest delete(String path) {
        return new OperationRequest(Operation.DELETE, null, null, path, null, null);
    }

    public static OperationRequest rename(String oldPath, String newPath) {
        return new OperationRequest(Operation.RENAME, null, null, null, oldPath, newPath);
    }

    /**
     * 错误记录中展示的主路径（与 {@link Operation#primaryPath()} 对应）。
     */
    public String primaryPath() {
        if (source != null) {
            return source;
        }
        if (path != null) {
            return path;
        }
        return oldPath;
    }

    /**
     * @param pathMapper 把调用方的路径字符串解析为绝对路径（负责白名单校验）
     */
    public Operation toOperation(Function<String, Path> pathMapper) {
        String normalizedType = (type == null) ? "" : type.trim().toLowerCase(Locale.ROOT);
        switch (normalizedType) {
            case Operation.MOVE:
                return new Operation.Move(
                        pathMapper.apply(required(source, "source")),
                        pathMapper.apply(required(destination, "destination"))
                );
            case Operation.DELETE:
                return new Operation.Delete(pathMapper.apply(required(path, "path")));
            case Operation.RENAME:
                return new Operation.Rename(
                        pathMapper.apply(required(oldPath, "oldPath")),
                        pathMapper.apply(required(newPath, "newPath"))
                );
            default:
                throw new IllegalArgumentException("不支持的操作类型：" + type);
        }
    }

    private String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type + " 操作缺少字段：" + field);
        }
        return value;
    }
}
