package org.drivesage.drive;

import org.drivesage.drive.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把工具调用方传入的路径解析成根目录白名单内的绝对路径。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径按 rootId 解析；rootId 为空时使用 root0。</li>
 *   <li>绝对路径自动匹配层级最长的 root。</li>
 *   <li>拒绝 {@code ../} 越界；未开启 {@code app.drive.follow-symlinks} 时拒绝经过符号链接的路径。</li>
 *   <li>目标不存在时（例如移动的目的地），只校验已存在的父目录链路。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final boolean followSymlinks;
    private final List<Root> roots;

    public SecurePathResolver(DriveSageProperties properties) {
        this.followSymlinks = properties.isFollowSymlinks();
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.drive.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;

        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute, requireExists);

        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot, absolute));
    }

    /**
     * 解析操作计划中的路径：目标允许不存在，是否存在由执行器判断并记录为单个操作的失败。
     */
    public Path resolveOperationPath(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("路径不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath, false);
        if (resolved.absolutePath().equals(resolved.rootPath())) {
            throw new IllegalArgumentException("不允许对根目录本身执行操作：" + resolved.rootPath());
        }
        return resolved.absolutePath();
    }

    private void validateWithinRoot(Root root, Path absolute, boolean requireExists) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        // 逐级校验：中间任何一级是链接/junction 都可能把后续路径带出根目录
        Path current = root.rootPath();
        Path relative = root.rootPath().relativize(absolute);
        for (Path segment : relative) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!followSymlinks && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                Path realCurrent = current.toRealPath();
                if (!realCurrent.startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.drive.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String rel = root.rootPath().relativize(absolute).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
