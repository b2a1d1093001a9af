package org.drivesage.drive.organize;

import org.drivesage.drive.dto.analysis.AnalysisReport;
import org.drivesage.drive.dto.analysis.FileRecord;
import org.drivesage.drive.dto.analysis.FolderProfile;
import org.drivesage.drive.dto.analysis.LooseFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 根据分析结果生成整理计划。
 * <p>
 * 规则：
 * <ul>
 *   <li>每个目录画像里的散落文件，按扩展名归入同级分类子目录（例如 {@code photo.jpg -> Images/photo.jpg}）。</li>
 *   <li>没有扩展名、扩展名不在映射表里，或以 {@code .} 开头的文件保持不动。</li>
 *   <li>系统杂项文件（{@code .DS_Store} 等）全部删除。</li>
 * </ul>
 * 受保护文件只是提示，不会被排除在计划之外，计划中涉及时会给出告警。
 */
public class OrganizePlanner {

    public static final Map<String, String> DEFAULT_CATEGORIES = Collections.unmodifiableMap(defaultCategories());

    private final Map<String, String> categories;

    public OrganizePlanner(Map<String, String> categories) {
        Map<String, String> normalized = new LinkedHashMap<>();
        categories.forEach((ext, folder) -> {
            if (ext != null && !ext.isBlank() && folder != null && !folder.isBlank()) {
                normalized.put(normalizeExtension(ext), folder.trim());
            }
        });
        this.categories = Map.copyOf(normalized);
    }

    public Plan plan(AnalysisReport report) {
        Set<String> protectedPaths = new HashSet<>();
        for (FileRecord file : report.protectedFiles()) {
            protectedPaths.add(file.path());
        }

        List<OperationRequest> operations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (FolderProfile folder : report.folders()) {
            Path folderPath = Path.of(folder.path());
            for (LooseFile file : folder.looseFiles()) {
                String category = categoryOf(file.name());
                if (category == null) {
                    continue;
                }
                Path source = folderPath.resolve(file.name());
                Path destination = folderPath.resolve(category).resolve(file.name());
                operations.add(OperationRequest.move(source.toString(), destination.toString()));
                if (protectedPaths.contains(source.toString())) {
                    warnings.add("计划移动受保护文件：" + source);
                }
            }
        }

        for (FileRecord file : report.systemFiles()) {
            operations.add(OperationRequest.delete(file.path()));
        }

        return new Plan(operations, warnings);
    }

    /**
     * 返回文件应归入的分类目录；不需要整理时返回 null。
     */
    public String categoryOf(String fileName) {
        if (fileName == null || fileName.startsWith(".")) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return categories.get(normalizeExtension(fileName.substring(dot + 1)));
    }

    private static String normalizeExtension(String ext) {
        String trimmed = ext.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    private static Map<String, String> defaultCategories() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("jpg", "Images");
        map.put("jpeg", "Images");
        map.put("png", "Images");
        map.put("gif", "Images");
        map.put("pdf", "Documents");
        map.put("doc", "Documents");
        map.put("docx", "Documents");
        map.put("txt", "Documents");
        map.put("mp4", "Videos");
        map.put("mov", "Videos");
        map.put("mp3", "Audio");
        map.put("wav", "Audio");
        return map;
    }

    /**
     * @param operations 计划执行的操作（先移动，后删除）
     * @param warnings   提示
     */
    public record Plan(List<OperationRequest> operations, List<String> warnings) {
        public Plan {
            operations = List.copyOf(operations);
            warnings = List.copyOf(warnings);
        }
    }
}
