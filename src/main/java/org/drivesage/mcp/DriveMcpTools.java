package org.drivesage.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.drivesage.drive.DriveSageProperties;
import org.drivesage.drive.PendingOperationStore;
import org.drivesage.drive.SecurePathResolver;
import org.drivesage.drive.analysis.AnalysisSettings;
import org.drivesage.drive.analysis.DriveAnalyzer;
import org.drivesage.drive.analysis.DuplicateVerifier;
import org.drivesage.drive.dto.AllowedRootsResult;
import org.drivesage.drive.dto.DuplicateListResult;
import org.drivesage.drive.dto.OperationConfirmResult;
import org.drivesage.drive.dto.OperationPlanResult;
import org.drivesage.drive.dto.OperationPrepareResult;
import org.drivesage.drive.dto.analysis.AnalysisReport;
import org.drivesage.drive.dto.analysis.DuplicateVerification;
import org.drivesage.drive.dto.organize.OperationResult;
import org.drivesage.drive.organize.OperationExecutor;
import org.drivesage.drive.organize.OperationRequest;
import org.drivesage.drive.organize.OrganizePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * DriveSage MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>分析目录（{@code drive_analyze}）、查找疑似重复（{@code drive_find_duplicates}）、内容复核（{@code drive_verify_duplicates}）。</li>
 *   <li>生成整理计划（{@code drive_plan_organize}）。</li>
 *   <li>执行操作：{@code drive_prepare_operations} 演练 -> {@code drive_confirm_operations} 确认后真实执行。</li>
 *   <li>删除单个文件（{@code drive_delete_file}，必须 confirm=true）。</li>
 * </ul>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>所有路径都经过 {@link SecurePathResolver}，只允许位于 {@code app.drive.roots} 内。</li>
 *   <li>真实执行必须二次确认；{@code app.drive.allow-mutations=false} 时只允许演练。</li>
 *   <li>受保护文件只做提示，是否操作由调用方决定。</li>
 * </ul>
 */
@Component
public class DriveMcpTools {

    private static final Logger log = LoggerFactory.getLogger(DriveMcpTools.class);

    /**
     * 操作列表参数解析用的 JSON 解析器（只解析入参，默认配置即可）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final DriveSageProperties properties;
    private final SecurePathResolver pathResolver;
    private final DriveAnalyzer analyzer;
    private final DuplicateVerifier duplicateVerifier;
    private final OrganizePlanner planner;
    private final OperationExecutor executor;
    private final PendingOperationStore pendingStore;

    public DriveMcpTools(
            DriveSageProperties properties,
            SecurePathResolver pathResolver,
            DriveAnalyzer analyzer,
            DuplicateVerifier duplicateVerifier,
            OrganizePlanner planner,
            OperationExecutor executor,
            PendingOperationStore pendingStore
    ) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.analyzer = analyzer;
        this.duplicateVerifier = duplicateVerifier;
        this.planner = planner;
        this.executor = executor;
        this.pendingStore = pendingStore;
    }

    @Tool(
            name = "drive_list_roots",
            description = "列出允许分析/整理的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "drive_analyze",
            description = "递归分析目录：目录画像、大文件、系统杂项文件、受保护文件、疑似重复文件（按文件名+大小）。只读。"
    )
    /**
     * 分析目录。受保护关键字与大文件阈值可按本次调用覆盖，不影响服务端配置。
     */
    public AnalysisReport analyze(
            @ToolParam(required = false, description = "rootId（可从 drive_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空则为根目录）") String path,
            @ToolParam(required = false, description = "受保护关键字，逗号分隔（默认 app.drive.protected-patterns）") String protectedPatterns,
            @ToolParam(required = false, description = "大文件阈值（字节，默认 app.drive.large-file-threshold）") Long largeFileThresholdBytes
    ) {
        return runAnalysis(rootId, path, settings(protectedPatterns, largeFileThresholdBytes));
    }

    @Tool(
            name = "drive_find_duplicates",
            description = "查找疑似重复文件（文件名与大小都相同；不比较内容）。只读。"
    )
    public DuplicateListResult findDuplicates(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空则为根目录）") String path
    ) {
        SecurePathResolver.ResolvedPath resolved = resolveDirectory(rootId, path);
        AnalysisReport report = analyzer.analyze(resolved.absolutePath(), settings(null, null));
        return new DuplicateListResult(
                resolved.rootId(),
                resolved.displayPath(),
                report.duplicates(),
                report.warnings().isEmpty() ? null : report.warnings()
        );
    }

    @Tool(
            name = "drive_verify_duplicates",
            description = "查找疑似重复文件并用 sha256 复核内容，返回内容一致/不一致/未复核三组。只读，大目录可能较慢。"
    )
    public DuplicateVerification verifyDuplicates(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空则为根目录）") String path
    ) {
        AnalysisReport report = runAnalysis(rootId, path, settings(null, null));
        return duplicateVerifier.verify(report.duplicates());
    }

    @Tool(
            name = "drive_plan_organize",
            description = "生成整理计划：散落文件按扩展名移入分类子目录（Images/Documents/Videos/Audio），删除系统杂项文件。只生成计划，不执行。"
    )
    public OperationPlanResult planOrganize(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空则为根目录）") String path
    ) {
        SecurePathResolver.ResolvedPath resolved = resolveDirectory(rootId, path);
        AnalysisReport report = analyzer.analyze(resolved.absolutePath(), settings(null, null));
        OrganizePlanner.Plan plan = planner.plan(report);
        return new OperationPlanResult(
                resolved.rootId(),
                resolved.displayPath(),
                plan.operations(),
                plan.warnings().isEmpty() ? null : plan.warnings()
        );
    }

    @Tool(
            name = "drive_prepare_operations",
            description = "演练一批操作（不修改文件），返回演练结果与确认 token。"
                    + "operations 为 JSON 数组，元素形如 {\"type\":\"move\",\"source\":...,\"destination\":...}、"
                    + "{\"type\":\"delete\",\"path\":...}、{\"type\":\"rename\",\"oldPath\":...,\"newPath\":...}。"
    )
    /**
     * 演练并暂存操作计划。
     * <p>
     * 单个操作不合法（未知类型、缺字段、路径越界）只记为该操作的失败；整个参数不是 JSON 数组时直接报错。
     */
    public OperationPrepareResult prepareOperations(
            @ToolParam(required = false, description = "rootId（相对路径按此解析；为空默认 root0）") String rootId,
            @ToolParam(description = "操作列表（JSON 数组）") String operations
    ) {
        List<OperationRequest> requests = parseOperations(operations);
        if (requests.size() > properties.getPendingPlanMaxOperations()) {
            throw new IllegalArgumentException("操作数过多：" + requests.size() + "（上限 " + properties.getPendingPlanMaxOperations() + "）");
        }
        OperationResult preview = executor.executeRequests(requests, true, operationPathMapper(rootId));

        if (!properties.isAllowMutations() || preview.summary().successful() == 0) {
            return new OperationPrepareResult(null, preview, null);
        }
        PendingOperationStore.PendingOperationPlan plan = pendingStore.create(rootId, requests);
        return new OperationPrepareResult(plan.token(), preview, plan.expiresAt());
    }

    @Tool(
            name = "drive_confirm_operations",
            description = "确认或取消 drive_prepare_operations 暂存的操作。confirm=true 时真实执行（不可撤销）；token 只能使用一次。"
    )
    public OperationConfirmResult confirmOperations(
            @ToolParam(description = "drive_prepare_operations 返回的 token") String token,
            @ToolParam(description = "是否确认执行（true 执行，false 取消）") Boolean confirm
    ) {
        if (!Boolean.TRUE.equals(confirm)) {
            pendingStore.remove(token);
            return new OperationConfirmResult(token, false, null, null);
        }
        requireMutationsAllowed();

        PendingOperationStore.PendingOperationPlan plan = pendingStore.remove(token);
        if (plan == null) {
            throw new IllegalArgumentException("token 无效或已过期，请重新调用 drive_prepare_operations");
        }
        log.info("确认执行操作计划：token={}，操作数 {}", token, plan.operations().size());
        OperationResult result = executor.executeRequests(plan.operations(), false, operationPathMapper(plan.rootId()));
        return new OperationConfirmResult(token, true, result, Instant.now());
    }

    @Tool(
            name = "drive_delete_file",
            description = "删除单个文件或目录（目录递归删除，不可撤销）。必须 confirm=true。"
    )
    public OperationResult deleteFile(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "要删除的路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "确认删除（必须为 true）") Boolean confirm
    ) {
        if (!Boolean.TRUE.equals(confirm)) {
            throw new IllegalArgumentException("删除不可撤销，请设置 confirm=true 后重试");
        }
        requireMutationsAllowed();
        return executor.executeRequests(List.of(OperationRequest.delete(path)), false, operationPathMapper(rootId));
    }

    private AnalysisReport runAnalysis(String rootId, String path, AnalysisSettings settings) {
        SecurePathResolver.ResolvedPath resolved = resolveDirectory(rootId, path);
        return analyzer.analyze(resolved.absolutePath(), settings);
    }

    private SecurePathResolver.ResolvedPath resolveDirectory(String rootId, String path) {
        return pathResolver.resolve(rootId, path, true);
    }

    private AnalysisSettings settings(String protectedPatterns, Long largeFileThresholdBytes) {
        List<String> patterns = (protectedPatterns == null || protectedPatterns.isBlank())
                ? properties.getProtectedPatterns()
                : splitPatterns(protectedPatterns);
        long threshold = (largeFileThresholdBytes == null)
                ? properties.getLargeFileThreshold().toBytes()
                : largeFileThresholdBytes;
        return new AnalysisSettings(patterns, threshold, properties.isFollowSymlinks());
    }

    private Function<String, Path> operationPathMapper(String rootId) {
        return input -> pathResolver.resolveOperationPath(rootId, input);
    }

    private void requireMutationsAllowed() {
        if (!properties.isAllowMutations()) {
            throw new IllegalStateException("服务端已禁止真实执行（app.drive.allow-mutations=false），只能演练");
        }
    }

    static List<String> splitPatterns(String text) {
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static List<OperationRequest> parseOperations(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("operations 不能为空");
        }
        JsonNode rootNode;
        try {
            rootNode = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("operations 不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
        if (rootNode == null || !rootNode.isArray()) {
            throw new IllegalArgumentException("operations 格式错误：必须是 JSON 数组");
        }
        List<OperationRequest> requests = new ArrayList<>(rootNode.size());
        for (JsonNode node : rootNode) {
            requests.add(new OperationRequest(
                    optionalText(node, "type"),
                    optionalText(node, "source"),
                    optionalText(node, "destination"),
                    optionalText(node, "path"),
                    optionalText(node, "oldPath"),
                    optionalText(node, "newPath")
            ));
        }
        return requests;
    }

    private static String optionalText(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return (text == null || text.isBlank()) ? null : text;
    }
}
