package org.drivesage.drive;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.drivesage.drive.organize.OrganizePlanner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DriveSage 的业务配置（{@code app.drive.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许分析/整理的根目录白名单（通常是云盘的本地同步目录）。</li>
 *   <li>{@link #largeFileThreshold} 与 {@link #protectedPatterns} 是分析时的默认设置，工具调用时可以临时覆盖。</li>
 *   <li>真实执行（移动/删除）必须先演练拿到 token，再确认；{@link #allowMutations} 可整体关闭真实执行。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.drive")
public class DriveSageProperties {

    /**
     * 允许访问的根目录白名单，每个 root 自动分配 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 大文件阈值：文件大小严格大于该值时归入 largeFiles。
     */
    @NotNull
    private DataSize largeFileThreshold = DataSize.ofMegabytes(100);

    /**
     * 受保护关键字（文件名小写后做子串匹配）。
     * <p>
     * 注意：子串匹配会“宁可多报”，例如 {@code aircraft.png} 会命中 {@code ai}。
     */
    @NotNull
    private List<String> protectedPatterns = List.of("gemini", "ai", "assistant", "code", "project");

    /**
     * 是否跟随符号链接。
     * <p>
     * 默认 false：符号链接只记录告警，不进入；开启后按真实路径去重，防止循环。
     */
    private boolean followSymlinks = false;

    /**
     * 重复文件内容复核时，单个文件参与 sha256 计算的最大大小；超过则标记为未复核。
     */
    @NotNull
    private DataSize hashMaxBytes = DataSize.ofMegabytes(512);

    /**
     * 是否允许真实执行移动/删除/重命名（演练不受影响）。
     */
    private boolean allowMutations = true;

    /**
     * 待确认操作计划 token 的有效期。
     */
    @NotNull
    private Duration pendingPlanTtl = Duration.ofMinutes(10);

    /**
     * 单个操作计划允许的最大操作数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int pendingPlanMaxOperations = 10_000;

    /**
     * 整理计划使用的“扩展名 -> 分类目录”映射。
     */
    @NotNull
    private Map<String, String> organizeCategories = new LinkedHashMap<>(OrganizePlanner.DEFAULT_CATEGORIES);

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public DataSize getLargeFileThreshold() {
        return largeFileThreshold;
    }

    public void setLargeFileThreshold(DataSize largeFileThreshold) {
        this.largeFileThreshold = largeFileThreshold;
    }

    public List<String> getProtectedPatterns() {
        return protectedPatterns;
    }

    public void setProtectedPatterns(List<String> protectedPatterns) {
        this.protectedPatterns = protectedPatterns;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public DataSize getHashMaxBytes() {
        return hashMaxBytes;
    }

    public void setHashMaxBytes(DataSize hashMaxBytes) {
        this.hashMaxBytes = hashMaxBytes;
    }

    public boolean isAllowMutations() {
        return allowMutations;
    }

    public void setAllowMutations(boolean allowMutations) {
        this.allowMutations = allowMutations;
    }

    public Duration getPendingPlanTtl() {
        return pendingPlanTtl;
    }

    public void setPendingPlanTtl(Duration pendingPlanTtl) {
        this.pendingPlanTtl = pendingPlanTtl;
    }

    public int getPendingPlanMaxOperations() {
        return pendingPlanMaxOperations;
    }

    public void setPendingPlanMaxOperations(int pendingPlanMaxOperations) {
        this.pendingPlanMaxOperations = pendingPlanMaxOperations;
    }

    public Map<String, String> getOrganizeCategories() {
        return organizeCategories;
    }

    public void setOrganizeCategories(Map<String, String> organizeCategories) {
        this.organizeCategories = organizeCategories;
    }
}
