package org.drivesage.drive.dto;

import org.drivesage.drive.organize.OperationRequest;

import java.util.List;

/**
 * {@code drive_plan_organize} 的返回结果（只生成计划，不执行）。
 *
 * @param rootId     根目录标识
 * @param path       扫描目录（相对 root，统一使用 / 分隔）
 * @param operations 建议执行的操作，可原样传给 {@code drive_prepare_operations}
 * @param warnings   提示（例如计划中包含受保护文件）
 */
public record OperationPlanResult(
        String rootId,
        String path,
        List<OperationRequest> operations,
        List<String> warnings
) {
}
