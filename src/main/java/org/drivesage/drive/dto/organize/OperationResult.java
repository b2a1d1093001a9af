package org.drivesage.drive.dto.organize;

import java.util.List;

/**
 * 一批操作的执行结果。
 *
 * @param dryRun  是否为演练（演练不会修改文件系统）
 * @param moved   移动成功的操作
 * @param deleted 删除成功的路径
 * @param renamed 重命名成功的操作
 * @param errors  失败的操作
 * @param summary 统计
 */
public record OperationResult(
        boolean dryRun,
        List<MoveRecord> moved,
        List<String> deleted,
        List<RenameRecord> renamed,
        List<OperationError> errors,
        OperationSummary summary
) {
    public OperationResult {
        moved = List.copyOf(moved);
        deleted = List.copyOf(deleted);
        renamed = List.copyOf(renamed);
        errors = List.copyOf(errors);
    }
}
