package org.drivesage.drive;

import org.drivesage.drive.organize.OperationRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 待确认的操作计划存储（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code drive_prepare_operations}：先演练整批操作，生成 token 并暂存操作列表。</li>
 *   <li>{@code drive_confirm_operations}：用户明确 {@code confirm=true} 后，用 token 取出同一批操作真实执行。</li>
 * </ol>
 * <p>
 * token 有 TTL，过期自动失效；token 只能使用一次。仅适用于单实例部署。
 */
public class PendingOperationStore {

    private final Duration ttl;
    private final int maxOperations;
    private final ConcurrentHashMap<String, PendingOperationPlan> store = new ConcurrentHashMap<>();

    public PendingOperationStore(Duration ttl, int maxOperations) {
        this.ttl = ttl;
        this.maxOperations = maxOperations;
    }

    public PendingOperationPlan create(String rootId, List<OperationRequest> operations) {
        cleanupExpired();
        if (operations.size() > maxOperations) {
            throw new IllegalArgumentException("操作数过多：" + operations.size() + "（上限 " + maxOperations + "）");
        }
        String token = UUID.randomUUID().toString();
        Instant now = Instant.now();
        PendingOperationPlan plan = new PendingOperationPlan(token, rootId, List.copyOf(operations), now, now.plus(ttl));
        store.put(token, plan);
        return plan;
    }

    PendingOperationPlan get(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingOperationPlan plan = store.get(token);
        if (plan == null) {
            return null;
        }
        if (plan.isExpired()) {
            store.remove(token);
            return null;
        }
        return plan;
    }

    public PendingOperationPlan remove(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingOperationPlan plan = store.remove(token);
        if (plan == null) {
            return null;
        }
        return plan.isExpired() ? null : plan;
    }

    private void cleanupExpired() {
        Instant now = Instant.now();
        for (Map.Entry<String, PendingOperationPlan> entry : store.entrySet()) {
            if (entry.getValue().expiresAt().isBefore(now)) {
                store.remove(entry.getKey());
            }
        }
    }

    public record PendingOperationPlan(
            String token,
            String rootId,
            List<OperationRequest> operations,
            Instant createdAt,
            Instant expiresAt
    ) {
        public boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }
}
