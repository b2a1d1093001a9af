package org.drivesage.drive;

import org.drivesage.drive.organize.OperationRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingOperationStoreTest {

    private final List<OperationRequest> operations = List.of(OperationRequest.delete("a.txt"));

    @Test
    void token_isSingleUse() {
        PendingOperationStore store = new PendingOperationStore(Duration.ofMinutes(5), 10);

        PendingOperationStore.PendingOperationPlan plan = store.create("root0", operations);

        assertThat(plan.token()).isNotBlank();
        assertThat(plan.expiresAt()).isAfter(plan.createdAt());
        assertThat(store.get(plan.token())).isEqualTo(plan);
        assertThat(store.remove(plan.token())).isEqualTo(plan);
        assertThat(store.remove(plan.token())).isNull();
        assertThat(store.get(plan.token())).isNull();
    }

    @Test
    void expiredPlansAreNotReturned() {
        PendingOperationStore store = new PendingOperationStore(Duration.ofSeconds(-1), 10);

        PendingOperationStore.PendingOperationPlan plan = store.create(null, operations);

        assertThat(plan.isExpired()).isTrue();
        assertThat(store.get(plan.token())).isNull();
        assertThat(store.remove(plan.token())).isNull();
    }

    @Test
    void create_rejectsTooManyOperations() {
        PendingOperationStore store = new PendingOperationStore(Duration.ofMinutes(5), 1);

        assertThatThrownBy(() -> store.create(null, List.of(OperationRequest.delete("a"), OperationRequest.delete("b"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("操作数过多");
    }

    @Test
    void blankTokensAreIgnored() {
        PendingOperationStore store = new PendingOperationStore(Duration.ofMinutes(5), 10);

        assertThat(store.get(null)).isNull();
        assertThat(store.remove(" ")).isNull();
    }
}
