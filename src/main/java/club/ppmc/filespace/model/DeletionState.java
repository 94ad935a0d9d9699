/**
 * DeletionState.java
 *
 * 节点的软删除状态：要么存活，要么在某个时间点被删除。
 * 两种状态互斥，删除时间只存在于 Deleted 中。
 */
package club.ppmc.filespace.model;

import java.time.Instant;
import java.util.Objects;

public sealed interface DeletionState permits DeletionState.Live, DeletionState.Deleted {

    Live LIVE = new Live();

    static DeletionState of(boolean deleted, Instant deletedAt) {
        return deleted ? new Deleted(deletedAt) : LIVE;
    }

    boolean isDeleted();

    record Live() implements DeletionState {
        @Override
        public boolean isDeleted() {
            return false;
        }
    }

    record Deleted(Instant at) implements DeletionState {
        public Deleted {
            Objects.requireNonNull(at, "删除时间不能为空");
        }

        @Override
        public boolean isDeleted() {
            return true;
        }
    }
}
