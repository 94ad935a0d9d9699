/**
 * IdBatches.java
 *
 * 把较长的 ID 列表切成固定大小的批次，避免 {@code in (...)} 参数超过数据库的绑定变量上限。
 */
package club.ppmc.filespace.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class IdBatches {

    public static final int BATCH_SIZE = 500;

    private IdBatches() {}

    public static <T> List<List<T>> of(Collection<T> ids) {
        List<T> all = List.copyOf(ids);
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < all.size(); from += BATCH_SIZE) {
            batches.add(all.subList(from, Math.min(from + BATCH_SIZE, all.size())));
        }
        return batches;
    }
}
