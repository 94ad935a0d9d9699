/**
 * BlobStore.java
 *
 * 外部 blob 存储的抽象。本层先计算并校验好所有元数据，再调用它保存字节。
 * 生产环境通常是对象存储（GCS、MinIO），默认实现 LocalDiskBlobStore 存在本地磁盘上。
 */
package club.ppmc.filespace.service;

import java.io.IOException;

public interface BlobStore {

    void put(String key, byte[] bytes) throws IOException;

    void delete(String key) throws IOException;
}
