/**
 * LocalDiskBlobStore.java
 *
 * 把对象键直接映射为 blob 根目录下相对路径的 BlobStore 实现。
 * 根目录由 filespace.blob-root 配置，启动时如果不存在会被创建。
 */
package club.ppmc.filespace.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class LocalDiskBlobStore implements BlobStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDiskBlobStore.class);

    private final Path root;

    public LocalDiskBlobStore(@Value("${filespace.blob-root:./blobs}") String blobRoot) {
        this.root = Paths.get(blobRoot).toAbsolutePath().normalize();
        if (Files.notExists(root)) {
            try {
                Files.createDirectories(root);
                LOGGER.info("blob 根目录不存在，已创建: {}", root);
            } catch (IOException e) {
                LOGGER.error("致命错误: 无法在以下路径创建 blob 根目录: {}", root, e);
                throw new IllegalStateException("无法创建 blob 目录: " + root, e);
            }
        }
    }

    @Override
    public void put(String key, byte[] bytes) throws IOException {
        Path target = resolve(key);
        FileUtils.forceMkdirParent(target.toFile());
        Files.write(target, bytes);
        LOGGER.debug("已写入 blob: {} ({} 字节)", key, bytes.length);
    }

    @Override
    public void delete(String key) throws IOException {
        if (Files.deleteIfExists(resolve(key))) {
            LOGGER.debug("已删除 blob: {}", key);
        }
    }

    private Path resolve(String key) throws IOException {
        Path target = root.resolve(key).normalize();
        // 对象键由本层生成，但仍然防止落到根目录之外
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IOException("无效的对象键: " + key);
        }
        return target;
    }
}
