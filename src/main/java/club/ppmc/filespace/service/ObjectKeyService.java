/**
 * ObjectKeyService.java
 *
 * 计算文件节点内容在外部 blob 存储中的对象键。
 *
 * <p>键的格式为 {@code <prefix>/<filespaceId>/<nodeId>/<安全文件名>}。
 * 前面几段只依赖 filespace 和节点的ID，因此节点重命名或移动后键保持不变，
 * 只有最后的文件名段来自名称。节点ID在构造时就已生成，所以保存之前也可以安全调用。</p>
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.util.NodeNames;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ObjectKeyService {

    private final String keyPrefix;

    public ObjectKeyService(@Value("${filespace.object-key-prefix:agent_fs}") String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /**
     * 计算一次新上传将使用的对象键。
     *
     * @param node 目标文件节点。
     * @param filename (可选) 原始文件名；为空或清洗后为空时依次退回到节点名称和 "file"。
     * @return 确定性的对象键，相同参数多次调用结果相同。
     */
    public String objectKey(FsNode node, String filename) {
        String safe = NodeNames.sanitize(filename);
        if (safe == null) {
            safe = NodeNames.sanitize(node.getName());
        }
        if (safe == null) {
            safe = NodeNames.FALLBACK_FILENAME;
        }
        return keyPrefix + "/" + node.getFileSpaceId() + "/" + node.getId() + "/" + safe;
    }

    /**
     * 当前内容的对象键：已经存储过内容时返回实际存储的键，否则返回按节点名称计算的候选键。
     */
    public String currentKey(FsNode node) {
        if (node.getContentKey() != null && !node.getContentKey().isEmpty()) {
            return node.getContentKey();
        }
        return objectKey(node, null);
    }
}
