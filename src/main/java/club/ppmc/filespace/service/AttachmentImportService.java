/**
 * AttachmentImportService.java
 *
 * 把消息附件导入智能体的 filespace，是节点创建接口的调用方之一。
 * 附件按接收日期放在 /Inbox/yyyy-MM-dd/ 下，目录不存在时自动创建，重名的文件会被自动编号。
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.ImportedNode;
import club.ppmc.filespace.model.NodeContent;
import club.ppmc.filespace.model.NodeType;
import java.time.LocalDate;
import java.util.UUID;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class AttachmentImportService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttachmentImportService.class);
    private static final String DEFAULT_ATTACHMENT_NAME = "attachment";

    private final FsNodeService nodeService;
    private final String inboxDir;

    public AttachmentImportService(
            FsNodeService nodeService, @Value("${filespace.import.inbox-dir:Inbox}") String inboxDir) {
        this.nodeService = nodeService;
        this.inboxDir = inboxDir;
    }

    /**
     * 导入单个附件。
     *
     * @param filename 附件原始文件名，可以为空。
     * @param date 消息接收日期，决定目标子目录。
     * @return 新建节点的ID、路径和最终使用的文件名。
     */
    @Transactional
    public ImportedNode importAttachment(
            UUID fileSpaceId, String filename, byte[] bytes, String mimeType, LocalDate date, String createdBy) {
        FsNode inbox = nodeService.getOrCreateDirectory(fileSpaceId, null, inboxDir);
        FsNode dateDir = nodeService.getOrCreateDirectory(fileSpaceId, inbox.getId(), date.toString());

        String name = nodeService.dedupeName(fileSpaceId, dateDir.getId(), baseNameOf(filename));
        FsNode node = nodeService.create(
                fileSpaceId,
                dateDir.getId(),
                NodeType.FILE,
                name,
                new NodeContent(filename, bytes, mimeType),
                createdBy);
        LOGGER.info("已将附件 '{}' 导入为 {}", filename, node.getPath());
        return new ImportedNode(node.getId(), node.getPath(), name);
    }

    private static String baseNameOf(String filename) {
        if (!StringUtils.hasText(filename)) {
            return DEFAULT_ATTACHMENT_NAME;
        }
        String base = FilenameUtils.getName(filename.replace("\0", "")).strip();
        return StringUtils.hasText(base) ? base : DEFAULT_ATTACHMENT_NAME;
    }
}
