/**
 * ImportedNode.java
 *
 * 导入附件后生成的节点信息。
 */
package club.ppmc.filespace.model;

import java.util.UUID;

public record ImportedNode(UUID nodeId, String path, String filename) {}
