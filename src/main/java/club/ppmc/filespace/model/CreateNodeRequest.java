/**
 * CreateNodeRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装创建新文件或目录的请求。
 *
 * @param parentId 父目录ID，为空表示创建在根层级。
 * @param name 新建文件或目录的名称。
 * @param type 创建的类型，必须是 "file" 或 "directory" (或其别名"folder")。
 * @param createdBy (可选) 创建者标识，例如智能体ID。
 */
package club.ppmc.filespace.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.UUID;

public record CreateNodeRequest(
        UUID parentId,
        @NotBlank String name,
        @NotBlank @Pattern(
                regexp = "file|directory|folder",
                message = "类型必须是 'file', 'directory', 或 'folder'")
        String type,
        String createdBy) {

    public NodeType nodeType() {
        return "file".equals(type) ? NodeType.FILE : NodeType.DIRECTORY;
    }
}
