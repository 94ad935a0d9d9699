/**
 * CreateFileSpaceRequest.java
 *
 * 创建 filespace 的请求体。
 *
 * @param name filespace 名称，同一所有者下唯一。
 * @param ownerId 所有者标识。
 * @param description (可选) 描述。
 */
package club.ppmc.filespace.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateFileSpaceRequest(
        @NotBlank @Size(max = 128) String name, @NotBlank String ownerId, String description) {}
