/**
 * RenameFileSpaceRequest.java
 *
 * 重命名 filespace 的请求体。
 */
package club.ppmc.filespace.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameFileSpaceRequest(@NotBlank @Size(max = 128) String newName) {}
