/**
 * ProvisionFileSpaceRequest.java
 *
 * 智能体创建流程为新智能体申请默认 filespace 时使用的请求体。
 */
package club.ppmc.filespace.model;

import jakarta.validation.constraints.NotBlank;

public record ProvisionFileSpaceRequest(@NotBlank String agentName, @NotBlank String ownerId) {}
