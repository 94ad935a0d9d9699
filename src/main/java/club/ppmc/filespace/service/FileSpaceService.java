/**
 * FileSpaceService.java
 *
 * filespace 注册表：创建、重命名和查询 filespace。
 * 同一所有者下 filespace 名称唯一。基于角色的访问控制完全由外部协作方负责，
 * 本服务信任收到的每个调用都已经过授权。
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.exception.DuplicateFileSpaceNameException;
import club.ppmc.filespace.exception.InvalidNameException;
import club.ppmc.filespace.exception.NodeNotFoundException;
import club.ppmc.filespace.model.FileSpace;
import club.ppmc.filespace.repository.FileSpaceRepository;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class FileSpaceService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSpaceService.class);
    private static final int MAX_NAME_LENGTH = 128;

    private final FileSpaceRepository fileSpaceRepository;
    private final Clock clock;
    private final String defaultNameSuffix;

    public FileSpaceService(
            FileSpaceRepository fileSpaceRepository,
            Clock clock,
            @Value("${filespace.default-name-suffix:Files}") String defaultNameSuffix) {
        this.fileSpaceRepository = fileSpaceRepository;
        this.clock = clock;
        this.defaultNameSuffix = defaultNameSuffix;
    }

    /**
     * 创建一个新的 filespace。
     *
     * @throws DuplicateFileSpaceNameException 所有者已有同名 filespace 时抛出。
     */
    @Transactional
    public FileSpace create(String name, String ownerId, String description) {
        validateName(name);
        if (fileSpaceRepository.existsByOwnerIdAndName(ownerId, name)) {
            throw new DuplicateFileSpaceNameException("所有者 '" + ownerId + "' 已有同名 filespace: " + name);
        }
        var fileSpace = new FileSpace(name, ownerId, description, clock.instant());
        try {
            fileSpaceRepository.saveAndFlush(fileSpace);
        } catch (DataIntegrityViolationException e) {
            // 并发创建时由唯一约束兜底
            throw new DuplicateFileSpaceNameException("所有者 '" + ownerId + "' 已有同名 filespace: " + name);
        }
        LOGGER.info("已为所有者 '{}' 创建 {}", ownerId, fileSpace);
        return fileSpace;
    }

    @Transactional
    public FileSpace rename(UUID fileSpaceId, String newName) {
        validateName(newName);
        FileSpace fileSpace = get(fileSpaceId);
        if (newName.equals(fileSpace.getName())) {
            return fileSpace;
        }
        if (fileSpaceRepository.existsByOwnerIdAndNameAndIdNot(fileSpace.getOwnerId(), newName, fileSpaceId)) {
            throw new DuplicateFileSpaceNameException(
                    "所有者 '" + fileSpace.getOwnerId() + "' 已有同名 filespace: " + newName);
        }
        String oldName = fileSpace.getName();
        fileSpace.setName(newName);
        fileSpace.setUpdatedAt(clock.instant());
        fileSpaceRepository.saveAndFlush(fileSpace);
        LOGGER.info("已将 filespace '{}' 重命名为 '{}'", oldName, newName);
        return fileSpace;
    }

    /**
     * 为新创建的智能体准备默认 filespace，名称为 "&lt;智能体名称&gt; Files"。
     * 由智能体创建流程显式调用；所有者已有同名 filespace 时直接返回它。
     */
    @Transactional
    public FileSpace provisionDefault(String agentName, String ownerId) {
        String name = defaultNameFor(agentName);
        return fileSpaceRepository
                .findByOwnerIdAndName(ownerId, name)
                .orElseGet(() -> create(name, ownerId, "智能体 " + agentName + " 的默认工作目录"));
    }

    @Transactional(readOnly = true)
    public FileSpace get(UUID fileSpaceId) {
        return fileSpaceRepository.findById(fileSpaceId).orElseThrow(() -> NodeNotFoundException.fileSpace(fileSpaceId));
    }

    /** 所有者名下的 filespace，最新创建的在前。 */
    @Transactional(readOnly = true)
    public List<FileSpace> listByOwner(String ownerId) {
        return fileSpaceRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    String defaultNameFor(String agentName) {
        String base = agentName == null ? "" : agentName.strip();
        int room = MAX_NAME_LENGTH - defaultNameSuffix.length() - 1;
        if (base.length() > room) {
            base = base.substring(0, room);
        }
        return base + " " + defaultNameSuffix;
    }

    private static void validateName(String name) {
        if (!StringUtils.hasText(name)) {
            throw new InvalidNameException("filespace 名称不能为空。");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidNameException("filespace 名称不能超过 " + MAX_NAME_LENGTH + " 个字符。");
        }
    }
}
