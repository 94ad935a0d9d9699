/**
 * FileSpaceController.java
 *
 * 该控制器处理 filespace 注册表相关的HTTP请求：创建、为智能体准备默认 filespace、重命名与查询。
 * 所有操作都通过委托给 FileSpaceService 来完成。
 */
package club.ppmc.filespace.controller;

import club.ppmc.filespace.exception.FileSpaceException;
import club.ppmc.filespace.model.CreateFileSpaceRequest;
import club.ppmc.filespace.model.FileSpace;
import club.ppmc.filespace.model.ProvisionFileSpaceRequest;
import club.ppmc.filespace.model.RenameFileSpaceRequest;
import club.ppmc.filespace.service.FileSpaceService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/filespaces")
@Slf4j
public class FileSpaceController {

    private final FileSpaceService fileSpaceService;

    public FileSpaceController(FileSpaceService fileSpaceService) {
        this.fileSpaceService = fileSpaceService;
    }

    /**
     * 获取某个所有者名下的所有 filespace。
     */
    @GetMapping
    public ResponseEntity<List<FileSpace>> listByOwner(@RequestParam String ownerId) {
        return ResponseEntity.ok(fileSpaceService.listByOwner(ownerId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable UUID id) {
        try {
            return ResponseEntity.ok(fileSpaceService.get(id));
        } catch (FileSpaceException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * 创建一个新的 filespace。
     */
    @PostMapping
    public ResponseEntity<?> create(@Valid @RequestBody CreateFileSpaceRequest request) {
        try {
            FileSpace fileSpace = fileSpaceService.create(request.name(), request.ownerId(), request.description());
            return ResponseEntity.status(HttpStatus.CREATED).body(fileSpace);
        } catch (FileSpaceException e) {
            log.warn("创建 filespace 失败: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 智能体创建流程调用：返回或创建智能体的默认 filespace。
     */
    @PostMapping("/provision")
    public ResponseEntity<?> provision(@Valid @RequestBody ProvisionFileSpaceRequest request) {
        try {
            return ResponseEntity.ok(fileSpaceService.provisionDefault(request.agentName(), request.ownerId()));
        } catch (FileSpaceException e) {
            log.warn("为智能体 '{}' 准备 filespace 失败: {}", request.agentName(), e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 重命名 filespace。
     */
    @PutMapping("/{id}/name")
    public ResponseEntity<?> rename(@PathVariable UUID id, @Valid @RequestBody RenameFileSpaceRequest request) {
        try {
            return ResponseEntity.ok(fileSpaceService.rename(id, request.newName()));
        } catch (FileSpaceException e) {
            log.warn("重命名 filespace {} 失败: {}", id, e.getMessage());
            return ErrorResponses.of(e);
        }
    }
}
