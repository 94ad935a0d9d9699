/**
 * FsNodeController.java
 *
 * 该控制器处理 filespace 内节点的HTTP请求。
 * 它提供了目录和文件的创建、列表、移动/重命名、移入回收站与恢复功能。
 * 文件内容的上传下载不在这里处理。所有操作都通过委托给 FsNodeService 来完成。
 */
package club.ppmc.filespace.controller;

import club.ppmc.filespace.exception.FileSpaceException;
import club.ppmc.filespace.model.CreateNodeRequest;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.FsNodeView;
import club.ppmc.filespace.model.MoveNodeRequest;
import club.ppmc.filespace.model.NodeChangeResult;
import club.ppmc.filespace.service.FsNodeService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/filespaces/{fileSpaceId}/nodes")
@Slf4j
public class FsNodeController {

    private final FsNodeService nodeService;

    public FsNodeController(FsNodeService nodeService) {
        this.nodeService = nodeService;
    }

    /**
     * 列出目录下的存活子节点；不传 parentId 时列出根层级。
     */
    @GetMapping
    public ResponseEntity<List<FsNodeView>> listChildren(
            @PathVariable UUID fileSpaceId, @RequestParam(required = false) UUID parentId) {
        return ResponseEntity.ok(toViews(nodeService.listChildren(fileSpaceId, parentId)));
    }

    /**
     * 按缓存路径查找节点。
     */
    @GetMapping("/by-path")
    public ResponseEntity<?> findByPath(@PathVariable UUID fileSpaceId, @RequestParam String path) {
        try {
            return ResponseEntity.ok(FsNodeView.of(nodeService.findByPath(fileSpaceId, path)));
        } catch (FileSpaceException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * 列出目录下任意深度的后代。
     */
    @GetMapping("/{nodeId}/descendants")
    public ResponseEntity<?> descendants(
            @PathVariable UUID fileSpaceId,
            @PathVariable UUID nodeId,
            @RequestParam(defaultValue = "false") boolean includeDeleted) {
        try {
            nodeService.getInFileSpace(fileSpaceId, nodeId);
            return ResponseEntity.ok(toViews(nodeService.descendants(nodeId, includeDeleted)));
        } catch (FileSpaceException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * 创建一个新的文件或目录。
     */
    @PostMapping
    public ResponseEntity<?> create(@PathVariable UUID fileSpaceId, @Valid @RequestBody CreateNodeRequest request) {
        try {
            FsNode node = nodeService.create(
                    fileSpaceId, request.parentId(), request.nodeType(), request.name(), null, request.createdBy());
            return ResponseEntity.status(HttpStatus.CREATED).body(FsNodeView.of(node));
        } catch (FileSpaceException e) {
            log.warn("创建失败: {} in filespace {}: {}", request, fileSpaceId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 移动和/或重命名一个节点，可选地在同一事务中移入回收站。
     */
    @PutMapping("/{nodeId}")
    public ResponseEntity<?> move(
            @PathVariable UUID fileSpaceId, @PathVariable UUID nodeId, @RequestBody MoveNodeRequest request) {
        try {
            nodeService.getInFileSpace(fileSpaceId, nodeId);
            NodeChangeResult result = nodeService.apply(nodeId, request.toChange());
            return ResponseEntity.ok(Map.of(
                    "node", FsNodeView.of(result.node()),
                    "rewrittenPaths", result.rewrittenPaths(),
                    "affected", result.affected()));
        } catch (FileSpaceException e) {
            log.warn("移动节点 {} (filespace {}) 失败: {}", nodeId, fileSpaceId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 把节点及其子树移入回收站。
     */
    @DeleteMapping("/{nodeId}")
    public ResponseEntity<?> trash(@PathVariable UUID fileSpaceId, @PathVariable UUID nodeId) {
        try {
            nodeService.getInFileSpace(fileSpaceId, nodeId);
            int affected = nodeService.trash(nodeId);
            return ResponseEntity.ok(Map.of("affected", affected));
        } catch (FileSpaceException e) {
            log.warn("删除节点 {} (filespace {}) 失败: {}", nodeId, fileSpaceId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 从回收站恢复节点及其子树。
     */
    @PostMapping("/{nodeId}/restore")
    public ResponseEntity<?> restore(@PathVariable UUID fileSpaceId, @PathVariable UUID nodeId) {
        try {
            nodeService.getInFileSpace(fileSpaceId, nodeId);
            int affected = nodeService.restore(nodeId);
            return ResponseEntity.ok(Map.of("affected", affected));
        } catch (FileSpaceException e) {
            log.warn("恢复节点 {} (filespace {}) 失败: {}", nodeId, fileSpaceId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    private static List<FsNodeView> toViews(List<FsNode> nodes) {
        return nodes.stream().map(FsNodeView::of).toList();
    }
}
