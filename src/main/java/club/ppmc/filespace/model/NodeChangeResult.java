/**
 * NodeChangeResult.java
 *
 * 一次 NodeChange 提交后的结果。
 *
 * @param node 修改后的节点（已从数据库重新加载）。
 * @param rewrittenPaths 被改写了缓存路径的后代数量。
 * @param affected 删除/恢复级联影响的行数（包含节点自身），未涉及删除状态时为 0。
 */
package club.ppmc.filespace.model;

public record NodeChangeResult(FsNode node, int rewrittenPaths, int affected) {}
