/**
 * NodeContent.java
 *
 * 附加到文件节点上的内容。
 *
 * @param filename 原始文件名，用于生成对象键的最后一段；为空时使用节点名称。
 * @param bytes 文件内容。
 * @param mimeType (可选) MIME 类型。
 */
package club.ppmc.filespace.model;

public record NodeContent(String filename, byte[] bytes, String mimeType) {

    public NodeContent {
        if (bytes == null) {
            bytes = new byte[0];
        }
    }
}
