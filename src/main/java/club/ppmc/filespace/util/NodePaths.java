/**
 * NodePaths.java
 *
 * 缓存路径相关的纯函数工具类。
 * 路径统一使用Unix风格的分隔符 '/'，并以 '/' 开头，例如 /a/b/c.txt。
 */
package club.ppmc.filespace.util;

import java.util.List;

public final class NodePaths {

    public static final String SEPARATOR = "/";

    /** LIKE 查询使用的转义符，与 FsNodeRepository 中的 escape '!' 对应。 */
    public static final char LIKE_ESCAPE = '!';

    /** 缓存路径的最大长度，与 agent_fs_node.path 列一致。 */
    public static final int MAX_LENGTH = 4096;

    private NodePaths() {}

    /**
     * 由从根到节点的名称序列拼出绝对路径。
     *
     * @param namesFromRoot 从根层级开始的名称列表，最后一个是节点自身。
     * @return 绝对路径。
     */
    public static String join(List<String> namesFromRoot) {
        return SEPARATOR + String.join(SEPARATOR, namesFromRoot);
    }

    /**
     * 后代路径必须以该前缀开头。
     */
    public static String childPrefix(String path) {
        String trimmed = path;
        while (trimmed.endsWith(SEPARATOR)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + SEPARATOR;
    }

    /**
     * 匹配 {@code path} 下所有后代的 LIKE 模式。名称中的 '%'、'_' 和转义符自身都会被转义。
     */
    public static String descendantPattern(String path) {
        return escapeLike(childPrefix(path)) + "%";
    }

    static String escapeLike(String literal) {
        var sb = new StringBuilder(literal.length() + 8);
        for (char c : literal.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
