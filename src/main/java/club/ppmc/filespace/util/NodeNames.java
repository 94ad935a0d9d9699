/**
 * NodeNames.java
 *
 * 节点名称与文件名相关的工具方法：合法性校验、对象键用的安全文件名，以及重名时的候选名生成。
 */
package club.ppmc.filespace.util;

import club.ppmc.filespace.exception.InvalidNameException;
import java.util.regex.Pattern;
import org.apache.commons.io.FilenameUtils;

public final class NodeNames {

    /** 所有清洗结果都为空时使用的兜底文件名。 */
    public static final String FALLBACK_FILENAME = "file";

    /** 节点名称的最大长度，与 agent_fs_node.name 列一致。 */
    public static final int MAX_LENGTH = 255;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^-\\w.]", Pattern.UNICODE_CHARACTER_CLASS);

    private NodeNames() {}

    /**
     * 校验节点名称：非空，不超过 {@link #MAX_LENGTH} 个字符，且不含路径分隔符或空字节。
     *
     * @throws InvalidNameException 名称不合法时抛出。
     */
    public static void validate(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidNameException("名称不能为空。");
        }
        if (name.length() > MAX_LENGTH) {
            throw new InvalidNameException("名称不能超过 " + MAX_LENGTH + " 个字符。");
        }
        if (name.contains(NodePaths.SEPARATOR) || name.indexOf('\0') >= 0) {
            throw new InvalidNameException("名称不能包含 '/' 或空字节: " + name.replace("\0", "\\0"));
        }
    }

    /**
     * 把任意文件名转换为可以安全放进对象键的形式。
     * 去掉首尾空白，空白替换为 '_'，删除字母、数字（含 Unicode）、'_'、'-'、'.' 以外的所有字符。
     *
     * @return 清洗后的名称；结果为空、"." 或 ".." 时返回 null。
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            return null;
        }
        String basename = FilenameUtils.getName(filename.replace("\0", "").strip());
        String safe = UNSAFE_CHARS.matcher(WHITESPACE.matcher(basename.strip()).replaceAll("_")).replaceAll("");
        if (safe.isEmpty() || ".".equals(safe) || "..".equals(safe)) {
            return null;
        }
        return safe;
    }

    /**
     * 生成第 n 个去重候选名，例如 report.pdf -> report (2).pdf。
     */
    public static String numbered(String baseName, int n) {
        int dot = baseName.lastIndexOf('.');
        if (dot <= 0) {
            return baseName + " (" + n + ")";
        }
        return baseName.substring(0, dot) + " (" + n + ")" + baseName.substring(dot);
    }
}
