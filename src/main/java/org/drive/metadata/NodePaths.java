package org.drive.metadata;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 逻辑路径拼接规则。
 * <p>
 * 路径是唯一的结构性关联（没有真正的父子树）：
 * <ul>
 *   <li>命名空间根：{@code <ownerId>/<segment>}；</li>
 *   <li>位于文件夹下：{@code <parentPath>/<segment>}；</li>
 *   <li>文件夹 segment 即名称；文件 segment 为 {@code <上传毫秒数>_<名称>}。</li>
 * </ul>
 */
public final class NodePaths {

    private static final Pattern FILE_SEGMENT = Pattern.compile("^(\\d+)_(.*)$");

    private NodePaths() {
    }

    /**
     * 校验名称：非空白，且不包含路径分隔符。
     */
    public static String requireValidName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw DriveException.invalidInput(field + " 不能为空");
        }
        String trimmed = name.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            throw DriveException.invalidInput(field + " 不能包含路径分隔符：" + name);
        }
        if (".".equals(trimmed) || "..".equals(trimmed)) {
            throw DriveException.invalidInput(field + " 不合法：" + name);
        }
        return trimmed;
    }

    public static String child(String ownerId, String parentPath, String segment) {
        String base = (parentPath == null || parentPath.isBlank()) ? ownerId : stripTrailingSlash(parentPath);
        return base + "/" + segment;
    }

    public static String fileSegment(long uploadMillis, String name) {
        return uploadMillis + "_" + name;
    }

    /**
     * 计算节点改名后的 segment：文件保留原有的上传时间前缀，文件夹直接使用新名称。
     */
    public static String renamedSegment(DriveNode node, String newName, long fallbackMillis) {
        if (node.isFolder()) {
            return newName;
        }
        Matcher m = FILE_SEGMENT.matcher(lastSegment(node.path()));
        String prefix = m.matches() ? m.group(1) : Long.toString(fallbackMillis);
        return prefix + "_" + newName;
    }

    public static String lastSegment(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    /**
     * {@code candidate} 是否就是 {@code ancestor} 或位于其下。
     */
    public static boolean isSameOrDescendant(String candidate, String ancestor) {
        return candidate.equals(ancestor) || candidate.startsWith(ancestor + "/");
    }

    public static String normalizeParent(String parentPath) {
        if (parentPath == null || parentPath.isBlank()) {
            return null;
        }
        return stripTrailingSlash(parentPath.trim());
    }

    private static String stripTrailingSlash(String raw) {
        return raw.replaceAll("/+$", "");
    }
}
