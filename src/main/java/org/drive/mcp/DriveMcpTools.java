package org.drive.mcp;

import org.drive.metadata.DriveException;
import org.drive.metadata.DriveNode;
import org.drive.metadata.DriveQueryService;
import org.drive.metadata.NodeLifecycleService;
import org.drive.metadata.PermissionGrant;
import org.drive.metadata.PermissionService;
import org.drive.metadata.Principal;
import org.drive.metadata.SharingService;
import org.drive.metadata.dto.GrantListResult;
import org.drive.metadata.dto.LinkResult;
import org.drive.metadata.dto.NodeListResult;
import org.drive.metadata.dto.SearchResult;
import org.drive.metadata.dto.SharedItemsResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * 云盘元数据 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列表与搜索（{@code drive_list_items}、{@code drive_search}、{@code drive_list_shared}、{@code drive_list_trash}）。</li>
 *   <li>生命周期（新建文件夹、上传、改名、移动、移入回收站、恢复）。</li>
 *   <li>授权管理（授予/修改/撤销/列出）与分享/下载链接。</li>
 * </ul>
 * <p>
 * 身份说明：
 * <ul>
 *   <li>调用主体 {@code principalId/principalEmail} 由上游认证网关写入，本服务不签发、不校验凭证。</li>
 *   <li>错误通过 {@link DriveException} 抛出，由 Spring AI 转换为工具错误结果返回给调用方。</li>
 * </ul>
 */
@Component
public class DriveMcpTools {

    private final DriveQueryService queryService;
    private final NodeLifecycleService lifecycleService;
    private final PermissionService permissionService;
    private final SharingService sharingService;

    public DriveMcpTools(DriveQueryService queryService,
                         NodeLifecycleService lifecycleService,
                         PermissionService permissionService,
                         SharingService sharingService) {
        this.queryService = queryService;
        this.lifecycleService = lifecycleService;
        this.permissionService = permissionService;
        this.sharingService = sharingService;
    }

    @Tool(
            name = "drive_list_items",
            description = "列出调用者名下所有未删除的文件和文件夹（结果可能来自缓存，任何写操作后立即失效）。"
    )
    public NodeListResult listItems(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail
    ) {
        return queryService.listItems(principal(principalId, principalEmail));
    }

    @Tool(
            name = "drive_search",
            description = "按名称或路径搜索调用者名下未删除的节点（不区分大小写，page 从 1 开始，默认每页 10 条）。"
    )
    public SearchResult search(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "搜索关键字") String query,
            @ToolParam(required = false, description = "页号，从 1 开始（默认 1）") Integer page,
            @ToolParam(required = false, description = "分页大小（默认 app.drive.search-default-limit，上限 app.drive.search-max-limit）") Integer limit
    ) {
        return queryService.search(principal(principalId, principalEmail), query, page, limit);
    }

    @Tool(
            name = "drive_list_shared",
            description = "列出其他用户授权给调用者的未删除节点及调用者的角色。"
    )
    public SharedItemsResult listShared(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail
    ) {
        return queryService.listSharedWithMe(principal(principalId, principalEmail));
    }

    @Tool(
            name = "drive_list_trash",
            description = "列出调用者回收站中的节点。"
    )
    public NodeListResult listTrash(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail
    ) {
        return queryService.listTrash(principal(principalId, principalEmail));
    }

    @Tool(
            name = "drive_create_folder",
            description = "新建文件夹（路径为 父路径/名称；父路径为空时位于调用者命名空间根）。同路径已存在时失败。"
    )
    public DriveNode createFolder(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(required = false, description = "父文件夹路径（为空表示根）") String parentPath,
            @ToolParam(description = "文件夹名称（不能包含 /）") String name
    ) {
        return lifecycleService.createFolder(principal(principalId, principalEmail), parentPath, name);
    }

    @Tool(
            name = "drive_upload_file",
            description = "上传文件（内容为 base64）。文件路径为 父路径/<上传毫秒数>_<文件名>。"
    )
    public DriveNode uploadFile(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(required = false, description = "父文件夹路径（为空表示根）") String parentPath,
            @ToolParam(description = "原始文件名") String fileName,
            @ToolParam(description = "文件内容（base64）") String contentBase64,
            @ToolParam(required = false, description = "MIME 类型（默认 application/octet-stream）") String contentType
    ) {
        Principal principal = principal(principalId, principalEmail);
        return lifecycleService.uploadFile(principal, parentPath, fileName, decodeBase64(contentBase64), contentType);
    }

    @Tool(
            name = "drive_rename",
            description = "重命名节点（保持在原父文件夹下；需要 editor 及以上权限）。目标路径已存在时失败。"
    )
    public DriveNode rename(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(description = "新名称") String newName
    ) {
        return lifecycleService.rename(principal(principalId, principalEmail), nodeId, newName);
    }

    @Tool(
            name = "drive_move",
            description = "把节点移动到另一个文件夹（为空表示所有者命名空间根；需要 editor 及以上权限）。"
    )
    public DriveNode move(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(required = false, description = "目标父文件夹路径") String newParentPath
    ) {
        return lifecycleService.move(principal(principalId, principalEmail), nodeId, newParentPath);
    }

    @Tool(
            name = "drive_trash",
            description = "把节点移入回收站（仅所有者；不级联子节点）。"
    )
    public DriveNode trash(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId
    ) {
        return lifecycleService.softDelete(principal(principalId, principalEmail), nodeId);
    }

    @Tool(
            name = "drive_restore",
            description = "从回收站恢复节点（仅所有者；原路径已被占用时失败）。"
    )
    public DriveNode restore(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId
    ) {
        return lifecycleService.restore(principal(principalId, principalEmail), nodeId);
    }

    @Tool(
            name = "drive_create_share_link",
            description = "生成分享链接（签名 URL，默认 7 天有效；viewer 及以上即可分享；文件夹指向其 .keep 占位对象）。"
    )
    public LinkResult createShareLink(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(required = false, description = "有效期（秒，默认 app.drive.share-link-default-ttl）") Long ttlSeconds
    ) {
        return sharingService.createShareLink(principal(principalId, principalEmail), nodeId, ttlSeconds);
    }

    @Tool(
            name = "drive_create_download_link",
            description = "生成文件的短时下载链接（默认 60 秒有效）。"
    )
    public LinkResult createDownloadLink(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "文件节点 id") String nodeId
    ) {
        return sharingService.createDownloadLink(principal(principalId, principalEmail), nodeId);
    }

    @Tool(
            name = "drive_grant_permission",
            description = "授予其他用户角色（owner/editor/viewer）；已有授权时更新角色。调用者必须持有 owner 权限。"
    )
    public PermissionGrant grantPermission(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(description = "被授权用户 id") String userId,
            @ToolParam(description = "角色：owner/editor/viewer") String role
    ) {
        return permissionService.grant(principal(principalId, principalEmail), nodeId, userId, role);
    }

    @Tool(
            name = "drive_update_permission",
            description = "修改已有授权的角色（授权不存在时失败）。"
    )
    public PermissionGrant updatePermission(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(description = "被授权用户 id") String userId,
            @ToolParam(description = "角色：owner/editor/viewer") String role
    ) {
        return permissionService.updateGrant(principal(principalId, principalEmail), nodeId, userId, role);
    }

    @Tool(
            name = "drive_revoke_permission",
            description = "撤销授权（授权不存在时失败）。"
    )
    public PermissionGrant revokePermission(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId,
            @ToolParam(description = "被授权用户 id") String userId
    ) {
        return permissionService.revokeGrant(principal(principalId, principalEmail), nodeId, userId);
    }

    @Tool(
            name = "drive_list_permissions",
            description = "列出节点上的显式授权（不含所有者本人）。"
    )
    public GrantListResult listPermissions(
            @ToolParam(description = "调用主体 id（由认证网关提供）") String principalId,
            @ToolParam(required = false, description = "调用主体邮箱") String principalEmail,
            @ToolParam(description = "节点 id") String nodeId
    ) {
        return permissionService.listGrants(principal(principalId, principalEmail), nodeId);
    }

    private static Principal principal(String principalId, String principalEmail) {
        return Principal.requireAuthenticated(new Principal(principalId, principalEmail));
    }

    private static byte[] decodeBase64(String contentBase64) {
        if (contentBase64 == null) {
            throw DriveException.invalidInput("没有上传文件内容");
        }
        try {
            return Base64.getDecoder().decode(contentBase64.trim());
        } catch (IllegalArgumentException e) {
            throw DriveException.invalidInput("文件内容不是合法的 base64：" + e.getMessage());
        }
    }
}
