package org.drive.metadata;

import org.drive.metadata.dto.LinkResult;
import org.drive.metadata.store.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * 分享链接：对解析后的单个对象签发带过期时间的签名 URL，与授权体系相互独立。
 * <p>
 * 本组件只负责两件事：权限校验（viewer 及以上即可分享）与对象 key 解析；真正的签名由对象存储完成。
 * 链接不落库，每次请求都生成新的链接。
 */
public class SharingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SharingService.class);

    private final NodeRepository repository;
    private final AccessControlService accessControl;
    private final ObjectReferenceResolver resolver;
    private final ObjectStore objectStore;
    private final DriveProperties properties;
    private final Clock clock;

    public SharingService(NodeRepository repository,
                          AccessControlService accessControl,
                          ObjectReferenceResolver resolver,
                          ObjectStore objectStore,
                          DriveProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.accessControl = accessControl;
        this.resolver = resolver;
        this.objectStore = objectStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 生成分享链接。文件夹指向其占位对象。
     *
     * @param ttlSeconds 有效期（秒）；为空使用 {@code app.drive.share-link-default-ttl}
     */
    public LinkResult createShareLink(Principal actor, String nodeId, Long ttlSeconds) {
        Principal.requireAuthenticated(actor);
        Duration ttl = resolveShareTtl(ttlSeconds);
        DriveNode node = requireReadableNode(actor, nodeId);
        LinkResult link = sign(node, ttl);
        LOGGER.info("Issued share link for node {} ({}s) to {}", node.id(), ttl.getSeconds(), actor.id());
        return link;
    }

    /**
     * 生成短时下载链接（仅文件），有效期为 {@code app.drive.download-link-ttl}。
     */
    public LinkResult createDownloadLink(Principal actor, String nodeId) {
        Principal.requireAuthenticated(actor);
        DriveNode node = requireReadableNode(actor, nodeId);
        if (!node.isFile()) {
            throw DriveException.invalidInput("只能下载文件：" + nodeId);
        }
        return sign(node, properties.getDownloadLinkTtl());
    }

    private LinkResult sign(DriveNode node, Duration ttl) {
        String key = resolver.resolve(node);
        String url = objectStore.createSignedUrl(key, ttl);
        return new LinkResult(node.id(), key, url, ttl.getSeconds(), clock.instant().plus(ttl));
    }

    private DriveNode requireReadableNode(Principal actor, String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw DriveException.invalidInput("nodeId 不能为空");
        }
        DriveNode node = repository.findLive(nodeId)
                .orElseThrow(() -> DriveException.notFound("文件或文件夹不存在：" + nodeId));
        accessControl.require(actor, node, Role.VIEWER);
        return node;
    }

    private Duration resolveShareTtl(Long ttlSeconds) {
        if (ttlSeconds == null) {
            return properties.getShareLinkDefaultTtl();
        }
        if (ttlSeconds < 1) {
            throw DriveException.invalidInput("ttlSeconds 必须大于 0：" + ttlSeconds);
        }
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        if (ttl.compareTo(properties.getShareLinkMaxTtl()) > 0) {
            throw DriveException.invalidInput("ttlSeconds 超过上限 " + properties.getShareLinkMaxTtl().getSeconds() + "：" + ttlSeconds);
        }
        return ttl;
    }
}
