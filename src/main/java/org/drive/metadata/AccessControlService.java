package org.drive.metadata;

import java.util.Optional;

/**
 * 统一的访问控制：所有需要权限的操作都经过这里判定，权限规则只在一处维护。
 * <p>
 * 规则：
 * <ol>
 *   <li>主体就是节点所有者：无条件允许（所有权等价于 owner 角色）。</li>
 *   <li>否则查找 (node.id, principal.id) 的授权记录；不存在则拒绝。</li>
 *   <li>存在则比较角色：角色达到或超过请求的级别才允许（owner > editor > viewer）。</li>
 * </ol>
 */
public class AccessControlService {

    private final NodeRepository repository;

    public AccessControlService(NodeRepository repository) {
        this.repository = repository;
    }

    public AccessDecision authorize(Principal principal, DriveNode node, Role required) {
        if (principal == null || principal.id() == null || node == null || required == null) {
            return AccessDecision.DENY;
        }
        return effectiveRole(principal, node)
                .filter(role -> role.satisfies(required))
                .map(role -> AccessDecision.ALLOW)
                .orElse(AccessDecision.DENY);
    }

    /**
     * 判定不通过时抛出 {@code FORBIDDEN}。
     */
    public void require(Principal principal, DriveNode node, Role required) {
        if (!authorize(principal, node, required).isAllowed()) {
            throw DriveException.forbidden("没有权限对该节点执行需要 " + required.wireName() + " 权限的操作：" + node.id());
        }
    }

    /**
     * 主体在节点上的实际角色：所有者为 owner，否则取授权记录中的角色。
     */
    public Optional<Role> effectiveRole(Principal principal, DriveNode node) {
        if (principal.id().equals(node.ownerId())) {
            return Optional.of(Role.OWNER);
        }
        if (node.id() == null) {
            return Optional.empty();
        }
        return repository.findGrant(node.id(), principal.id()).map(PermissionGrant::role);
    }
}
