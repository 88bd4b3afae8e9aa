package cids.core.model.role;

/**
 * Maps an identity-provider group display name to a role of an application.
 */
public record GroupRoleMapping(String clientId, String groupName, String roleName) {

    public GroupRoleMapping {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Mapping client ID cannot be null or blank");
        }
        if (groupName == null || groupName.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be null or blank");
        }
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("Role name cannot be null or blank");
        }
    }
}
