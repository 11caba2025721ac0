package com.foreman.core.error;

import com.foreman.core.model.Role;

/**
 * A spawn was requested for a role that already has an active agent.
 */
public class AlreadyActiveException extends ForemanException {

    private final Role role;
    private final String activeAgentId;

    public AlreadyActiveException(Role role, String activeAgentId) {
        super("Role " + role.key() + " already has an active agent: " + activeAgentId);
        this.role = role;
        this.activeAgentId = activeAgentId;
    }

    public Role getRole() {
        return role;
    }

    public String getActiveAgentId() {
        return activeAgentId;
    }
}
