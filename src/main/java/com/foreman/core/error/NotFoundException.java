package com.foreman.core.error;

/**
 * Unknown session, task or agent reference.
 */
public class NotFoundException extends ForemanException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public static NotFoundException session(String sessionId) {
        return new NotFoundException("Session", sessionId);
    }

    public static NotFoundException task(String taskId) {
        return new NotFoundException("Task", taskId);
    }

    public static NotFoundException agent(String agentId) {
        return new NotFoundException("Agent", agentId);
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
