package hk.edu.hulab.portal.backend.lrs;

public enum BlobNamespace {
    /**
     * One blob per (agent, profileId).
     */
    AGENT_PROFILE("agent-profile"),
    /**
     * One blob per (agent, activityId, stateId).
     */
    ACTIVITY_STATE("activity-state");

    private final String wireName;

    BlobNamespace(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
