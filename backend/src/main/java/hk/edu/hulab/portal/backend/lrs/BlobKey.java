package hk.edu.hulab.portal.backend.lrs;

import java.util.Locale;
import java.util.Objects;

/**
 * Address of a profile or state blob. {@code activityId} is null for agent profiles.
 */
public record BlobKey(BlobNamespace namespace, String agent, String activityId, String key) {

    public static final String USER_PROFILE = "user-profile";

    public BlobKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(key, "key");
        agent = agent.trim().toLowerCase(Locale.ROOT);
        if (namespace == BlobNamespace.ACTIVITY_STATE) {
            Objects.requireNonNull(activityId, "activityId");
        }
    }

    public static BlobKey profile(String agent, String profileId) {
        return new BlobKey(BlobNamespace.AGENT_PROFILE, agent, null, profileId);
    }

    public static BlobKey userProfile(String agent) {
        return profile(agent, USER_PROFILE);
    }

    public static BlobKey state(String agent, String activityId, String stateId) {
        return new BlobKey(BlobNamespace.ACTIVITY_STATE, agent, activityId, stateId);
    }
}
