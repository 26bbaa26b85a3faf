package hk.edu.hulab.portal.backend.model;

/**
 * Verb and activity-type IRIs used by the portal. Values are opaque strings shared with the
 * learning record store and must not change.
 */
public final class Vocabulary {

    public static final String BASE = "http://hulab.edu.hk";
    public static final String LANGUAGE = "en-US";
    public static final String PLATFORM = "HULAB Research Portal";

    private static final String ADL_VERBS = "http://adlnet.gov/expapi/verbs/";
    private static final String PORTAL_VERBS = BASE + "/verbs/";

    public static final Verb REGISTERED = Verb.of(ADL_VERBS + "registered", "registered");
    public static final Verb INITIALIZED = Verb.of(ADL_VERBS + "initialized", "initialized");
    public static final Verb COMPLETED = Verb.of(ADL_VERBS + "completed", "completed");
    public static final Verb ATTEMPTED = Verb.of(ADL_VERBS + "attempted", "attempted");
    public static final Verb EXPERIENCED = Verb.of(ADL_VERBS + "experienced", "experienced");
    public static final Verb INTERACTED = Verb.of(ADL_VERBS + "interacted", "interacted");

    public static final Verb UPLOADED = Verb.of(PORTAL_VERBS + "uploaded", "uploaded");
    public static final Verb DOWNLOADED = Verb.of(PORTAL_VERBS + "downloaded", "downloaded");
    public static final Verb COLLABORATED = Verb.of(PORTAL_VERBS + "collaborated", "collaborated");
    public static final Verb RESEARCHED = Verb.of(PORTAL_VERBS + "researched", "researched");
    public static final Verb ANALYZED = Verb.of(PORTAL_VERBS + "analyzed", "analyzed");
    public static final Verb ASSESSED = Verb.of(PORTAL_VERBS + "assessed", "assessed");
    public static final Verb REVIEWED = Verb.of(PORTAL_VERBS + "reviewed", "reviewed");
    public static final Verb SHARED = Verb.of(PORTAL_VERBS + "shared", "shared");
    public static final Verb COMMENTED = Verb.of(PORTAL_VERBS + "commented", "commented");
    public static final Verb ANNOTATED = Verb.of(PORTAL_VERBS + "annotated", "annotated");
    public static final Verb QUERIED = Verb.of(PORTAL_VERBS + "queried", "queried AI");
    public static final Verb CREATED = Verb.of(PORTAL_VERBS + "created", "created");
    public static final Verb UPDATED = Verb.of(PORTAL_VERBS + "updated", "updated");
    public static final Verb DELETED = Verb.of(PORTAL_VERBS + "deleted", "deleted");
    public static final Verb INVITED = Verb.of(PORTAL_VERBS + "invited", "invited");
    public static final Verb ACCEPTED = Verb.of(PORTAL_VERBS + "accepted", "accepted invitation");
    public static final Verb DECLINED = Verb.of(PORTAL_VERBS + "declined", "declined invitation");
    public static final Verb ADVANCED = Verb.of(PORTAL_VERBS + "advanced", "advanced to phase");

    private static final String ADL_ACTIVITIES = "http://adlnet.gov/expapi/activities/";
    private static final String PORTAL_ACTIVITIES = BASE + "/activities/";

    public static final String TYPE_APPLICATION = ADL_ACTIVITIES + "application";
    public static final String TYPE_ASSESSMENT = ADL_ACTIVITIES + "assessment";
    public static final String TYPE_RESEARCH_PROJECT = PORTAL_ACTIVITIES + "research-project";
    public static final String TYPE_INVITATION = PORTAL_ACTIVITIES + "collaboration-invitation";
    public static final String TYPE_COMMENT = PORTAL_ACTIVITIES + "comment";
    public static final String TYPE_SHARE = PORTAL_ACTIVITIES + "share";
    public static final String TYPE_PROFILE = PORTAL_ACTIVITIES + "profile";

    public static final String PORTAL_ACTIVITY = BASE + "/portal";

    private Vocabulary() {
    }

    /**
     * Entity address used both as statement object id and as state-blob activity id.
     */
    public static String address(String entityType, String entityId) {
        return BASE + "/" + entityType + "/" + entityId;
    }

    public static String activityType(String entityType) {
        return PORTAL_ACTIVITIES + entityType;
    }
}
