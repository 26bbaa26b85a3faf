package hk.edu.hulab.portal.backend.model;

/**
 * Well-known extension IRIs. Anything else found on a statement stays in the extra bag of {@link Extensions}.
 */
public enum ExtensionKey {
    RECIPIENTS("recipients"),
    PERMISSIONS("permissions"),
    INVITEE("invitee"),
    ROLE("role"),
    MENTIONS("mentions"),
    PARENT_COMMENT("parent-comment"),
    COLLABORATION_ACTION("collaboration-action"),
    RIDE_I_PHASE("ride-i-phase"),
    PREVIOUS_PHASE("previous-phase"),
    OWNER("owner"),
    AI_TOKENS("ai-tokens"),
    PROMPT("prompt"),
    FILE_SIZE("file-size"),
    REFERRER("referrer");

    private final String iri;

    ExtensionKey(String suffix) {
        this.iri = Vocabulary.BASE + "/" + suffix;
    }

    public String iri() {
        return iri;
    }

    public static ExtensionKey fromIri(String iri) {
        for (ExtensionKey key : values()) {
            if (key.iri.equals(iri)) {
                return key;
            }
        }
        return null;
    }
}
