package io.ietfdata.core;

/**
 * Datatracker API constants (origin, collection paths, query keys, envelope keys and headers).
 *
 * <p>Shared by the JSON bindings and the client. Contains no HTTP or JSON library dependency.
 */
public final class Protocol {
    private Protocol() {}

    public static final String DEFAULT_ORIGIN = "https://datatracker.ietf.org";

    // Collection paths
    public static final String PATH_PERSON = "/api/v1/person/person/";
    public static final String PATH_HISTORICAL_PERSON = "/api/v1/person/historicalperson/";
    public static final String PATH_PERSON_ALIAS = "/api/v1/person/alias/";
    public static final String PATH_EMAIL = "/api/v1/person/email/";
    public static final String PATH_HISTORICAL_EMAIL = "/api/v1/person/historicalemail/";
    public static final String PATH_DOCUMENT = "/api/v1/doc/document/";
    public static final String PATH_SUBMISSION = "/api/v1/submit/submission/";
    public static final String PATH_DOC_STATE = "/api/v1/doc/state/";
    public static final String PATH_DOC_STATE_TYPE = "/api/v1/doc/statetype/";
    public static final String PATH_GROUP = "/api/v1/group/group/";
    public static final String PATH_GROUP_TYPE = "/api/v1/name/grouptypename/";
    public static final String PATH_GROUP_STATE = "/api/v1/name/groupstatename/";

    // Query parameter keys
    public static final String Q_LIMIT = "limit";
    public static final String Q_ID = "id";
    public static final String Q_NAME = "name";
    public static final String Q_NAME_CONTAINS = "name__contains";
    public static final String Q_TIME_GTE = "time__gte";
    public static final String Q_TIME_LT = "time__lt";
    public static final String Q_PERSON = "person";
    public static final String Q_ADDRESS = "address";
    public static final String Q_ACRONYM = "acronym";
    public static final String Q_TYPE = "type";

    // Collection envelope keys
    public static final String K_META = "meta";
    public static final String K_OBJECTS = "objects";
    public static final String K_TOTAL_COUNT = "total_count";
    public static final String K_LIMIT = "limit";
    public static final String K_OFFSET = "offset";
    public static final String K_PREVIOUS = "previous";
    public static final String K_NEXT = "next";

    // HTTP headers
    public static final String H_ACCEPT = "Accept";
    public static final String H_USER_AGENT = "User-Agent";

    public static final String CT_JSON = "application/json";
}
