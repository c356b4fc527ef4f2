package io.ietfdata.core.group;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a group state, e.g. {@code /api/v1/name/groupstatename/active/}.
 */
public final class GroupStateUri extends ResourceUri {

    public GroupStateUri(String path) {
        super(path, Protocol.PATH_GROUP_STATE);
    }

    public static GroupStateUri of(String slug) {
        return new GroupStateUri(Protocol.PATH_GROUP_STATE + slug + "/");
    }

    public String slug() {
        return lastSegment();
    }

    @Override
    public String kind() {
        return "group-state";
    }
}
