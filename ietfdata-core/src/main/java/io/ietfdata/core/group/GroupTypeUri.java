package io.ietfdata.core.group;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a group type, e.g. {@code /api/v1/name/grouptypename/wg/}.
 */
public final class GroupTypeUri extends ResourceUri {

    public GroupTypeUri(String path) {
        super(path, Protocol.PATH_GROUP_TYPE);
    }

    public static GroupTypeUri of(String slug) {
        return new GroupTypeUri(Protocol.PATH_GROUP_TYPE + slug + "/");
    }

    public String slug() {
        return lastSegment();
    }

    @Override
    public String kind() {
        return "group-type";
    }
}
