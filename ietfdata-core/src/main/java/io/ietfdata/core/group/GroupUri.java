package io.ietfdata.core.group;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a group, e.g. {@code /api/v1/group/group/1963/}.
 */
public final class GroupUri extends ResourceUri {

    public GroupUri(String path) {
        super(path, Protocol.PATH_GROUP);
    }

    public static GroupUri of(long id) {
        return new GroupUri(Protocol.PATH_GROUP + id + "/");
    }

    public long id() {
        return numericId();
    }

    @Override
    public String kind() {
        return "group";
    }
}
