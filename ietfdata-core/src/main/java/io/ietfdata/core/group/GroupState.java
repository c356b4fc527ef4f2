package io.ietfdata.core.group;

import java.util.Objects;

public record GroupState(GroupStateUri resourceUri, String slug, String name, String desc, boolean used, long order) {
    public GroupState {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(name, "name");
        desc = (desc == null) ? "" : desc;
    }
}
