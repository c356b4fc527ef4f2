package io.ietfdata.core.group;

import java.util.Objects;

/**
 * Kind of group, e.g. {@code wg}, {@code rg}, {@code area}.
 */
public record GroupType(
        GroupTypeUri resourceUri,
        String slug,
        String name,
        String verboseName,
        String desc,
        boolean used,
        long order
) {
    public GroupType {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(name, "name");
        verboseName = (verboseName == null) ? "" : verboseName;
        desc = (desc == null) ? "" : desc;
    }
}
