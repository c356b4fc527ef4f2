package io.ietfdata.core.doc;

import java.util.Objects;

public record DocStateType(DocStateTypeUri resourceUri, String slug, String label) {
    public DocStateType {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(label, "label");
    }
}
