package io.ietfdata.core.doc;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a document state type, e.g. {@code /api/v1/doc/statetype/draft-iesg/}.
 */
public final class DocStateTypeUri extends ResourceUri {

    public DocStateTypeUri(String path) {
        super(path, Protocol.PATH_DOC_STATE_TYPE);
    }

    public static DocStateTypeUri of(String slug) {
        return new DocStateTypeUri(Protocol.PATH_DOC_STATE_TYPE + slug + "/");
    }

    public String slug() {
        return lastSegment();
    }

    @Override
    public String kind() {
        return "doc-state-type";
    }
}
