package io.ietfdata.core.doc;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a document state, e.g. {@code /api/v1/doc/state/7/}.
 */
public final class DocStateUri extends ResourceUri {

    public DocStateUri(String path) {
        super(path, Protocol.PATH_DOC_STATE);
    }

    public static DocStateUri of(long id) {
        return new DocStateUri(Protocol.PATH_DOC_STATE + id + "/");
    }

    public long id() {
        return numericId();
    }

    @Override
    public String kind() {
        return "doc-state";
    }
}
