package io.ietfdata.core.doc;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a document by name, e.g. {@code /api/v1/doc/document/draft-ietf-avtcore-rtp-circuit-breakers/}.
 */
public final class DocumentUri extends ResourceUri {

    public DocumentUri(String path) {
        super(path, Protocol.PATH_DOCUMENT);
    }

    public static DocumentUri of(String name) {
        return new DocumentUri(Protocol.PATH_DOCUMENT + name + "/");
    }

    public String name() {
        return lastSegment();
    }

    @Override
    public String kind() {
        return "document";
    }
}
