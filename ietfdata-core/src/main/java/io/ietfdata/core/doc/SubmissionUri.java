package io.ietfdata.core.doc;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a draft submission, e.g. {@code /api/v1/submit/submission/2402/}.
 */
public final class SubmissionUri extends ResourceUri {

    public SubmissionUri(String path) {
        super(path, Protocol.PATH_SUBMISSION);
    }

    public static SubmissionUri of(long id) {
        return new SubmissionUri(Protocol.PATH_SUBMISSION + id + "/");
    }

    public long id() {
        return numericId();
    }

    @Override
    public String kind() {
        return "submission";
    }
}
