package io.ietfdata.core.email;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to an email address record, e.g. {@code /api/v1/person/email/csp@csperkins.org/}.
 */
public final class EmailUri extends ResourceUri {

    public EmailUri(String path) {
        super(path, Protocol.PATH_EMAIL);
    }

    public static EmailUri of(String address) {
        return new EmailUri(Protocol.PATH_EMAIL + address + "/");
    }

    public String address() {
        return lastSegment();
    }

    @Override
    public String kind() {
        return "email";
    }
}
