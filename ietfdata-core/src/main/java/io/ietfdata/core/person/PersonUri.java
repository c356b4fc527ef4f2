package io.ietfdata.core.person;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to a person, e.g. {@code /api/v1/person/person/20209/}.
 */
public final class PersonUri extends ResourceUri {

    public PersonUri(String path) {
        super(path, Protocol.PATH_PERSON);
    }

    public static PersonUri of(long id) {
        return new PersonUri(Protocol.PATH_PERSON + id + "/");
    }

    public long id() {
        return numericId();
    }

    @Override
    public String kind() {
        return "person";
    }
}
