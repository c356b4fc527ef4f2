package io.ietfdata.core.person;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to an alternative name recorded for a person, e.g. {@code /api/v1/person/alias/62/}.
 */
public final class PersonAliasUri extends ResourceUri {

    public PersonAliasUri(String path) {
        super(path, Protocol.PATH_PERSON_ALIAS);
    }

    public static PersonAliasUri of(long id) {
        return new PersonAliasUri(Protocol.PATH_PERSON_ALIAS + id + "/");
    }

    public long id() {
        return numericId();
    }

    @Override
    public String kind() {
        return "person-alias";
    }
}
