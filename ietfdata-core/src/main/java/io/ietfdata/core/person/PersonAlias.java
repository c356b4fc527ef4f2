package io.ietfdata.core.person;

import java.util.Objects;

/**
 * An alternative name under which a person is known.
 */
public record PersonAlias(long id, PersonAliasUri resourceUri, PersonUri person, String name) {
    public PersonAlias {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(name, "name");
    }
}
