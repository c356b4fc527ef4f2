package io.ietfdata.core.email;

import io.ietfdata.core.person.PersonUri;

import java.time.Instant;
import java.util.Objects;

/**
 * A mapping from an email address to the person who uses it.
 *
 * @param resourceUri reference to this record
 * @param address the email address
 * @param person the person the address belongs to
 * @param time when the mapping was last modified (UTC)
 * @param origin where the server learnt the address from, e.g. {@code author: draft-ietf-...}
 * @param primary whether this is the person's primary address
 * @param active whether the address is still in use
 */
public record Email(
        EmailUri resourceUri,
        String address,
        PersonUri person,
        Instant time,
        String origin,
        boolean primary,
        boolean active
) {
    public Email {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(origin, "origin");
    }
}
