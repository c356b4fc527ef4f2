package io.ietfdata.core.person;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A person in the IETF Datatracker.
 *
 * @param id numeric identifier, the last segment of {@code resourceUri}
 * @param resourceUri reference to this record
 * @param name full name as the person prefers it
 * @param nameFromDraft name as extracted from a draft, if different
 * @param biography free text biography, possibly empty
 * @param ascii ASCII rendering of {@code name}
 * @param asciiShort abbreviated ASCII name
 * @param time when the record was last modified (UTC)
 * @param photo URL of the photo
 * @param photoThumb URL of the photo thumbnail
 * @param user login of the associated account
 * @param consent whether the person consented to having their data published
 */
public record Person(
        long id,
        PersonUri resourceUri,
        String name,
        Optional<String> nameFromDraft,
        String biography,
        String ascii,
        Optional<String> asciiShort,
        Instant time,
        Optional<String> photo,
        Optional<String> photoThumb,
        Optional<String> user,
        Optional<Boolean> consent
) {
    public Person {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(biography, "biography");
        Objects.requireNonNull(ascii, "ascii");
        Objects.requireNonNull(time, "time");
        nameFromDraft = (nameFromDraft == null) ? Optional.empty() : nameFromDraft;
        asciiShort = (asciiShort == null) ? Optional.empty() : asciiShort;
        photo = (photo == null) ? Optional.empty() : photo;
        photoThumb = (photoThumb == null) ? Optional.empty() : photoThumb;
        user = (user == null) ? Optional.empty() : user;
        consent = (consent == null) ? Optional.empty() : consent;
    }
}
