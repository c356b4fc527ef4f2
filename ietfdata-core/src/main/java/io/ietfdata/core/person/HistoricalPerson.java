package io.ietfdata.core.person;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One revision of a {@link Person} record, as kept by the server's change history.
 *
 * <p>The person fields hold the values as they were at {@code historyDate}. {@code historyType} is
 * the server's change marker ({@code +} created, {@code ~} changed, {@code -} deleted).
 */
public record HistoricalPerson(
        long id,
        HistoricalPersonUri resourceUri,
        String name,
        Optional<String> nameFromDraft,
        String biography,
        String ascii,
        Optional<String> asciiShort,
        Instant time,
        Optional<String> photo,
        Optional<String> photoThumb,
        Optional<String> user,
        Optional<Boolean> consent,
        Optional<String> historyChangeReason,
        Optional<String> historyUser,
        String historyType,
        long historyId,
        Instant historyDate
) {
    public HistoricalPerson {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(biography, "biography");
        Objects.requireNonNull(ascii, "ascii");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(historyType, "historyType");
        Objects.requireNonNull(historyDate, "historyDate");
        nameFromDraft = (nameFromDraft == null) ? Optional.empty() : nameFromDraft;
        asciiShort = (asciiShort == null) ? Optional.empty() : asciiShort;
        photo = (photo == null) ? Optional.empty() : photo;
        photoThumb = (photoThumb == null) ? Optional.empty() : photoThumb;
        user = (user == null) ? Optional.empty() : user;
        consent = (consent == null) ? Optional.empty() : consent;
        historyChangeReason = (historyChangeReason == null) ? Optional.empty() : historyChangeReason;
        historyUser = (historyUser == null) ? Optional.empty() : historyUser;
    }

    /**
     * Reference to the current record of the person this revision belongs to.
     */
    public PersonUri person() {
        return PersonUri.of(id);
    }
}
