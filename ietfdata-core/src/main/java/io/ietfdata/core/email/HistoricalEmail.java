package io.ietfdata.core.email;

import io.ietfdata.core.person.PersonUri;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One revision of an {@link Email} record.
 */
public record HistoricalEmail(
        HistoricalEmailUri resourceUri,
        String address,
        PersonUri person,
        Instant time,
        String origin,
        boolean primary,
        boolean active,
        Optional<String> historyChangeReason,
        Optional<String> historyUser,
        long historyId,
        String historyType,
        Instant historyDate
) {
    public HistoricalEmail {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(historyType, "historyType");
        Objects.requireNonNull(historyDate, "historyDate");
        historyChangeReason = (historyChangeReason == null) ? Optional.empty() : historyChangeReason;
        historyUser = (historyUser == null) ? Optional.empty() : historyUser;
    }
}
