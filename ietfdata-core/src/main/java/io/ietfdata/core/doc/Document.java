package io.ietfdata.core.doc;

import io.ietfdata.core.email.EmailUri;
import io.ietfdata.core.group.GroupUri;
import io.ietfdata.core.person.PersonUri;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A document (Internet-Draft, RFC, charter, ...) in the Datatracker.
 *
 * <p>{@code type}, {@code stream}, {@code stdLevel} and {@code intendedStdLevel} are name references
 * the server encodes as paths under {@code /api/v1/name/}; they are kept as plain strings.
 * {@code docAbstract} is the {@code abstract} field on the wire and {@code notifyList} is {@code notify}.
 */
public record Document(
        long id,
        DocumentUri resourceUri,
        String name,
        String title,
        Optional<Long> pages,
        Optional<Long> words,
        Instant time,
        String notifyList,
        Optional<Instant> expires,
        String type,
        Optional<Long> rfc,
        String rev,
        String docAbstract,
        String internalComments,
        long order,
        String note,
        Optional<PersonUri> ad,
        Optional<EmailUri> shepherd,
        Optional<GroupUri> group,
        Optional<String> stream,
        Optional<String> stdLevel,
        Optional<String> intendedStdLevel,
        List<DocStateUri> states,
        List<SubmissionUri> submissions,
        List<String> tags,
        String uploadedFilename,
        String externalUrl
) {
    public Document {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rev, "rev");
        pages = (pages == null) ? Optional.empty() : pages;
        words = (words == null) ? Optional.empty() : words;
        expires = (expires == null) ? Optional.empty() : expires;
        rfc = (rfc == null) ? Optional.empty() : rfc;
        ad = (ad == null) ? Optional.empty() : ad;
        shepherd = (shepherd == null) ? Optional.empty() : shepherd;
        group = (group == null) ? Optional.empty() : group;
        stream = (stream == null) ? Optional.empty() : stream;
        stdLevel = (stdLevel == null) ? Optional.empty() : stdLevel;
        intendedStdLevel = (intendedStdLevel == null) ? Optional.empty() : intendedStdLevel;
        states = (states == null) ? List.of() : List.copyOf(states);
        submissions = (submissions == null) ? List.of() : List.copyOf(submissions);
        tags = (tags == null) ? List.of() : List.copyOf(tags);
        notifyList = (notifyList == null) ? "" : notifyList;
        docAbstract = (docAbstract == null) ? "" : docAbstract;
        internalComments = (internalComments == null) ? "" : internalComments;
        note = (note == null) ? "" : note;
        uploadedFilename = (uploadedFilename == null) ? "" : uploadedFilename;
        externalUrl = (externalUrl == null) ? "" : externalUrl;
    }
}
