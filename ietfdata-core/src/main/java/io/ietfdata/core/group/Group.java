package io.ietfdata.core.group;

import io.ietfdata.core.doc.DocStateUri;
import io.ietfdata.core.doc.DocumentUri;
import io.ietfdata.core.person.PersonUri;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A working group, research group, area, directorate or other body in the Datatracker.
 *
 * <p>{@code parent} is empty for top-level groups; {@code charter} is empty for groups that have none.
 */
public record Group(
        long id,
        GroupUri resourceUri,
        String acronym,
        String name,
        String description,
        Optional<DocumentUri> charter,
        Optional<PersonUri> ad,
        Instant time,
        GroupTypeUri type,
        String comments,
        Optional<GroupUri> parent,
        GroupStateUri state,
        List<DocStateUri> unusedStates,
        List<String> unusedTags,
        String listEmail,
        String listSubscribe,
        String listArchive
) {
    public Group {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(acronym, "acronym");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(state, "state");
        charter = (charter == null) ? Optional.empty() : charter;
        ad = (ad == null) ? Optional.empty() : ad;
        parent = (parent == null) ? Optional.empty() : parent;
        unusedStates = (unusedStates == null) ? List.of() : List.copyOf(unusedStates);
        unusedTags = (unusedTags == null) ? List.of() : List.copyOf(unusedTags);
        description = (description == null) ? "" : description;
        comments = (comments == null) ? "" : comments;
        listEmail = (listEmail == null) ? "" : listEmail;
        listSubscribe = (listSubscribe == null) ? "" : listSubscribe;
        listArchive = (listArchive == null) ? "" : listArchive;
    }
}
