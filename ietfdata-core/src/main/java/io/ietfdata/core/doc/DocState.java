package io.ietfdata.core.doc;

import java.util.List;
import java.util.Objects;

/**
 * A state a document can be in, within one {@link DocStateType}.
 *
 * @param nextStates states the document may move to from this one
 * @param type the state machine this state belongs to
 */
public record DocState(
        long id,
        DocStateUri resourceUri,
        String name,
        String desc,
        String slug,
        List<DocStateUri> nextStates,
        boolean used,
        long order,
        DocStateTypeUri type
) {
    public DocState {
        Objects.requireNonNull(resourceUri, "resourceUri");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(type, "type");
        desc = (desc == null) ? "" : desc;
        nextStates = (nextStates == null) ? List.of() : List.copyOf(nextStates);
    }
}
