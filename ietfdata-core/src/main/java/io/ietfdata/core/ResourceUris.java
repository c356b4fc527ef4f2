package io.ietfdata.core;

import io.ietfdata.core.doc.DocStateTypeUri;
import io.ietfdata.core.doc.DocStateUri;
import io.ietfdata.core.doc.DocumentUri;
import io.ietfdata.core.doc.SubmissionUri;
import io.ietfdata.core.email.EmailUri;
import io.ietfdata.core.email.HistoricalEmailUri;
import io.ietfdata.core.group.GroupStateUri;
import io.ietfdata.core.group.GroupTypeUri;
import io.ietfdata.core.group.GroupUri;
import io.ietfdata.core.person.HistoricalPersonUri;
import io.ietfdata.core.person.PersonAliasUri;
import io.ietfdata.core.person.PersonUri;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of every {@link ResourceUri} kind and how to construct it from a path.
 *
 * <p>JSON bindings iterate over {@link #kinds()} to install one decoder per kind.
 */
public final class ResourceUris {
    private ResourceUris() {}

    private static final Map<Class<? extends ResourceUri>, Function<String, ? extends ResourceUri>> FACTORIES;

    static {
        Map<Class<? extends ResourceUri>, Function<String, ? extends ResourceUri>> m = new LinkedHashMap<>();
        m.put(PersonUri.class, PersonUri::new);
        m.put(HistoricalPersonUri.class, HistoricalPersonUri::new);
        m.put(PersonAliasUri.class, PersonAliasUri::new);
        m.put(EmailUri.class, EmailUri::new);
        m.put(HistoricalEmailUri.class, HistoricalEmailUri::new);
        m.put(DocumentUri.class, DocumentUri::new);
        m.put(SubmissionUri.class, SubmissionUri::new);
        m.put(DocStateUri.class, DocStateUri::new);
        m.put(DocStateTypeUri.class, DocStateTypeUri::new);
        m.put(GroupUri.class, GroupUri::new);
        m.put(GroupTypeUri.class, GroupTypeUri::new);
        m.put(GroupStateUri.class, GroupStateUri::new);
        FACTORIES = Map.copyOf(m);
    }

    public static Set<Class<? extends ResourceUri>> kinds() {
        return FACTORIES.keySet();
    }

    /**
     * Constructs a reference of the given kind.
     *
     * @throws IllegalArgumentException if the kind is not registered
     * @throws DatatrackerException.InvalidUri if the path does not match the kind's prefix
     */
    public static <U extends ResourceUri> U parse(Class<U> kind, String path) {
        Objects.requireNonNull(kind, "kind");
        Function<String, ? extends ResourceUri> factory = FACTORIES.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("unknown resource kind: " + kind.getName());
        }
        return kind.cast(factory.apply(path));
    }
}
