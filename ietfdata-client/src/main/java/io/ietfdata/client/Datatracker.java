package io.ietfdata.client;

import io.ietfdata.core.DatatrackerException;
import io.ietfdata.core.Protocol;
import io.ietfdata.core.Urls;
import io.ietfdata.core.doc.DocState;
import io.ietfdata.core.doc.DocStateType;
import io.ietfdata.core.doc.DocStateTypeUri;
import io.ietfdata.core.doc.DocStateUri;
import io.ietfdata.core.doc.Document;
import io.ietfdata.core.doc.DocumentUri;
import io.ietfdata.core.email.Email;
import io.ietfdata.core.email.EmailUri;
import io.ietfdata.core.email.HistoricalEmail;
import io.ietfdata.core.email.HistoricalEmailUri;
import io.ietfdata.core.group.Group;
import io.ietfdata.core.group.GroupState;
import io.ietfdata.core.group.GroupStateUri;
import io.ietfdata.core.group.GroupType;
import io.ietfdata.core.group.GroupTypeUri;
import io.ietfdata.core.group.GroupUri;
import io.ietfdata.core.person.HistoricalPerson;
import io.ietfdata.core.person.HistoricalPersonUri;
import io.ietfdata.core.person.Person;
import io.ietfdata.core.person.PersonAlias;
import io.ietfdata.core.person.PersonAliasUri;
import io.ietfdata.core.person.PersonUri;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only client for the IETF Datatracker REST API.
 *
 * <p>Single lookups return the decoded record or throw {@link DatatrackerException.NotFound} /
 * {@link DatatrackerException.Transport}. Collection lookups return a {@link PaginatedSequence} that
 * issues no request until it is iterated. Every call starts from scratch; nothing is cached.
 *
 * <pre>{@code
 * Datatracker dt = Datatracker.builder().build();
 * Person p = dt.personFromEmail("csp@csperkins.org");
 * for (Email e : dt.emailsForPerson(p.resourceUri())) {
 *     System.out.println(e.address());
 * }
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads; the sequences they return are not.
 */
public final class Datatracker {

    private final DatatrackerConfig config;
    private final ResourceClient client;
    private final URI origin;

    Datatracker(DatatrackerConfig config, ResourceClient client) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.origin = config.origin();
    }

    public static DatatrackerBuilder builder() {
        return new DatatrackerBuilder();
    }

    public DatatrackerConfig config() {
        return config;
    }

    // People

    public Person person(PersonUri uri) {
        return client.fetchOne(uri.resolve(origin), Person.class);
    }

    public Person personById(long id) {
        return person(PersonUri.of(id));
    }

    public HistoricalPerson historicalPerson(HistoricalPersonUri uri) {
        return client.fetchOne(uri.resolve(origin), HistoricalPerson.class);
    }

    public PersonAlias personAlias(PersonAliasUri uri) {
        return client.fetchOne(uri.resolve(origin), PersonAlias.class);
    }

    public PaginatedSequence<Person> people(ResourceFilter filter) {
        return collection(Protocol.PATH_PERSON, filter.toQuery(), Person.class);
    }

    /**
     * Earlier versions of a person record, oldest first as the server orders them.
     */
    public PaginatedSequence<HistoricalPerson> personHistory(PersonUri person) {
        return collection(Protocol.PATH_HISTORICAL_PERSON,
                Map.of(Protocol.Q_ID, Long.toString(person.id())), HistoricalPerson.class);
    }

    public PaginatedSequence<PersonAlias> personAliases(PersonUri person) {
        return collection(Protocol.PATH_PERSON_ALIAS,
                Map.of(Protocol.Q_PERSON, Long.toString(person.id())), PersonAlias.class);
    }

    /**
     * Looks up the email record, then the person it belongs to. A failed email lookup means the person
     * is never requested.
     */
    public Person personFromEmail(String address) {
        return person(email(address).person());
    }

    // Email

    /**
     * @throws IllegalArgumentException if the address is empty
     */
    public Email email(String address) {
        return client.fetchOne(Urls.member(origin, Protocol.PATH_EMAIL, address), Email.class);
    }

    public Email email(EmailUri uri) {
        return client.fetchOne(uri.resolve(origin), Email.class);
    }

    public HistoricalEmail historicalEmail(HistoricalEmailUri uri) {
        return client.fetchOne(uri.resolve(origin), HistoricalEmail.class);
    }

    public PaginatedSequence<Email> emailsForPerson(PersonUri person) {
        return collection(Protocol.PATH_EMAIL,
                Map.of(Protocol.Q_PERSON, Long.toString(person.id())), Email.class);
    }

    public PaginatedSequence<HistoricalEmail> emailHistory(String address) {
        return collection(Protocol.PATH_HISTORICAL_EMAIL,
                Map.of(Protocol.Q_ADDRESS, address), HistoricalEmail.class);
    }

    // Documents

    public Document document(DocumentUri uri) {
        return client.fetchOne(uri.resolve(origin), Document.class);
    }

    public Document documentByName(String name) {
        return client.fetchOne(Urls.member(origin, Protocol.PATH_DOCUMENT, name), Document.class);
    }

    public PaginatedSequence<Document> documents(ResourceFilter filter) {
        return collection(Protocol.PATH_DOCUMENT, filter.toQuery(), Document.class);
    }

    public DocState docState(DocStateUri uri) {
        return client.fetchOne(uri.resolve(origin), DocState.class);
    }

    public PaginatedSequence<DocState> docStates() {
        return collection(Protocol.PATH_DOC_STATE, Map.of(), DocState.class);
    }

    public PaginatedSequence<DocState> docStates(DocStateTypeUri stateType) {
        return collection(Protocol.PATH_DOC_STATE,
                Map.of(Protocol.Q_TYPE, stateType.slug()), DocState.class);
    }

    public DocStateType docStateType(DocStateTypeUri uri) {
        return client.fetchOne(uri.resolve(origin), DocStateType.class);
    }

    public PaginatedSequence<DocStateType> docStateTypes() {
        return collection(Protocol.PATH_DOC_STATE_TYPE, Map.of(), DocStateType.class);
    }

    // Groups

    public Group group(GroupUri uri) {
        return client.fetchOne(uri.resolve(origin), Group.class);
    }

    /**
     * @throws DatatrackerException.NotFound if no group has this acronym
     */
    public Group groupFromAcronym(String acronym) {
        Objects.requireNonNull(acronym, "acronym");
        URI url = Urls.withQuery(Urls.resolve(origin, Protocol.PATH_GROUP), Map.of(Protocol.Q_ACRONYM, acronym));
        PageEnvelope<Group> page = client.fetchPage(url, Group.class);
        if (page.objects().isEmpty()) {
            throw new DatatrackerException.NotFound(url, "no group with acronym " + acronym);
        }
        return page.objects().get(0);
    }

    public PaginatedSequence<Group> groups(ResourceFilter filter) {
        return collection(Protocol.PATH_GROUP, filter.toQuery(), Group.class);
    }

    public GroupType groupType(GroupTypeUri uri) {
        return client.fetchOne(uri.resolve(origin), GroupType.class);
    }

    public PaginatedSequence<GroupType> groupTypes() {
        return collection(Protocol.PATH_GROUP_TYPE, Map.of(), GroupType.class);
    }

    public GroupState groupState(GroupStateUri uri) {
        return client.fetchOne(uri.resolve(origin), GroupState.class);
    }

    public PaginatedSequence<GroupState> groupStates() {
        return collection(Protocol.PATH_GROUP_STATE, Map.of(), GroupState.class);
    }

    private <T> PaginatedSequence<T> collection(String path, Map<String, String> query, Class<T> type) {
        Map<String, String> params = new LinkedHashMap<>(query);
        params.put(Protocol.Q_LIMIT, Integer.toString(config.pageSize()));
        URI first = Urls.withQuery(Urls.resolve(origin, path), params);
        return new PaginatedSequence<>(client, origin, first, type);
    }
}
