package io.ietfdata.core;

import io.ietfdata.core.group.GroupStateUri;
import io.ietfdata.core.person.PersonUri;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceUrisTest {

    @Test
    void everyKindIsRegistered() {
        assertThat(ResourceUris.kinds()).hasSize(12);
        assertThat(ResourceUris.kinds()).contains(PersonUri.class, GroupStateUri.class);
    }

    @Test
    void parseBuildsTheRequestedKind() {
        PersonUri uri = ResourceUris.parse(PersonUri.class, "/api/v1/person/person/20209/");

        assertThat(uri).isEqualTo(PersonUri.of(20209));
        assertThat(uri.kind()).isEqualTo("person");
    }

    @Test
    void parseValidatesThePrefix() {
        assertThatThrownBy(() -> ResourceUris.parse(GroupStateUri.class, "/api/v1/person/person/1/"))
                .isInstanceOf(DatatrackerException.InvalidUri.class);
    }

    @Test
    void parseRejectsUnregisteredKinds() {
        assertThatThrownBy(() -> ResourceUris.parse(UnregisteredUri.class, "/x/"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class UnregisteredUri extends ResourceUri {
        UnregisteredUri(String path) {
            super(path, "/x/");
        }

        @Override
        public String kind() {
            return "unregistered";
        }
    }
}
