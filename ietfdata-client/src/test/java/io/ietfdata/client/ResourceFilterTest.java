package io.ietfdata.client;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceFilterTest {

    @Test
    void noneHasNoParameters() {
        assertThat(ResourceFilter.none().toQuery()).isEmpty();
        assertThat(ResourceFilter.none().name()).isEmpty();
    }

    @Test
    void parametersUseServerFieldNames() {
        ResourceFilter filter = ResourceFilter.builder()
                .name("Colin Perkins")
                .nameContains("Perk")
                .since(Instant.parse("2018-05-01T08:00:00.250Z"))
                .until(Instant.parse("2018-06-01T00:00:00Z"))
                .build();

        assertThat(filter.toQuery())
                .containsEntry("name", "Colin Perkins")
                .containsEntry("name__contains", "Perk")
                .containsEntry("time__gte", "2018-05-01T08:00:01")
                .containsEntry("time__lt", "2018-06-01T00:00:00")
                .hasSize(4);
    }

    @Test
    void subSecondBoundsNeverWidenTheRange() {
        ResourceFilter filter = ResourceFilter.builder()
                .since(Instant.parse("2021-03-04T10:00:00.500Z"))
                .until(Instant.parse("2021-03-04T11:00:00.999Z"))
                .build();

        assertThat(filter.toQuery())
                .containsEntry("time__gte", "2021-03-04T10:00:01")
                .containsEntry("time__lt", "2021-03-04T11:00:00");
    }

    @Test
    void wholeSecondBoundsAreSentUnchanged() {
        ResourceFilter filter = ResourceFilter.builder()
                .since(Instant.parse("2021-03-04T10:00:00Z"))
                .build();

        assertThat(filter.toQuery()).containsEntry("time__gte", "2021-03-04T10:00:00");
    }

    @Test
    void sinceAfterUntilIsRejected() {
        ResourceFilter.Builder builder = ResourceFilter.builder()
                .since(Instant.parse("2020-01-02T00:00:00Z"))
                .until(Instant.parse("2020-01-01T00:00:00Z"));

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("since");
    }

    @Test
    void equalBoundsAreAllowed() {
        Instant t = Instant.parse("2020-01-01T00:00:00Z");

        assertThat(ResourceFilter.builder().since(t).until(t).build().since()).contains(t);
    }
}
