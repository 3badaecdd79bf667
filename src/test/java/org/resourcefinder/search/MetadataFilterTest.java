package org.resourcefinder.search;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataFilterTest {

    private static final Instant JAN_2024 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void sizeInRange_isInclusiveOnBothEnds() {
        assertThat(MetadataFilter.sizeInRange(10, 10L, 20L)).isTrue();
        assertThat(MetadataFilter.sizeInRange(20, 10L, 20L)).isTrue();
        assertThat(MetadataFilter.sizeInRange(9, 10L, 20L)).isFalse();
        assertThat(MetadataFilter.sizeInRange(21, 10L, 20L)).isFalse();
        assertThat(MetadataFilter.sizeInRange(0, null, 0L)).isTrue();
        assertThat(MetadataFilter.sizeInRange(Long.MAX_VALUE, null, null)).isTrue();
    }

    @Test
    void mtimeInRange_isExclusiveOnBothEnds() {
        assertThat(MetadataFilter.mtimeInRange(JAN_2024, JAN_2024, null)).isFalse();
        assertThat(MetadataFilter.mtimeInRange(JAN_2024.plusSeconds(1), JAN_2024, null)).isTrue();
        assertThat(MetadataFilter.mtimeInRange(JAN_2024, null, JAN_2024)).isFalse();
        assertThat(MetadataFilter.mtimeInRange(JAN_2024.minusSeconds(1), null, JAN_2024)).isTrue();
    }

    @Test
    void mtimeInRange_missingTimestampFailsOnlyWhenBoundGiven() {
        assertThat(MetadataFilter.mtimeInRange(null, null, null)).isTrue();
        assertThat(MetadataFilter.mtimeInRange(null, JAN_2024, null)).isFalse();
        assertThat(MetadataFilter.mtimeInRange(null, null, JAN_2024)).isFalse();
    }

    @Test
    void accepts_convertsDatesAtUtcMidnight() {
        FileCandidate candidate = new FileCandidate("a.txt", Path.of("a.txt"), 13, Instant.parse("2023-06-01T12:00:00Z"));
        SearchCriteria inRange = SearchCriteria.builder()
                .dateAfter(LocalDate.of(2022, 1, 1))
                .dateBefore(LocalDate.of(2024, 1, 1))
                .sizeMax(1000L)
                .build();
        SearchCriteria tooEarly = SearchCriteria.builder()
                .dateAfter(LocalDate.of(2023, 6, 2))
                .build();

        assertThat(MetadataFilter.accepts(candidate, inRange)).isTrue();
        assertThat(MetadataFilter.accepts(candidate, tooEarly)).isFalse();
        assertThat(MetadataFilter.accepts(candidate, SearchCriteria.builder().sizeMin(14L).build())).isFalse();
    }
}
