package com.eryxon.gateway.domain.naming;

import com.eryxon.gateway.tags.UnitTest;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class TopicNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "Laser Cutting, laser_cutting",
            "'  Plant   A  ', _plant_a_",
            "Acme Co., acme_co",
            "Zone-7_B, zone-7_b",
            "Ünïcødé Hall, ncd_hall",
            "a/b+c#d, abcd"
    })
    void shouldNormalizeToTopicSafeSegment(String raw, String expected) {
        assertThat(TopicNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"Laser Cutting", "Acme Co.", "'  x  y  '", "Ünïcødé"})
    void shouldBeIdempotent(String raw) {
        String once = TopicNormalizer.normalize(raw);

        assertThat(TopicNormalizer.normalize(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void shouldReturnEmptyForMissingValue(String raw) {
        assertThat(TopicNormalizer.normalize(raw)).isEmpty();
    }
}
