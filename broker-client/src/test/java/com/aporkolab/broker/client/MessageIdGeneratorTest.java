package com.aporkolab.broker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MessageIdGeneratorTest {

    @Test
    @DisplayName("should format ids as prefix, epoch millis and nine base-36 chars")
    void shouldFormatIds() {
        Instant now = Instant.parse("2024-05-01T10:15:30.123Z");
        MessageIdGenerator generator = new MessageIdGenerator("payment-service", Clock.fixed(now, ZoneOffset.UTC));

        assertThat(generator.next()).matches("payment-service-" + now.toEpochMilli() + "-[0-9a-z]{9}");
    }

    @Test
    @DisplayName("should not repeat ids generated in the same millisecond")
    void shouldBeUniqueWithinSameMillisecond() {
        MessageIdGenerator generator = new MessageIdGenerator("svc",
                Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 10_000; i++) {
            ids.add(generator.next());
        }

        assertThat(ids).hasSize(10_000);
    }

    @Test
    @DisplayName("should reject blank prefix")
    void shouldRejectBlankPrefix() {
        assertThatThrownBy(() -> new MessageIdGenerator(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
