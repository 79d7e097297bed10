package com.acme.eventlog.core;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TopicFilterTest {

    @Test
    void testWildcardMatchesEverything() {
        TopicFilter filter = TopicFilter.of(Set.of("*"));
        assertTrue(filter.matches("person_created"));
        assertTrue(filter.matches("anything"));
    }

    @Test
    void testWildcardAlongsideNamedTopics() {
        TopicFilter filter = TopicFilter.of(Set.of("person_created", "*"));
        assertTrue(filter.matches("order_placed"));
    }

    @Test
    void testNamedTopicsOnly() {
        TopicFilter filter = TopicFilter.of(Set.of("person_created", "person_deleted"));
        assertTrue(filter.matches("person_created"));
        assertTrue(filter.matches("person_deleted"));
        assertFalse(filter.matches("person_updated"));
    }

    @Test
    void testEmptySetMatchesNothing() {
        TopicFilter filter = TopicFilter.of(Set.of());
        assertFalse(filter.matches("person_created"));
    }

    @Test
    void testNullTopicsTreatedAsWildcard() {
        assertTrue(TopicFilter.of(null).matches("person_created"));
    }
}
