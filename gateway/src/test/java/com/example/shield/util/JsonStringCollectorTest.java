package com.example.shield.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonStringCollectorTest {

    @Test
    void testCollectsNestedStringLeaves() {
        String json = """
                {"title": "Hello", "views": 12, "draft": true,
                 "tags": ["news", "tech"],
                 "author": {"name": "Sam", "roles": [{"id": "editor"}]}}
                """;

        Map<String, String> values = JsonStringCollector.collect(json.getBytes(StandardCharsets.UTF_8));

        assertThat(values).containsExactly(
                entry("title", "Hello"),
                entry("tags[0]", "news"),
                entry("tags[1]", "tech"),
                entry("author.name", "Sam"),
                entry("author.roles[0].id", "editor"));
    }

    @Test
    void testTopLevelString() {
        assertThat(JsonStringCollector.collect("\"just text\"".getBytes(StandardCharsets.UTF_8)))
                .containsExactly(entry("$", "just text"));
    }

    @Test
    void testNonJsonAndEmptyBodies() {
        assertThat(JsonStringCollector.collect("name=value&x=1".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(JsonStringCollector.collect(new byte[0])).isEmpty();
        assertThat(JsonStringCollector.collect(null)).isEmpty();
    }
}
