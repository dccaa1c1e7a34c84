package com.delta.gapreview.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyTest {

    @Test
    void caseWhitespaceAndTermOrderDoNotMatter() {
        CacheKey first = CacheKey.of("search:catalog", "  Spring   Boot Tutorial ");
        CacheKey second = CacheKey.of("Search:Catalog", "tutorial boot spring");

        assertThat(first.value()).isEqualTo(second.value());
        assertThat(first.value()).isEqualTo("search:catalog:boot spring tutorial");
    }

    @Test
    void parametersAreOrderedByName() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("max", 8);
        first.put("Lang", "en");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("lang", "en");
        second.put("max", 8);

        assertThat(CacheKey.of("search", "docker", first)).isEqualTo(CacheKey.of("search", "docker", second));
        assertThat(CacheKey.of("search", "docker", first).value()).isEqualTo("search:docker|lang=en|max=8");
    }

    @Test
    void differentParametersProduceDifferentKeys() {
        assertThat(CacheKey.of("search", "docker", Map.of("max", 8)).value())
            .isNotEqualTo(CacheKey.of("search", "docker", Map.of("max", 9)).value());
    }

    @Test
    void longKeysAreHashed() {
        String query = "kubernetes ".repeat(40);
        String value = CacheKey.of("search", query + "extra").value();

        assertThat(value).startsWith("search:h:");
        assertThat(value).hasSize("search:h:".length() + 64);
    }

    @Test
    void namespaceIsRequired() {
        assertThatThrownBy(() -> CacheKey.of(" ", "docker")).isInstanceOf(IllegalArgumentException.class);
    }
}
