package com.acme.delivery.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonsTest {

  public record Sample(String name, Instant at) {}

  @Test
  @DisplayName("instants are written as ISO strings")
  void testIsoDates() {
    String json = Jsons.toJson(new Sample("a", Instant.parse("2024-01-01T00:00:00Z")));

    assertThat(json).contains("\"2024-01-01T00:00:00Z\"");
  }

  @Test
  @DisplayName("unknown properties are ignored")
  void testUnknownProperties() {
    Sample sample = Jsons.fromJson("{\"name\":\"a\",\"extra\":1}", Sample.class);

    assertThat(sample.name()).isEqualTo("a");
  }

  @Test
  @DisplayName("invalid or null JSON is a poison message")
  void testInvalid() {
    assertThatThrownBy(() -> Jsons.fromJson("{not json", Sample.class))
        .isInstanceOf(PoisonMessageException.class)
        .isInstanceOf(PermanentException.class);
    assertThatThrownBy(() -> Jsons.fromJson(null, Sample.class))
        .isInstanceOf(PoisonMessageException.class);
  }

  @Test
  @DisplayName("maps read blank input as empty")
  void testMaps() {
    assertThat(Jsons.toStringMap(null)).isEmpty();
    assertThat(Jsons.toStringMap("{\"a\":\"b\"}")).containsEntry("a", "b");
    assertThat(Jsons.toObjectMap("{\"n\":1}")).containsEntry("n", 1);
    assertThat(Jsons.merge(Map.of("a", "1", "b", "1"), Map.of("b", "2")))
        .containsEntry("a", "1")
        .containsEntry("b", "2");
  }
}
