package com.blogicum.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButCountsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(new Payload(2004874454540382209L, 7L, 3L, 15L, null));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("id").asText()).isEqualTo("2004874454540382209");
            assertThat(node.get("authorId").isTextual()).isTrue();
            assertThat(node.get("commentCount").isNumber()).isTrue();
            assertThat(node.get("total").isNumber()).isTrue();
            assertThat(node.get("categoryId").isNull()).isTrue();
        });
    }

    record Payload(long id, Long authorId, long commentCount, long total, Long categoryId) {
    }
}
