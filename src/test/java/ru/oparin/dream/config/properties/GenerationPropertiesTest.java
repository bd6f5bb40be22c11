package ru.oparin.dream.config.properties;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationPropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(GenerationProperties.class);

    @Test
    void shouldAcceptDefaults() {
        assertThat(validator.validate(new GenerationProperties())).isEmpty();
    }

    @Test
    void shouldRejectStateTtlShorterThanCooldown() {
        GenerationProperties properties = new GenerationProperties();
        properties.setCooldown(Duration.ofMinutes(5));
        properties.setAdmissionStateTtl(Duration.ofMinutes(1));

        assertThat(validator.validate(properties).stream()
                .map(violation -> violation.getPropertyPath().toString())
                .toList())
                .containsExactly("admissionStateTtlCoveringCooldown");
    }

    @Test
    void shouldFailStartupWhenStateTtlShorterThanCooldown() {
        contextRunner
                .withPropertyValues("app.generation.cooldown=5m", "app.generation.admission-state-ttl=1m")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBindConsistentDurations() {
        contextRunner
                .withPropertyValues("app.generation.cooldown=30s", "app.generation.admission-state-ttl=2h")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    GenerationProperties properties = context.getBean(GenerationProperties.class);
                    assertThat(properties.getCooldown()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(properties.getAdmissionStateTtl()).isEqualTo(Duration.ofHours(2));
                });
    }
}
