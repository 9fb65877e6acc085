package com.pulpulitiko.importprocessor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ImportPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    @DisplayName("Defaults bind: three suggestions within edit distance two, party required")
    void defaultsBind() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            ImportProperties properties = context.getBean(ImportProperties.class);
            assertThat(properties.getSuggestions().getLimit()).isEqualTo(3);
            assertThat(properties.getSuggestions().getMaxEditDistance()).isEqualTo(2);
            assertThat(properties.getValidation().isPartyRequired()).isTrue();
        });
    }

    @Test
    @DisplayName("More than three suggestions is rejected at startup")
    void suggestionLimitAboveThree_fails() {
        contextRunner.withPropertyValues("importer.suggestions.limit=5")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(BindValidationException.class)
                        .rootCause().hasMessageContaining("suggestions.limit"));
    }

    @Test
    @DisplayName("A negative edit distance and a blank upload directory are rejected")
    void negativeDistanceAndBlankUploadDir_fail() {
        contextRunner.withPropertyValues("importer.suggestions.max-edit-distance=-1")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("importer.upload-dir= ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ImportProperties.class)
    static class PropertiesConfig {}
}
