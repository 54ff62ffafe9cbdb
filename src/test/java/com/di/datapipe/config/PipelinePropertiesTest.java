package com.di.datapipe.config;

import com.di.datapipe.join.JoinDefinition;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetRegistration;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the shipped application.yml the way Spring Boot does at startup, without starting a context.
 */
@DisplayName("PipelineProperties Tests")
class PipelinePropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private PipelineProperties properties;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    private Set<String> violatedPaths() {
        return validator.validate(properties).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    @BeforeEach
    void setUp() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        StandardEnvironment environment = new StandardEnvironment();
        sources.forEach(environment.getPropertySources()::addLast);
        properties = new Binder(ConfigurationPropertySources.get(environment))
                .bind("datapipe", PipelineProperties.class)
                .orElseThrow(() -> new IllegalStateException("datapipe properties missing"));
    }

    @Test
    @DisplayName("Default runtime is local with the in-memory marker store")
    void testRuntimeDefaults() {
        assertEquals("local", properties.getRuntime());
        assertEquals("memory", properties.getState().getStore());
    }

    @Test
    @DisplayName("Configured datasets form a valid catalog")
    void testDatasets() {
        DatasetCatalog catalog = new DatasetCatalog(properties.getDatasets().stream()
                .map(PipelineProperties.Dataset::toRegistration)
                .toList());

        DatasetRegistration income = catalog.find("HOUSEHOLD_INCOME").orElseThrow();
        assertEquals("SAIPE", income.getDescriptor().getFilename());
        assertNull(income.getDescriptor().getFileprefix());
        assertEquals("http", income.getFetcher());
        assertTrue(catalog.find("POVERTY_BY_STATE").orElseThrow().getDescriptor().isPrefixed());
    }

    @Test
    @DisplayName("Configured joins are valid")
    void testJoins() {
        JoinDefinition join = properties.getJoins().get(0).toDefinition();
        assertNull(join.validationError());
        assertEquals(List.of("household_income", "poverty_by_state"), join.dependencyTables());
    }

    @Test
    @DisplayName("Durations bind from ISO-8601")
    void testDurations() {
        assertEquals(Duration.ofMinutes(5), properties.getBus().getTrigger().getAckDeadline());
        assertEquals(Duration.ofHours(26), properties.getJoin().getStaleAfter());
        assertEquals(3, properties.getIngestion().getPublishRetry().getMaxAttempts());
    }

    // ============================================================================
    // Validation
    // ============================================================================

    @Test
    @DisplayName("Shipped configuration passes validation")
    void testValidation_ShippedConfig() {
        assertEquals(Set.of(), violatedPaths());
    }

    @Test
    @DisplayName("Should reject an unknown runtime and store")
    void testValidation_UnknownRuntime() {
        properties.setRuntime("aws");
        properties.getState().setStore("redis");
        assertEquals(Set.of("runtime", "state.store"), violatedPaths());
    }

    @Test
    @DisplayName("Should reject a dataset without a bucket and a join without dependencies")
    void testValidation_IncompleteEntries() {
        properties.getDatasets().get(0).setGcsBucket(" ");
        properties.getJoins().get(0).setDependsOn(List.of());
        assertEquals(Set.of("datasets[0].gcsBucket", "joins[0].dependsOn"), violatedPaths());
    }

    @Test
    @DisplayName("Should reject a subscription that never delivers")
    void testValidation_ZeroDeliveryAttempts() {
        properties.getBus().getNotification().setMaxDeliveryAttempts(0);
        assertEquals(Set.of("bus.notification.maxDeliveryAttempts"), violatedPaths());
    }
}
