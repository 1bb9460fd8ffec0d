package com.shoptrends.warehouse.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoaderProperties Validation Tests")
class LoaderPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    @DisplayName("Should accept the default settings")
    void shouldAcceptDefaults() {
        assertThat(validator.validate(new LoaderProperties())).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"10", "10.00", "99.5", "-0.01"})
    @DisplayName("Should reject a rating bound that does not fit DECIMAL(3,2)")
    void shouldRejectRatingBoundOutsideColumn(String bound) {
        // Given
        LoaderProperties properties = new LoaderProperties();
        properties.setMaxReviewRating(new BigDecimal(bound));

        // When
        Set<ConstraintViolation<LoaderProperties>> violations = validator.validate(properties);

        // Then
        assertThat(violations)
            .extracting(violation -> violation.getPropertyPath().toString())
            .containsExactly("maxReviewRating");
    }

    @Test
    @DisplayName("Should accept the largest rating the column holds")
    void shouldAcceptLargestRatingBound() {
        LoaderProperties properties = new LoaderProperties();
        properties.setMaxReviewRating(new BigDecimal("9.99"));

        assertThat(validator.validate(properties)).isEmpty();
    }
}
