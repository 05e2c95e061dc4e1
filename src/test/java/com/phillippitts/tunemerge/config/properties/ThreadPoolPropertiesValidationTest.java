package com.phillippitts.tunemerge.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolPropertiesValidationTest {

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new ThreadPoolProperties())).isEmpty();
    }

    @Test
    void rejectsZeroCorePoolSize() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getSource().setCorePoolSize(0);

        Set<ConstraintViolation<ThreadPoolProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .contains("source.corePoolSize");
    }

    @Test
    void rejectsMaxBelowCore() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getSource().setCorePoolSize(6);
        props.getSource().setMaxPoolSize(2);

        Set<ConstraintViolation<ThreadPoolProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .contains("threadpool.source.max-pool-size must be >= core-pool-size");
    }

    @Test
    void rejectsBlankThreadPrefix() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getSource().setThreadNamePrefix(" ");

        assertThat(validator.validate(props)).hasSize(1);
    }
}
