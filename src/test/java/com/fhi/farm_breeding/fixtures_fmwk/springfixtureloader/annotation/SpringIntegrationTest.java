package com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.TestInstance;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestExecutionListeners;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.farm_breeding.config.SpringTestConfig;
import com.fhi.farm_breeding.fixtures_fmwk.annotation.Fixtures;
import com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.FixtureTestExecutionListener;


/**
 * Meta-annotation for Spring Boot integration tests with transactional fixture-based data loading.
 *
 * This annotation:
 * - Boots the full Spring application context once per test class (cached across classes)
 * - Ensures transactional rollback after each test method (to isolate test data)
 * - Registers {@link FixtureTestExecutionListener} to load {@link Fixtures} automatically
 * - Imports {@link SpringTestConfig}: fixed clock, fixture loader, {@code TestHerd}
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)

@SpringBootTest

// application.yaml overridden by application-test.yaml
@ActiveProfiles("test")

// Lets @BeforeAll methods be non-static.
@TestInstance(TestInstance.Lifecycle.PER_CLASS)

@AutoConfigureMockMvc

// Each test method runs in a transaction rolled back after the test.
@Transactional

// @TestExecutionListeners looks for the class, not a bean: the listener must be registered here
// even though it reads its loader from the application context.
@TestExecutionListeners(
    value = FixtureTestExecutionListener.class,
    mergeMode = TestExecutionListeners.MergeMode.MERGE_WITH_DEFAULTS
)

@Import(SpringTestConfig.class)

// Usage: mvn test -Dgroups=SpringIntegrationTest
@Tag("SpringIntegrationTest")

public @interface SpringIntegrationTest
{}
