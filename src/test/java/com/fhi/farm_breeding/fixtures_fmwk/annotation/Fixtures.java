package com.fhi.farm_breeding.fixtures_fmwk.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the entities whose JSON fixtures are loaded before the tests of the annotated class.
 *
 * <p>Each entity is read from {@code fixtures/tests/<TestClass>/<entity>s.json} if present, else from
 * {@code fixtures/shared/<entity>s.json}, and saved through its Spring Data repository. Entities are
 * loaded in the declared order.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 *    @SpringIntegrationTest
 *    @Fixtures({ AnimalType.class, Farm.class })
 *    class MatingEventServiceTest { ... }
 * }</pre>
 *
 * <p>Generated ids keep increasing across reloads (rollback does not reset identity columns), so
 * tests look fixture rows up by name rather than by id.</p>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface Fixtures
{
    /**
     * Entity classes for which fixtures should be loaded.
     */
    Class<?>[] value();

    Lifecycle lifecycle() default Lifecycle.PER_METHOD;

    enum Lifecycle
    {
        /**
         * Load fixtures before each test method (default). Ensures test isolation.
         */
        PER_METHOD,

        /**
         * Load fixtures once per test class. Use when tests can share state.
         */
        PER_CLASS
    }
}
