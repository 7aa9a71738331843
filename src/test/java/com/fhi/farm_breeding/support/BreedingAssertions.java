package com.fhi.farm_breeding.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import com.fhi.farm_breeding.service.exception.breeding.BreedingException;

public final class BreedingAssertions
{
    private BreedingAssertions()
    {}

    /**
     * Asserts that the call fails with a {@link BreedingException} of the given cause.
     */
    public static void assertBreedingError(BreedingException.Cause expected, ThrowingCallable call)
    {   assertThatThrownBy(call)
            .isInstanceOfSatisfying(BreedingException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(expected));
    }
}
