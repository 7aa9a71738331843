package com.fhi.farm_breeding.service.exception.breeding;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.fhi.farm_breeding.model.Animal;

/**
 * Exception thrown when a reproduction or genetics operation violates a domain rule.
 *
 * <p>Use the static factory methods to build a {@code BreedingException} with a specific
 * {@link Cause} and a descriptive message. The API layer maps the cause to an HTTP status.</p>
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class BreedingException extends RuntimeException
{
    /**
     * Reason the operation was refused.
     */
   public enum Cause
   {
      NOT_FOUND             ("%s %d not found"),
      PERMISSION_DENIED     ("Farm %d is not owned by user %d"),
      INVALID_SEX           ("%s %s must be %s but is %s"),
      FEATURE_DISABLED      ("%s is not enabled for the animal type of %s"),
      ALREADY_PREGNANT      ("Dam %s already has an active pregnancy"),
      ALREADY_TERMINAL      ("Offspring %d is already recorded as %s"),
      CONFLICT              ("%s"),
      INVALID_TRANSITION    ("Cannot %s %s %d in status %s"),
      VALIDATION_ERROR      ("%s"),
      IMMUTABLE_FIELD_CHANGE("Field '%s' of %s %d cannot be changed"),
      INCONSISTENT_STATE    ("%s"),
      UNKNOWN               ("Unknown breeding error");

      private final String messageTemplate;

      Cause(String messageTemplate)
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args)
      {  return String.format(messageTemplate, args);
      }

      public String getCode()
      {   return this.name();
      }
   }

   private final Cause causeEnum;

   public BreedingException(Cause causeEnum, String message)
   {  this(causeEnum, message, null);
   }

    /**
     * @param causeEnum the domain reason
     * @param message human-readable description
     * @param cause the exception that triggered this one, or null
     */
    public BreedingException(Cause causeEnum, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
    }

    public Cause getCauseEnum()
    {   return causeEnum;
    }


   /**
    * {@code BreedingException: message | Caused by: CauseClass: cause message}
    */
   @Override
   public String toString()
   {
      String errMsg = String.format("%s[%s]: %s", this.getClass().getSimpleName(), causeEnum, this.getMessage());
      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null
            && !cause.getMessage().isBlank())
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }


    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

    /**
     * @param entity display name of the missing entity, e.g. "Animal", "Pregnancy"
     */
    public static BreedingException notFound(String entity, Long id)
    {   return new BreedingException(Cause.NOT_FOUND, Cause.NOT_FOUND.format(entity, id));
    }

    public static BreedingException permissionDenied(Long farmId, Long userId)
    {   return new BreedingException(Cause.PERMISSION_DENIED, Cause.PERMISSION_DENIED.format(farmId, userId));
    }

    /**
     * @param role "Sire" or "Dam"
     */
    public static BreedingException invalidSex(String role, Animal animal, String expected)
    {   return new BreedingException(Cause.INVALID_SEX,
                                     Cause.INVALID_SEX.format(role, animal.describe(), expected, animal.getGender()));
    }

    /**
     * @param feature "Reproduction" or "Genetics"
     */
    public static BreedingException featureDisabled(String feature, Animal animal)
    {   return new BreedingException(Cause.FEATURE_DISABLED, Cause.FEATURE_DISABLED.format(feature, animal.describe()));
    }

    public static BreedingException alreadyPregnant(Animal dam)
    {   return new BreedingException(Cause.ALREADY_PREGNANT, Cause.ALREADY_PREGNANT.format(dam.describe()));
    }

    public static BreedingException alreadyTerminal(Long offspringId, Object status)
    {   return new BreedingException(Cause.ALREADY_TERMINAL, Cause.ALREADY_TERMINAL.format(offspringId, status));
    }

    public static BreedingException conflict(String message)
    {   return new BreedingException(Cause.CONFLICT, Cause.CONFLICT.format(message));
    }

    /**
     * E.g. {@code invalidTransition("record outcome for", "mating event", 12L, MatingStatus.CANCELLED)}.
     */
    public static BreedingException invalidTransition(String action, String entity, Long id, Object currentStatus)
    {   return new BreedingException(Cause.INVALID_TRANSITION,
                                     Cause.INVALID_TRANSITION.format(action, entity, id, currentStatus));
    }

    public static BreedingException validation(String message)
    {   return new BreedingException(Cause.VALIDATION_ERROR, Cause.VALIDATION_ERROR.format(message));
    }

    public static BreedingException immutableField(String field, String entity, Long id)
    {   return new BreedingException(Cause.IMMUTABLE_FIELD_CHANGE, Cause.IMMUTABLE_FIELD_CHANGE.format(field, entity, id));
    }

    /**
     * A multi-step write failed halfway. The surrounding transaction is rolled back.
     *
     * @param cause pass null if no Throwable cause.
     */
    public static BreedingException inconsistentState(String message, Throwable cause)
    {   return new BreedingException(Cause.INCONSISTENT_STATE, Cause.INCONSISTENT_STATE.format(message), cause);
    }

    public static BreedingException unknown(String message, Throwable cause)
    {   return new BreedingException(Cause.UNKNOWN,
                                     message != null ? message : Cause.UNKNOWN.format(),
                                     cause);
    }
}
