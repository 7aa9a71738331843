package com.fhi.farm_breeding.model;

/**
 * Post-birth lifecycle of one offspring.
 *
 * <pre>
 *   ALIVE -> WEANED -> SOLD | DIED | TRANSFERRED | CULLED
 *   ALIVE -> SOLD | DIED | TRANSFERRED | CULLED
 * </pre>
 */
public enum OffspringStatus
{
    ALIVE,
    WEANED,
    SOLD,
    DIED,
    TRANSFERRED,
    CULLED;

    /**
     * True while the offspring is still on the farm and can move on.
     */
    public boolean isOnFarm()
    {   return this == ALIVE || this == WEANED;
    }

    /**
     * Registry status an offspring in this state is mirrored to, or null if none is mirrored.
     */
    public AnimalStatus mirroredAnimalStatus()
    {
        return switch (this)
        {
            case DIED        -> AnimalStatus.DECEASED;
            case SOLD        -> AnimalStatus.SOLD;
            case CULLED      -> AnimalStatus.CULLED;
            case TRANSFERRED -> AnimalStatus.TRANSFERRED;
            case ALIVE, WEANED -> null;
        };
    }
}
