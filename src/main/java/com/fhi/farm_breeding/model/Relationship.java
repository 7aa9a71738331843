package com.fhi.farm_breeding.model;

/**
 * Kinship between two animals, with its relatedness coefficient and the breeding risk it implies.
 */
public enum Relationship
{
    PARENT      (0.5,   RiskLevel.HIGH,   "Parent-Offspring relationship"),
    OFFSPRING   (0.5,   RiskLevel.HIGH,   "Offspring-Parent relationship"),
    FULL_SIBLING(0.5,   RiskLevel.HIGH,   "Full siblings"),
    HALF_SIBLING(0.25,  RiskLevel.MEDIUM, "Half siblings"),
    GRANDPARENT (0.25,  RiskLevel.MEDIUM, "Grandparent-Grandchild"),
    GRANDCHILD  (0.25,  RiskLevel.MEDIUM, "Grandchild-Grandparent"),
    COUSIN      (0.125, RiskLevel.LOW,    "Cousins");

    private final double coefficient;
    private final RiskLevel risk;
    private final String title;

    Relationship(double coefficient, RiskLevel risk, String title)
    {   this.coefficient = coefficient;
        this.risk = risk;
        this.title = title;
    }

    public double getCoefficient()
    {   return coefficient;
    }

    public RiskLevel getRisk()
    {   return risk;
    }

    /**
     * The relationship seen from the other animal: if B is A's parent, A is B's offspring.
     */
    public Relationship inverse()
    {
        return switch (this)
        {
            case PARENT      -> OFFSPRING;
            case OFFSPRING   -> PARENT;
            case GRANDPARENT -> GRANDCHILD;
            case GRANDCHILD  -> GRANDPARENT;
            default          -> this;
        };
    }

    public String label()
    {   return name().toLowerCase().replace('_', ' ');
    }

    /**
     * E.g. "Half siblings (medium risk)".
     */
    public String description()
    {   return title + " (" + risk.name().toLowerCase() + " risk)";
    }
}
