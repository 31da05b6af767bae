package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Craft specializations a project can be submitted under.
 * <p>
 * Every craft-keyed table is an exhaustive {@code switch} over this enum, so adding a craft
 * forces each table to decide what the new craft looks like. {@link #GENERAL} is the default
 * profile that crafts without specific guidance fall back to.
 */
public enum CraftType {

    WOODWORKING,
    METALWORKING,
    LEATHERCRAFT,
    POTTERY,
    WEAVING,
    BLACKSMITHING,
    BUSHCRAFT,
    STONEMASONRY,
    GLASSBLOWING,
    JEWELRY,
    GENERAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the lower-case wire value.
     *
     * @throws IllegalArgumentException if the value names no known craft
     */
    @JsonCreator
    public static CraftType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Craft type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown craft type: " + value, e);
        }
    }

    /** Aspects a reviewer of this craft looks at first. */
    public List<String> evaluationFocus() {
        return switch (this) {
            case WOODWORKING -> List.of("joint quality", "grain orientation", "finishing technique");
            case METALWORKING -> List.of("precision", "heat treatment", "surface finish");
            case POTTERY -> List.of("form consistency", "glazing technique", "firing results");
            case WEAVING -> List.of("tension consistency", "pattern execution", "edge finishing");
            case LEATHERCRAFT -> List.of("stitching quality", "edge finishing", "dye application");
            case JEWELRY -> List.of("precision work", "stone setting", "metal finishing");
            case BLACKSMITHING, BUSHCRAFT, STONEMASONRY, GLASSBLOWING, GENERAL ->
                    List.of("technique execution", "tool usage", "safety practices");
        };
    }

    /** Problems crafters of this kind typically run into. */
    public List<String> commonChallenges() {
        return switch (this) {
            case WOODWORKING -> List.of("wood movement", "grain tear-out", "joint fitting");
            case METALWORKING -> List.of("heat control", "material warping", "surface oxidation");
            case POTTERY -> List.of("cracking", "glazing defects", "firing issues");
            case WEAVING -> List.of("tension problems", "pattern errors", "edge distortion");
            case LEATHERCRAFT -> List.of("leather selection", "stitching consistency", "dye bleeding");
            case JEWELRY -> List.of("stone damage", "metal fatigue", "sizing accuracy");
            case BLACKSMITHING, BUSHCRAFT, STONEMASONRY, GLASSBLOWING, GENERAL ->
                    List.of("tool selection", "project planning", "quality consistency");
        };
    }

    /** Safety practices the safety rubric looks for in this craft. */
    public List<String> safetyConsiderations() {
        return switch (this) {
            case WOODWORKING -> List.of("Eye and hearing protection", "Dust collection", "Blade guards",
                    "Safe feeding techniques");
            case METALWORKING -> List.of("Heat protection", "Ventilation for fumes", "Eye protection for welding",
                    "Fire safety");
            case POTTERY -> List.of("Clay dust prevention", "Kiln safety", "Chemical safety for glazes",
                    "Proper lifting techniques");
            case WEAVING -> List.of("Proper posture", "Eye strain prevention",
                    "Repetitive motion injury prevention");
            case LEATHERCRAFT -> List.of("Sharp blade handling", "Chemical safety for dyes",
                    "Ventilation for solvents");
            case JEWELRY -> List.of("Torch safety", "Chemical safety for acids", "Eye protection for detail work");
            case BLACKSMITHING -> List.of("Fire safety", "Heat protection", "Ventilation", "Tool handling");
            case BUSHCRAFT -> List.of("Knife safety", "Fire safety", "Weather awareness", "First aid preparedness");
            case STONEMASONRY -> List.of("Dust protection", "Heavy lifting safety", "Tool maintenance",
                    "Eye protection");
            case GLASSBLOWING -> List.of("Heat protection", "Eye protection", "Ventilation", "Tool safety");
            case GENERAL -> List.of("Basic PPE usage", "Safe workspace setup", "Tool handling", "Risk awareness");
        };
    }

    /** Quality markers the technical-execution rubric looks for in this craft. */
    public List<String> qualityIndicators() {
        return switch (this) {
            case WOODWORKING -> List.of("Joint quality", "Surface finish", "Grain orientation", "Dimensional accuracy");
            case METALWORKING -> List.of("Precision tolerances", "Weld quality", "Surface finish", "Heat treatment");
            case POTTERY -> List.of("Wall thickness", "Form balance", "Glaze application", "Firing success");
            case WEAVING -> List.of("Tension consistency", "Pattern accuracy", "Edge quality", "Color transitions");
            case LEATHERCRAFT -> List.of("Stitch consistency", "Edge finishing", "Dye application",
                    "Hardware attachment");
            case JEWELRY -> List.of("Precision work", "Stone setting", "Surface polish", "Joint quality");
            case BLACKSMITHING -> List.of("Heat control", "Form accuracy", "Surface texture", "Structural integrity");
            case BUSHCRAFT -> List.of("Functionality", "Durability", "Efficiency", "Safety integration");
            case STONEMASONRY -> List.of("Joint quality", "Surface finish", "Structural integrity", "Tool marks");
            case GLASSBLOWING -> List.of("Form consistency", "Wall thickness", "Surface quality", "Color application");
            case GENERAL -> List.of("Technique execution", "Attention to detail", "Functional quality",
                    "Aesthetic appeal");
        };
    }
}
