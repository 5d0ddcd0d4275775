package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.SeverityTier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves violation codes to their point value and severity tier.
 *
 * Codes are matched after normalisation (upper case, spaces and dashes removed), so
 * "1180 d", "1180-D" and "1180D" are the same code. Unknown codes resolve to empty;
 * the caller decides what an unknown code means, no default points are applied.
 */
public class ViolationCodeCatalog {

    public record CodeDefinition(String code, int points, SeverityTier severity) {}

    private final Map<String, CodeDefinition> byNormalisedCode;

    public ViolationCodeCatalog(Map<String, CodeDefinition> definitions) {
        Map<String, CodeDefinition> index = new LinkedHashMap<>();
        definitions.forEach((code, def) -> {
            CodeDefinition previous = index.put(normalise(code), def);
            if (previous != null) {
                throw new IllegalArgumentException("Violation code defined twice: " + code);
            }
        });
        this.byNormalisedCode = Collections.unmodifiableMap(index);
    }

    /**
     * NY VTL 1180 speeding codes plus the camera speed codes.
     * Points per code follow the NY point schedule; 1180D-family, school zone and
     * work zone codes are the severe tier.
     */
    public static ViolationCodeCatalog defaults() {
        Map<String, CodeDefinition> defs = new LinkedHashMap<>();
        add(defs, "1180A", 2, SeverityTier.LOW);        // 1-10 mph over
        add(defs, "1180B", 3, SeverityTier.MODERATE);   // 11-20 mph over
        add(defs, "1180C", 5, SeverityTier.HIGH);       // 21-30 mph over
        add(defs, "1180D", 8, SeverityTier.SEVERE);     // 31+ mph over
        add(defs, "1180D2", 8, SeverityTier.SEVERE);
        add(defs, "1180DJ", 8, SeverityTier.SEVERE);
        add(defs, "1180E", 6, SeverityTier.SEVERE);     // school zone
        add(defs, "1180F", 6, SeverityTier.SEVERE);     // work zone
        add(defs, "PHTO-SCHOOL-ZN-SPEED", 0, SeverityTier.LOW);
        add(defs, "PHTO-SPEED", 0, SeverityTier.LOW);
        return new ViolationCodeCatalog(defs);
    }

    private static void add(Map<String, CodeDefinition> defs, String code, int points, SeverityTier severity) {
        defs.put(code, new CodeDefinition(code, points, severity));
    }

    public Optional<CodeDefinition> resolve(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        return Optional.ofNullable(byNormalisedCode.get(normalise(code)));
    }

    public int size() {
        return byNormalisedCode.size();
    }

    public Map<String, CodeDefinition> definitions() {
        Map<String, CodeDefinition> out = new LinkedHashMap<>();
        byNormalisedCode.values().forEach(def -> out.put(def.code(), def));
        return out;
    }

    static String normalise(String code) {
        return code.trim().toUpperCase().replaceAll("[\\s\\-_]+", "");
    }
}
