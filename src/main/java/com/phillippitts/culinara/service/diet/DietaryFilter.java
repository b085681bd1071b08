package com.phillippitts.culinara.service.diet;

import com.phillippitts.culinara.domain.Candidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether a recipe is compatible with the diets a user asked for.
 *
 * <p>Each {@link DietTag} maps to a predicate over the candidate's {@link IngredientProfile}.
 * Requested predicates are combined with logical AND, with one precedence rule: when
 * NON_VEGETARIAN is combined with KETO or LOW_CARB, the strict carb predicates give way to a
 * relaxed one that rejects a recipe only when a dominant starch is present and no animal protein
 * is. Under that rule "Chicken Fried Rice" passes and "Pasta Primavera" does not.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class DietaryFilter {

    private static final Logger LOG = LogManager.getLogger(DietaryFilter.class);

    private static final Predicate<IngredientProfile> STRICT_LOW_CARB =
            p -> !p.strongCarb() && !p.moderateCarb();

    private static final Predicate<IngredientProfile> RELAXED_LOW_CARB =
            p -> !(p.strongCarb() && !p.animalProtein());

    private static final Map<DietTag, Predicate<IngredientProfile>> RULES = buildRules();

    private static Map<DietTag, Predicate<IngredientProfile>> buildRules() {
        Map<DietTag, Predicate<IngredientProfile>> rules = new EnumMap<>(DietTag.class);
        rules.put(DietTag.VEGAN, p -> !p.meat() && !p.seafood() && !p.dairy() && !p.egg()
                && !p.honey() && !p.gelatin());
        rules.put(DietTag.VEGETARIAN, p -> !p.meat() && !p.seafood() && !p.gelatin());
        rules.put(DietTag.NON_VEGETARIAN, IngredientProfile::animalProtein);
        rules.put(DietTag.LOW_CARB, STRICT_LOW_CARB);
        rules.put(DietTag.KETO, STRICT_LOW_CARB.and(p -> !p.sweetener()));
        rules.put(DietTag.GLUTEN_FREE, p -> !p.gluten());
        rules.put(DietTag.DAIRY_FREE, p -> !p.dairy());
        rules.put(DietTag.PALEO, p -> !p.grain() && !p.legume() && !p.dairy() && !p.sweetener());
        return Collections.unmodifiableMap(rules);
    }

    /**
     * Returns true when the candidate satisfies every requested diet.
     *
     * @param candidate      recipe to check
     * @param requestedDiets diet labels as sent by the caller; unknown labels are ignored
     * @return true if compatible (always true when no recognised diet is requested)
     */
    public boolean accepts(Candidate candidate, Set<String> requestedDiets) {
        return admitting(requestedDiets).test(candidate);
    }

    /**
     * Builds a reusable admission predicate for a set of diet labels. Labels are parsed once,
     * so callers filtering many candidates should prefer this over {@link #accepts}.
     *
     * @param requestedDiets diet labels as sent by the caller
     * @return predicate accepting compatible candidates
     */
    public Predicate<Candidate> admitting(Collection<String> requestedDiets) {
        Predicate<IngredientProfile> rule = ruleFor(parse(requestedDiets));
        return candidate -> rule.test(IngredientProfile.of(candidate.title(), candidate.ingredients()));
    }

    /**
     * Parses caller labels into tags, logging and skipping anything unrecognised.
     */
    public Set<DietTag> parse(Collection<String> labels) {
        Set<DietTag> tags = EnumSet.noneOf(DietTag.class);
        if (labels == null) {
            return tags;
        }
        for (String label : labels) {
            DietTag.fromLabel(label).ifPresentOrElse(tags::add,
                    () -> LOG.debug("Ignoring unknown diet label '{}'", label));
        }
        return tags;
    }

    Predicate<IngredientProfile> ruleFor(Set<DietTag> tags) {
        if (tags.isEmpty()) {
            return p -> true;
        }
        boolean relaxCarbs = tags.contains(DietTag.NON_VEGETARIAN)
                && (tags.contains(DietTag.KETO) || tags.contains(DietTag.LOW_CARB));
        List<Predicate<IngredientProfile>> predicates = new ArrayList<>();
        for (DietTag tag : tags) {
            if (relaxCarbs && (tag == DietTag.KETO || tag == DietTag.LOW_CARB)) {
                continue;
            }
            predicates.add(RULES.get(tag));
        }
        if (relaxCarbs) {
            predicates.add(RELAXED_LOW_CARB);
        }
        return p -> {
            for (Predicate<IngredientProfile> predicate : predicates) {
                if (!predicate.test(p)) {
                    return false;
                }
            }
            return true;
        };
    }
}
