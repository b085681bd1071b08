package com.phillippitts.culinara.service.diet;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Which ingredient families appear in a recipe's title and ingredient lines.
 *
 * <p>Markers match on word boundaries with optional plural suffixes, so "eggs" is an egg marker
 * and "eggplant" is not. Each family strips its own plant-based look-alikes before matching:
 * "coconut milk" is not dairy and "cauliflower rice" is not a carb.
 *
 * @param meat         chicken, beef, pork and other land-animal meat
 * @param seafood      fish and shellfish
 * @param dairy        milk, cheese, butter, cream and friends
 * @param egg          eggs
 * @param honey        honey
 * @param gelatin      gelatin
 * @param gluten       wheat and wheat products
 * @param strongCarb   pasta, bread, noodles and similar dominant starches
 * @param moderateCarb rice, potato, sugar, corn and similar
 * @param sweetener    sugar, honey, syrups
 * @param legume       beans, lentils, peanuts, soy
 * @param grain        any cereal grain or product made from one
 */
public record IngredientProfile(
        boolean meat,
        boolean seafood,
        boolean dairy,
        boolean egg,
        boolean honey,
        boolean gelatin,
        boolean gluten,
        boolean strongCarb,
        boolean moderateCarb,
        boolean sweetener,
        boolean legume,
        boolean grain
) {

    private static final Markers MEAT = Markers.of(
            List.of("chicken", "beef", "pork", "lamb", "mutton", "bacon", "ham", "hamburger", "sausage",
                    "turkey", "duck", "steak", "veal", "venison", "goat", "prosciutto", "salami",
                    "pepperoni", "chorizo", "meat", "meatball", "brisket", "ribs", "mince"),
            List.of("vegan sausage", "veggie burger", "plant-based meat", "goat cheese", "goat's cheese",
                    "goat milk", "goat's milk"));

    private static final Markers SEAFOOD = Markers.of(
            List.of("fish", "salmon", "tuna", "shrimp", "prawn", "crab", "lobster", "cod", "tilapia",
                    "anchovy", "anchovies", "sardine", "scallop", "clam", "mussel", "oyster", "squid",
                    "calamari", "halibut", "trout", "mackerel", "seafood"),
            List.of());

    private static final Markers DAIRY = Markers.of(
            List.of("milk", "cheese", "butter", "cream", "yogurt", "yoghurt", "ghee", "parmesan",
                    "mozzarella", "cheddar", "feta", "ricotta", "paneer", "buttermilk", "mascarpone",
                    "custard", "alfredo"),
            List.of("coconut milk", "almond milk", "oat milk", "soy milk", "rice milk", "cashew milk",
                    "peanut butter", "almond butter", "cocoa butter", "nut butter", "coconut cream",
                    "cashew cream", "vegan cheese", "vegan butter", "butter bean"));

    private static final Markers EGG = Markers.of(List.of("egg", "yolk"), List.of("egg-free", "eggless"));

    private static final Markers HONEY = Markers.of(List.of("honey"), List.of());

    private static final Markers GELATIN = Markers.of(List.of("gelatin", "gelatine"), List.of());

    private static final List<String> FLOUR_SWAPS = List.of(
            "almond flour", "coconut flour", "cauliflower rice", "zucchini noodle", "gluten-free",
            "gluten free");

    private static final Markers GLUTEN = Markers.of(
            List.of("wheat", "flour", "bread", "pasta", "noodle", "barley", "rye", "couscous", "seitan",
                    "spaghetti", "macaroni", "lasagna", "penne", "fettuccine", "linguine", "crouton",
                    "bun", "bagel", "baguette", "croissant", "breadcrumb", "panko", "semolina",
                    "bulgur", "farro"),
            FLOUR_SWAPS);

    private static final Markers STRONG_CARB = Markers.of(
            List.of("pasta", "bread", "noodle", "flour", "spaghetti", "macaroni", "lasagna", "penne",
                    "fettuccine", "linguine", "tortilla", "bun", "bagel", "baguette", "croissant",
                    "couscous", "crouton"),
            FLOUR_SWAPS);

    private static final Markers MODERATE_CARB = Markers.of(
            List.of("rice", "potato", "sugar", "corn", "oat", "quinoa", "barley"),
            FLOUR_SWAPS);

    private static final Markers SWEETENER = Markers.of(
            List.of("sugar", "honey", "maple syrup", "agave", "syrup", "molasses"),
            List.of("sugar-free", "sugar free"));

    private static final Markers LEGUME = Markers.of(
            List.of("bean", "lentil", "chickpea", "peanut", "soy", "tofu", "edamame", "tempeh", "hummus"),
            List.of("green bean"));

    private static final Markers GRAIN = Markers.of(
            List.of("wheat", "flour", "rice", "oat", "corn", "barley", "rye", "quinoa", "pasta", "bread",
                    "noodle", "couscous", "bulgur", "millet", "spaghetti", "macaroni", "tortilla"),
            FLOUR_SWAPS);

    /**
     * Computes the profile of a recipe.
     *
     * @param title       recipe title, may be null
     * @param ingredients ingredient lines, may be null
     * @return profile with a flag per ingredient family
     */
    public static IngredientProfile of(String title, List<String> ingredients) {
        String text = ((title == null ? "" : title) + " "
                + (ingredients == null ? "" : String.join(", ", ingredients))).toLowerCase(Locale.ROOT);
        return new IngredientProfile(
                MEAT.foundIn(text),
                SEAFOOD.foundIn(text),
                DAIRY.foundIn(text),
                EGG.foundIn(text),
                HONEY.foundIn(text),
                GELATIN.foundIn(text),
                GLUTEN.foundIn(text),
                STRONG_CARB.foundIn(text),
                MODERATE_CARB.foundIn(text),
                SWEETENER.foundIn(text),
                LEGUME.foundIn(text),
                GRAIN.foundIn(text));
    }

    public boolean animalProtein() {
        return meat || seafood;
    }

    /** One ingredient family: its marker words and the phrases that only look like them. */
    private static final class Markers {

        private final Pattern markers;
        private final Pattern exceptions;

        private Markers(Pattern markers, Pattern exceptions) {
            this.markers = markers;
            this.exceptions = exceptions;
        }

        static Markers of(List<String> words, List<String> exceptions) {
            Pattern exceptionPattern = exceptions.isEmpty() ? null : wordPattern(exceptions);
            return new Markers(wordPattern(words), exceptionPattern);
        }

        // Optional plural suffix, so "zucchini noodles" and "eggs" match their singular entry.
        private static Pattern wordPattern(List<String> words) {
            String alternation = words.stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|"));
            return Pattern.compile("\\b(?:" + alternation + ")(?:s|es)?\\b");
        }

        boolean foundIn(String lowerText) {
            String text = exceptions == null ? lowerText : exceptions.matcher(lowerText).replaceAll(" ");
            return markers.matcher(text).find();
        }
    }
}
