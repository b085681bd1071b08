package com.phillippitts.culinara.domain;

/**
 * Outcome of running a prompt through the generation fallback chain.
 *
 * @param text     generated text, empty on failure
 * @param provider id of the provider that succeeded, null on failure
 * @param ok       true when some provider produced non-blank text
 */
public record GenerationResult(String text, String provider, boolean ok) {

    private static final GenerationResult FAILURE = new GenerationResult("", null, false);

    public GenerationResult {
        text = text == null ? "" : text;
    }

    public static GenerationResult success(String text, String provider) {
        return new GenerationResult(text, provider, true);
    }

    public static GenerationResult failure() {
        return FAILURE;
    }
}
