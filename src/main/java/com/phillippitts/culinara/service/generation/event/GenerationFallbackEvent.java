package com.phillippitts.culinara.service.generation.event;

import java.time.Instant;

/** Published when a generation provider fails and the chain moves on to the next one. */
public record GenerationFallbackEvent(String provider, String reason, Instant at) { }
