package com.phillippitts.culinara.service.generation.event;

import java.time.Instant;

/** Published when no generation provider produced usable text for a prompt. */
public record AllProvidersFailedEvent(int attempted, Instant at) { }
