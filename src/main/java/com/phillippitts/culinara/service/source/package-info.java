/**
 * Collaborator contracts for the candidate sources consumed by the orchestrator: embedding,
 * vector search, web search and page fetching. Implementations live outside this project;
 * {@link com.phillippitts.culinara.config.SourceFallbackConfig} wires placeholders that report
 * the source as unavailable when none is provided.
 */
package com.phillippitts.culinara.service.source;
