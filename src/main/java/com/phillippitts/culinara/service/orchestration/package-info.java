/**
 * Query orchestration: the top-level pipeline from validated query to ranked, narrated response.
 *
 * <p>{@link com.phillippitts.culinara.service.orchestration.QueryOrchestrator} is the entry point;
 * {@link com.phillippitts.culinara.service.orchestration.QueryOrchestratorBuilder} wires it.
 */
package com.phillippitts.culinara.service.orchestration;
