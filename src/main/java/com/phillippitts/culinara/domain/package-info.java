/**
 * Domain models for recipe queries.
 *
 * <p>This package contains immutable records: the incoming {@link com.phillippitts.culinara.domain.Query},
 * the {@link com.phillippitts.culinara.domain.Candidate} value objects produced by the database and
 * web stages, and the {@link com.phillippitts.culinara.domain.QueryResponse} handed back to callers.
 * Records validate their invariants in compact constructors.
 */
package com.phillippitts.culinara.domain;
