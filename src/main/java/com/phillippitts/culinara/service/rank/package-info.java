/**
 * Candidate merging and ranking.
 */
package com.phillippitts.culinara.service.rank;
