/**
 * Dietary compatibility rules.
 *
 * <p>{@link com.phillippitts.culinara.service.diet.DietaryFilter} is applied to every candidate
 * before ranking, so incompatible recipes never take a result slot.
 */
package com.phillippitts.culinara.service.diet;
