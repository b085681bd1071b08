/**
 * Text generation: the provider contract, the ordered fallback chain and prompt building.
 */
package com.phillippitts.culinara.service.generation;
