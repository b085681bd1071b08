/**
 * Small stateless helpers shared across services: log sanitizing, time arithmetic, tokenizing.
 */
package com.phillippitts.culinara.util;
