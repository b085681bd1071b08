/**
 * HTTP boundary: the query endpoint and exception-to-status mapping.
 */
package com.phillippitts.culinara.presentation;
