/**
 * HTTP surface: run submission, engine status and performance views, plus the global
 * exception mapping.
 */
package com.phillippitts.multishot.presentation;
