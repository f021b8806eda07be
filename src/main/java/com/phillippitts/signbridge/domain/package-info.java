/**
 * Immutable value types shared across the mediation pipeline: input events, pipeline
 * context and status, phrase entries and cached recognition/animation payloads.
 */
package com.phillippitts.signbridge.domain;
