package com.quantori.eqp.api;

import com.quantori.eqp.api.model.ProgressUpdate;

/**
 * Receives progress of a thematic search. Invocations are serialized and follow the pipeline stage
 * order. Events may be dropped when the listener cannot keep up, the oldest pending ones first.
 */
@FunctionalInterface
public interface ProgressListener {
  ProgressListener NO_OP = update -> { };

  void onProgress(ProgressUpdate update);
}
