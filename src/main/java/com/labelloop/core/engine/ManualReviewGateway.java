package com.labelloop.core.engine;

import com.labelloop.core.model.ManualReviewRequired;

/**
 * Collaborator that takes over tasks the automated loop gave up on.
 */
@FunctionalInterface
public interface ManualReviewGateway {

    void requestReview(ManualReviewRequired signal);
}
