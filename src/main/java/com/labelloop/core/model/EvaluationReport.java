package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Recorded comparison between a retrained model's caption and the reviewed ground truth.
 *
 * @param taskId                 the finalized task the evaluation refers to
 * @param modelVersion           version of the retrained model
 * @param originalCaption        caption of the prediction the task was created from
 * @param consensusCaption       accepted consensus caption
 * @param retrainedCaption       caption produced by the retrained model
 * @param agreementWithConsensus token-set overlap of retrained and consensus captions
 * @param agreementWithOriginal  token-set overlap of retrained and original captions
 * @param reviewedAt             when the report was recorded
 */
public record EvaluationReport(
    String taskId,
    String modelVersion,
    String originalCaption,
    String consensusCaption,
    String retrainedCaption,
    double agreementWithConsensus,
    double agreementWithOriginal,
    Instant reviewedAt
) implements Serializable {}
