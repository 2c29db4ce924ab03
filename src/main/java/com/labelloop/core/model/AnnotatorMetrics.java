package com.labelloop.core.model;

import java.io.Serializable;

/**
 * Read model for an annotator's dashboard entry.
 *
 * @param annotatorId        annotator identifier
 * @param reliability        current reliability score
 * @param throughput         annotations submitted
 * @param averageTaskSeconds mean assignment-to-submission time
 * @param disagreementRate   disagreements over all judged contributions (0 with no history)
 * @param agreementCount     contributions matching consensus
 * @param disagreementCount  contributions contradicting consensus
 * @param openTaskCount      assignments currently held
 */
public record AnnotatorMetrics(
    String annotatorId,
    double reliability,
    long throughput,
    double averageTaskSeconds,
    double disagreementRate,
    long agreementCount,
    long disagreementCount,
    int openTaskCount
) implements Serializable {

    public static AnnotatorMetrics of(Annotator annotator) {
        long judged = annotator.agreementCount() + annotator.disagreementCount();
        double avgSeconds = annotator.completedAnnotations() == 0 ? 0.0
                : annotator.totalAnnotationMillis() / 1000.0 / annotator.completedAnnotations();
        double disagreementRate = judged == 0 ? 0.0 : (double) annotator.disagreementCount() / judged;
        return new AnnotatorMetrics(annotator.id(), annotator.reliability(), annotator.completedAnnotations(),
                avgSeconds, disagreementRate, annotator.agreementCount(), annotator.disagreementCount(),
                annotator.openTaskCount());
    }
}
