package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A review judgment on an existing {@link Annotation}. The voter is never the annotation's author.
 *
 * @param id           vote identifier
 * @param annotationId the annotation being judged
 * @param taskId       task the annotation belongs to
 * @param voterId      annotator casting the vote
 * @param agree        true if the voter accepts the caption
 * @param castAt       when the vote was cast
 */
public record Vote(
    String id,
    String annotationId,
    String taskId,
    String voterId,
    boolean agree,
    Instant castAt
) implements Serializable {}
