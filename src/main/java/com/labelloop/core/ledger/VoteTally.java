package com.labelloop.core.ledger;

import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Vote;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of the votes cast on one task's annotations.
 * <p>
 * The <em>leader</em> is the annotation with at least one agreeing vote and the highest
 * share of agreeing votes among the votes it received; ties go to the earliest submission,
 * then to ledger order. The task's agreement ratio is the leader's agreeing votes over all
 * votes on the task, so a vote for a competing caption counts as dissent from the leader.
 */
public final class VoteTally {

    /**
     * Votes received by one annotation.
     *
     * @param annotation the annotation
     * @param position   index of the annotation in ledger order
     * @param agree      agreeing votes
     * @param total      all votes
     */
    public record AnnotationVotes(Annotation annotation, int position, int agree, int total) {
        public double agreeShare() {
            return total == 0 ? 0.0 : (double) agree / total;
        }
    }

    private static final Comparator<AnnotationVotes> LEADER_ORDER =
            Comparator.comparingDouble(AnnotationVotes::agreeShare).reversed()
                    .thenComparing(av -> av.annotation().submittedAt())
                    .thenComparingInt(AnnotationVotes::position);

    private final List<Annotation> annotations;
    private final List<Vote> votes;
    private final Map<String, AnnotationVotes> byAnnotation;

    public VoteTally(List<Annotation> annotations, List<Vote> votes) {
        this.annotations = List.copyOf(annotations);
        this.votes = List.copyOf(votes);
        this.byAnnotation = new LinkedHashMap<>();
        for (int i = 0; i < this.annotations.size(); i++) {
            Annotation a = this.annotations.get(i);
            int agree = 0;
            int total = 0;
            for (Vote v : this.votes) {
                if (v.annotationId().equals(a.id())) {
                    total++;
                    if (v.agree()) {
                        agree++;
                    }
                }
            }
            byAnnotation.put(a.id(), new AnnotationVotes(a, i, agree, total));
        }
    }

    public List<Annotation> annotations() {
        return annotations;
    }

    public List<Vote> votes() {
        return votes;
    }

    public int totalVotes() {
        return votes.size();
    }

    public List<AnnotationVotes> perAnnotation() {
        return new ArrayList<>(byAnnotation.values());
    }

    public Optional<AnnotationVotes> leader() {
        return byAnnotation.values().stream()
                .filter(av -> av.agree() > 0)
                .min(LEADER_ORDER);
    }

    public double agreementRatio() {
        if (votes.isEmpty()) {
            return 0.0;
        }
        return leader().map(av -> (double) av.agree() / votes.size()).orElse(0.0);
    }

    /** Distinct voters who agreed with the given annotation, in voting order. */
    public Set<String> agreeingVoters(String annotationId) {
        var voters = new LinkedHashSet<String>();
        for (Vote v : votes) {
            if (v.agree() && v.annotationId().equals(annotationId)) {
                voters.add(v.voterId());
            }
        }
        return voters;
    }
}
