package com.mike.siteleadfinder.service.scoring;

import com.mike.siteleadfinder.dto.Issue;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single-site severity policy.
 * <p>
 * Ascending scale from {@value #MIN_SCORE} to {@value #MAX_SCORE}: the sum of the weights of
 * every fired signal rule, capped at the maximum. Higher means a worse site. Not to be mixed
 * up with {@link OpportunityScorer}, which runs in the opposite direction.
 */
@Component
public class SeverityScorer {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    public ClampedScore scoreSeverity(List<Issue> issues) {
        int raw = 0;
        if (issues != null) {
            for (Issue issue : issues) {
                raw += Math.max(0, issue.weight());
            }
        }
        return ClampedScore.clamp(raw, MIN_SCORE, MAX_SCORE);
    }
}
