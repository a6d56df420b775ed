package com.mike.siteleadfinder.service.scoring;

import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.OpportunityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpportunityScorerTest {

    private OpportunityScorer opportunityScorer;

    @BeforeEach
    void setUp() {
        opportunityScorer = new OpportunityScorer();
    }

    private List<IssueKind> kinds(OpportunityScore score) {
        return score.issues().stream().map(Issue::kind).toList();
    }

    @Nested
    @DisplayName("no website")
    class NoWebsite {

        @Test
        @DisplayName("empty url -> 0 with a single issue, whatever the snippet says")
        void emptyUrl_zero() {
            //Act
            OpportunityScore score = opportunityScorer.scoreOpportunity("", "Joe's Pizza", "coming soon adobe flash");
            //Assert
            assertEquals(0, score.score());
            assertEquals(1, score.issues().size());
            assertEquals("No website found", score.issues().get(0).message());
            assertEquals(IssueKind.NO_WEBSITE, score.issues().get(0).kind());
        }

        @Test
        @DisplayName("null and blank url behave like empty")
        void nullOrBlankUrl_zero() {
            assertEquals(0, opportunityScorer.scoreOpportunity(null, null, null).score());
            assertEquals(0, opportunityScorer.scoreOpportunity("   ", "x", "y").score());
        }
    }

    @Nested
    @DisplayName("penalties")
    class Penalties {

        @Test
        @DisplayName("wix subdomain + under construction -> 5")
        void wixUnderConstruction_five() {
            OpportunityScore score = opportunityScorer.scoreOpportunity("https://joe.wix.com", "Joe", "under construction");

            assertEquals(5, score.score());
            assertFalse(score.clamped());
            assertEquals(List.of(IssueKind.LOW_EFFORT_BUILDER, IssueKind.MAINTENANCE_PLACEHOLDER), kinds(score));
        }

        @Test
        @DisplayName("facebook page -> 25")
        void facebookPage() {
            OpportunityScore score = opportunityScorer.scoreOpportunity("https://www.facebook.com/joespizza", "Joe", "");

            assertEquals(25, score.score());
            assertEquals(List.of(IssueKind.HOSTED_ON_SOCIAL_OR_DIRECTORY), kinds(score));
        }

        @Test
        @DisplayName("free wordpress.com subdomain without scheme -> 40")
        void freeWordpressSubdomain() {
            OpportunityScore score = opportunityScorer.scoreOpportunity("joesplumbing.wordpress.com", "Joe", null);

            assertEquals(40, score.score());
            assertEquals(List.of(IssueKind.FREE_HOSTED_SUBDOMAIN), kinds(score));
        }

        @Test
        @DisplayName("flash mentioned in snippet -> 25")
        void flashInSnippet() {
            OpportunityScore score = opportunityScorer.scoreOpportunity("https://joes.com", "Joe",
                    "This site requires Adobe Flash Player");

            assertEquals(25, score.score());
            assertEquals(List.of(IssueKind.TECHNOLOGY_STALENESS_IN_SNIPPET), kinds(score));
        }

        @Test
        @DisplayName("domain rules come before snippet rules and all apply; result is clamped")
        void cumulative_clampedAtZero() {
            OpportunityScore score = opportunityScorer.scoreOpportunity("https://www.facebook.com/x", "X",
                    "Coming soon! Requires Adobe Flash Player");

            assertEquals(0, score.score());
            assertTrue(score.clamped());
            assertEquals(List.of(
                    IssueKind.HOSTED_ON_SOCIAL_OR_DIRECTORY,
                    IssueKind.MAINTENANCE_PLACEHOLDER,
                    IssueKind.TECHNOLOGY_STALENESS_IN_SNIPPET), kinds(score));
        }

        @Test
        @DisplayName("look-alike domain is not a builder")
        void lookAlikeDomain_noPenalty() {
            assertEquals(50, opportunityScorer.scoreOpportunity("https://notwix.com", "x", "").score());
        }
    }

    @Test
    @DisplayName("clean site keeps baseline and gets a review note")
    void cleanSite_baselineWithNote() {
        OpportunityScore score = opportunityScorer.scoreOpportunity("https://joespizza.com", "Joe's", "Best pizza in town");

        assertEquals(OpportunityScorer.BASELINE, score.score());
        assertEquals(List.of(IssueKind.NEEDS_MANUAL_REVIEW), kinds(score));
        assertFalse(score.issues().get(0).negative());
    }

    @Test
    @DisplayName("score(index, lead) carries the index and the lead")
    void score_carriesIndex() {
        LeadMetadata lead = LeadMetadata.of("Joe", "https://joe.wix.com", "under construction");

        OpportunityResult result = opportunityScorer.score(7, lead);

        assertEquals(7, result.index());
        assertSame(lead, result.lead());
        assertEquals(5, result.score());
    }

    @Test
    @DisplayName("null lead -> scored as no website")
    void nullLead_noWebsite() {
        OpportunityResult result = opportunityScorer.score(0, null);

        assertEquals(0, result.score());
        assertEquals(IssueKind.NO_WEBSITE, result.issues().get(0).kind());
    }
}
