package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.config.LeadFinderProperties;
import com.mike.siteleadfinder.dto.FetchedPage;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.service.fetch.PageFetcher;
import com.mike.siteleadfinder.service.scoring.SeverityScorer;
import com.mike.siteleadfinder.service.signal.SignalExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SiteAnalyzerTest {

    private static final String OLD_SITE_HTML = "<html><head><title>Joe's Pizza | Chicago</title></head>" +
            "<body><marquee>Welcome!</marquee><font face='Comic Sans MS'>Best pizza</font>" +
            "<p>Call (312) 555-1234 or write to joe@joespizza.com</p><p>© 2009 Joe's Pizza</p></body></html>";

    private static final String MODERN_SITE_HTML = "<html><head>" +
            "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">" +
            "<meta name=\"description\" content=\"  Family bakery since 1990  \">" +
            "<title>Rosa's Bakery</title></head><body><p>© 2024 Rosa's</p></body></html>";

    private PageFetcher pageFetcher;
    private SiteAnalyzer siteAnalyzer;

    @BeforeEach
    void setUp() {
        pageFetcher = mock(PageFetcher.class);
        siteAnalyzer = new SiteAnalyzer(
                new SignalExtractor(),
                new ContactExtractor(),
                new SeverityScorer(),
                pageFetcher,
                new LeadFinderProperties()
        );
    }

    @Nested
    @DisplayName("analyzeUrl")
    class AnalyzeUrl {

        @Test
        @DisplayName("bare host -> fetched over https with the configured timeout")
        void bareHost_prefixedWithHttps() {
            //Arrange
            when(pageFetcher.fetch(anyString(), any())).thenReturn(
                    FetchedPage.of("https://example.com", MODERN_SITE_HTML, 200));
            //Act
            siteAnalyzer.analyzeUrl("example.com");
            //Assert
            verify(pageFetcher).fetch("https://example.com", Duration.ofMillis(10_000));
        }

        @Test
        @DisplayName("blank url -> no fetch, empty result")
        void blankUrl_noFetch() {
            //Act
            ScoreResult result = siteAnalyzer.analyzeUrl("   ");
            //Assert
            verifyNoInteractions(pageFetcher);
            assertEquals(0, result.score());
            assertEquals(1, result.issues().size());
            assertEquals(IssueKind.NO_WEBSITE, result.issues().get(0).kind());
        }

        @Test
        @DisplayName("unreachable site -> single issue worth 2 points")
        void unreachable_scoresTwo() {
            //Arrange
            when(pageFetcher.fetch(anyString(), any())).thenReturn(
                    FetchedPage.unreachable("https://down.example", "Connection refused"));
            //Act
            ScoreResult result = siteAnalyzer.analyzeUrl("https://down.example");
            //Assert
            assertEquals(2, result.score());
            assertEquals(0, result.status());
            assertEquals("https://down.example", result.title());
            assertEquals(1, result.issues().size());
            assertEquals(IssueKind.UNREACHABLE_SITE, result.issues().get(0).kind());
            assertEquals("Site unreachable: Connection refused", result.issues().get(0).message());
            assertTrue(result.emails().isEmpty());
            assertFalse(result.mobileFriendly());
        }

        @Test
        @DisplayName("long failure reason -> cut to 80 chars")
        void unreachable_reasonTruncated() {
            //Arrange
            String reason = "x".repeat(150);
            when(pageFetcher.fetch(anyString(), any())).thenReturn(
                    FetchedPage.unreachable("https://down.example", reason));
            //Act
            ScoreResult result = siteAnalyzer.analyzeUrl("https://down.example");
            //Assert
            assertEquals("Site unreachable: " + "x".repeat(80), result.issues().get(0).message());
        }
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("old insecure site -> clamped to 10 with contacts")
        void oldSite() {
            //Act
            ScoreResult result = siteAnalyzer.analyze(FetchedPage.of("http://joespizza.com", OLD_SITE_HTML, 200));
            //Assert
            assertEquals(10, result.score());
            assertTrue(result.clamped());
            assertEquals("Joe's Pizza | Chicago", result.title());
            assertEquals(List.of("joe@joespizza.com"), result.emails());
            assertEquals(List.of("(312) 555-1234"), result.phones());
            assertFalse(result.mobileFriendly());
            assertFalse(result.secureTransport());
            assertEquals(200, result.status());
            assertTrue(result.issues().stream().anyMatch(i -> i.message().equals("Copyright year: 2009")));
        }

        @Test
        @DisplayName("modern site -> score 0, description trimmed")
        void modernSite() {
            //Act
            ScoreResult result = siteAnalyzer.analyze(FetchedPage.of("https://rosasbakery.com", MODERN_SITE_HTML, 200));
            //Assert
            assertEquals(0, result.score());
            assertTrue(result.issues().isEmpty());
            assertTrue(result.mobileFriendly());
            assertTrue(result.secureTransport());
            assertEquals("Rosa's Bakery", result.title());
            assertEquals("Family bakery since 1990", result.description());
            assertEquals(0, result.pageSizeKb());
        }

        @Test
        @DisplayName("missing title -> url, long title -> 120 chars")
        void titleFallbackAndTruncation() {
            //Arrange
            String longTitle = "T".repeat(150);
            //Act
            ScoreResult untitled = siteAnalyzer.analyze(FetchedPage.of("https://a.example", "<p>hi</p>", 200));
            ScoreResult verbose = siteAnalyzer.analyze(FetchedPage.of("https://b.example",
                    "<title>" + longTitle + "</title>", 200));
            //Assert
            assertEquals("https://a.example", untitled.title());
            assertEquals("T".repeat(120), verbose.title());
        }

        @Test
        @DisplayName("untitled page at a hyphenated url -> title is the full url")
        void untitledHyphenatedUrl_titleIsUrl() {
            //Act
            ScoreResult result = siteAnalyzer.analyze(FetchedPage.of("https://joes-pizza.com", "<p>menu</p>", 200));
            //Assert
            assertEquals("https://joes-pizza.com", result.title());
        }

        @Test
        @DisplayName("untitled page without url -> empty title and url, never null")
        void untitledPageWithoutUrl_emptyTitle() {
            //Act
            ScoreResult result = siteAnalyzer.analyze(new FetchedPage(null, "<p>menu</p>", 200, 11, null));
            //Assert
            assertEquals("", result.title());
            assertEquals("", result.url());
            assertFalse(result.secureTransport());
        }

        @Test
        @DisplayName("page size is rounded to whole kilobytes")
        void pageSizeRounded() {
            //Arrange
            String html = "<meta name=viewport>" + "a".repeat(2_000);
            //Act
            ScoreResult result = siteAnalyzer.analyze(FetchedPage.of("https://c.example", html, 200));
            //Assert
            assertEquals(2, result.pageSizeKb());
        }

        @Test
        @DisplayName("null page -> empty result")
        void nullPage() {
            assertEquals(IssueKind.NO_WEBSITE, siteAnalyzer.analyze(null).issues().get(0).kind());
        }
    }
}
