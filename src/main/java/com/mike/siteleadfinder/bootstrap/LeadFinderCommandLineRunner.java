package com.mike.siteleadfinder.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.siteleadfinder.dto.AnalysisResponse;
import com.mike.siteleadfinder.dto.LeadBatchResponse;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.service.LeadReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point, active with {@code leadfinder.cli.enabled=true}.
 * <pre>
 *   &lt;url&gt; [&lt;url&gt;...]     analyze sites
 *   --batch=&lt;file&gt;          analyze every non-blank line of the file
 *   --leads=&lt;file&gt;          score TSV lead records: title, url, snippet[, location]
 *   --json                  JSON instead of text
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "leadfinder.cli", name = "enabled", havingValue = "true")
public class LeadFinderCommandLineRunner implements CommandLineRunner {

    private final LeadReportService leadReportService;
    private final ObjectMapper objectMapper;

    private PrintStream out = System.out;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        boolean json = false;
        String batchFile = null;
        String leadsFile = null;
        List<String> urls = new ArrayList<>();

        for (String arg : args) {
            if (arg.equals("--json")) {
                json = true;
            } else if (arg.startsWith("--batch=")) {
                batchFile = arg.substring("--batch=".length());
            } else if (arg.startsWith("--leads=")) {
                leadsFile = arg.substring("--leads=".length());
            } else if (!arg.startsWith("--")) {
                urls.add(arg);
            }
        }

        if (leadsFile != null) {
            List<LeadMetadata> leads = readLeads(Path.of(leadsFile));
            log.info("LeadFinderCommandLineRunner: scoring {} leads from {}", leads.size(), leadsFile);
            LeadBatchResponse response = leadReportService.scoreLeads(leads);
            out.println(json ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response.results())
                    : response.table());
            return;
        }

        if (batchFile != null) {
            urls.addAll(readNonBlankLines(Path.of(batchFile)));
        }

        if (urls.isEmpty()) {
            log.warn("LeadFinderCommandLineRunner: nothing to do, pass a url, --batch=<file> or --leads=<file>");
            return;
        }

        log.info("LeadFinderCommandLineRunner: analyzing {} urls", urls.size());
        List<AnalysisResponse> responses = leadReportService.analyzeSites(urls);

        if (json) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(responses));
        } else {
            for (AnalysisResponse response : responses) {
                out.println(response.report());
            }
        }
    }

    private List<String> readNonBlankLines(Path path) throws IOException {
        return Files.readAllLines(path).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    private List<LeadMetadata> readLeads(Path path) throws IOException {
        // columns may be empty, so lines are not stripped before splitting
        return Files.readAllLines(path).stream()
                .filter(line -> !line.isBlank())
                .map(LeadFinderCommandLineRunner::parseLeadLine)
                .toList();
    }

    static LeadMetadata parseLeadLine(String line) {
        String[] parts = line.split("\t", -1);
        String title = parts.length > 0 ? parts[0].strip() : "";
        String url = parts.length > 1 ? parts[1].strip() : "";
        String snippet = parts.length > 2 ? parts[2].strip() : "";
        String location = parts.length > 3 && !parts[3].isBlank() ? parts[3].strip() : null;
        return new LeadMetadata(title, url, snippet, location);
    }
}
