package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.ContactDetails;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls candidate e-mail addresses and North-American phone numbers out of raw page text.
 * Duplicates are dropped by exact match, first-seen order is kept and each list is capped.
 */
@Component
public class ContactExtractor {

    public static final int MAX_CONTACTS = 5;

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final Pattern PHONE_PATTERN =
            Pattern.compile("\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");

    public ContactDetails extractContacts(String text) {
        return new ContactDetails(extractEmails(text), extractPhones(text));
    }

    public List<String> extractEmails(String text) {
        return firstUniqueMatches(EMAIL_PATTERN, text);
    }

    public List<String> extractPhones(String text) {
        return firstUniqueMatches(PHONE_PATTERN, text);
    }

    private List<String> firstUniqueMatches(Pattern pattern, String text) {
        Set<String> results = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Matcher matcher = pattern.matcher(text);
        while (matcher.find() && results.size() < MAX_CONTACTS) {
            results.add(matcher.group());
        }
        return new ArrayList<>(results);
    }
}
