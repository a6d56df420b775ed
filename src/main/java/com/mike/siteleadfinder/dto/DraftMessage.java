package com.mike.siteleadfinder.dto;

public record DraftMessage(
        String subject,
        String body,
        String businessName
) {

    public String toText() {
        return "Subject: " + subject + "\n\n" + body;
    }
}
