package com.mike.siteleadfinder.dto;

import java.util.List;

public record ContactDetails(
        List<String> emails,
        List<String> phones
) {

    public ContactDetails {
        emails = emails == null ? List.of() : List.copyOf(emails);
        phones = phones == null ? List.of() : List.copyOf(phones);
    }
}
