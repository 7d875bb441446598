package com.calaccess.filings.domain.item;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public record PersonName(
    @Column(name = "title", length = 10)
    String title,

    // last name, or the business name for organizations
    @Column(name = "last_name", length = 200)
    String lastName,

    @Column(name = "first_name", length = 45)
    String firstName,

    @Column(name = "suffix", length = 10)
    String suffix
) {

    public static PersonName of(String lastName, String firstName) {
        return new PersonName(null, lastName, firstName, null);
    }
}
