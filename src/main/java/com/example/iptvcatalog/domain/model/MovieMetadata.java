package com.example.iptvcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MovieMetadata implements EntryMetadata {

    private String title;

    private Integer year;

    private String genre;

    public MovieMetadata(String title, Integer year) {
        this(title, year, null);
    }
}
