package com.example.audiobook.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BookMetadata {
    private String title;
    private String subtitle;
    private String description;
    @Builder.Default
    private List<String> authors = new ArrayList<>();
    @Builder.Default
    private List<String> narrators = new ArrayList<>();
    private String publisher;
    @JsonProperty("series_name")
    private String seriesName;
    @JsonProperty("series_sequence")
    private String seriesSequence;
    @JsonProperty("release_date")
    private String releaseDate;
    private String language;
    @JsonProperty("cover_url")
    private String coverUrl;
    @JsonProperty("external_id")
    private String externalId;
}
