package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DTO for a Notion page returned by /v1/search.
 * Properties are schema-less; the title is whichever property has type "title".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotionPageDto {

    private String id;
    private String object;
    private String url;

    @JsonProperty("created_time")
    private String createdTime;

    @JsonProperty("last_edited_time")
    private String lastEditedTime;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();
}
