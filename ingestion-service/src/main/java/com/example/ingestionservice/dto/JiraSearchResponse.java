package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JiraSearchResponse {
    private int startAt;
    private int maxResults;
    private int total;
    private List<JiraIssueDto> issues = new ArrayList<>();
}
