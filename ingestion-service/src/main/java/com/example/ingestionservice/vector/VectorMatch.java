package com.example.ingestionservice.vector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorMatch {
    private String id;
    private double score;
    private Map<String, Object> metadata;
}
