package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Slack Web API envelope for conversations.list and conversations.history.
 * Slack reports most errors as HTTP 200 with ok=false.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlackResponse {

    private boolean ok;
    private String error;
    private List<Channel> channels = new ArrayList<>();
    private List<Message> messages = new ArrayList<>();

    @JsonProperty("has_more")
    private boolean hasMore;

    @JsonProperty("response_metadata")
    private ResponseMetadata responseMetadata;

    public String nextCursor() {
        if (responseMetadata == null || responseMetadata.getNextCursor() == null
                || responseMetadata.getNextCursor().isBlank()) {
            return null;
        }
        return responseMetadata.getNextCursor();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Channel {
        private String id;
        private String name;

        @JsonProperty("is_member")
        private boolean member;

        @JsonProperty("is_private")
        private boolean privateChannel;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String type;
        private String subtype;
        private String ts;
        private String user;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseMetadata {
        @JsonProperty("next_cursor")
        private String nextCursor;
    }
}
