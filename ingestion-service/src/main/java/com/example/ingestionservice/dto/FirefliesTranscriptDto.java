package com.example.ingestionservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for a Fireflies GraphQL transcript.
 * date is epoch milliseconds, duration is minutes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FirefliesTranscriptDto {

    private String id;
    private String title;
    private Long date;
    private Double duration;

    @Builder.Default
    private List<String> participants = new ArrayList<>();

    @JsonProperty("organizer_email")
    private String organizerEmail;

    @JsonProperty("meeting_attendees")
    @Builder.Default
    private List<Attendee> meetingAttendees = new ArrayList<>();

    @Builder.Default
    private List<Sentence> sentences = new ArrayList<>();

    @JsonProperty("sharing_settings")
    private SharingSettings sharingSettings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attendee {
        private String email;
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sentence {
        private String text;

        @JsonProperty("speaker_name")
        private String speakerName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SharingSettings {
        @JsonProperty("shared_with")
        private List<String> sharedWith = new ArrayList<>();

        @JsonProperty("is_public")
        private boolean publicMeeting;
    }
}
