package me.golemcore.oracle.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Context gathered around a prompt besides the conversation history.
 */
@Data
@Builder
public class ExtraContext {

    @Builder.Default
    private List<String> projectFiles = new ArrayList<>();

    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();

    private AegisOrientation aegisOrientation;

    @Builder.Default
    private List<Note> aegisNotes = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> callerContext = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    /** Rendered system message text for the project manifest. */
    @JsonIgnore
    private String manifest;

    /**
     * Aegis state plus the files and selections touched by this request.
     */
    public record AegisOrientation(List<String> tags, String summary, double temperature, List<String> files,
            List<String> selections) {
    }
}
