package me.golemcore.oracle.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * File and optional selection the caller attached to a prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {

    private String file;
    private String selection;
    private Integer line;
    private Integer column;
}
