package com.pulpulitiko.registryservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to close a current assignment")
public class CloseAssignmentRequest {

    @Schema(description = "Term end to record; keeps the existing one, or today, when omitted")
    private LocalDate termEnd;

    @Schema(description = "Why the assignment ends", example = "term_ended")
    private String endedReason;
}
