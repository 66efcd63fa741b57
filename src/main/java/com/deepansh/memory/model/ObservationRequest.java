package com.deepansh.memory.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ObservationRequest {

    @NotBlank(message = "text must not be blank")
    private String text;

    /** Optional; a fresh id is generated when missing. */
    private String sourceId;

    /** Process on the decision pool and return immediately. */
    private boolean async;
}
