package com.calaccess.filings.controller;

import com.calaccess.filings.domain.Form460Submission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record IngestionRunRequest(
    @Size(max = 200)
    String source,

    @NotEmpty
    List<@Valid Form460Submission> submissions
) {
}
