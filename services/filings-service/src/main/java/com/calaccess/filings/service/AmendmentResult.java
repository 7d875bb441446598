package com.calaccess.filings.service;

import com.calaccess.filings.domain.Form460FilingVersionEntity;
import com.calaccess.filings.domain.UpsertResult;

public record AmendmentResult(Form460FilingVersionEntity version, UpsertResult result) {
}
