package com.calaccess.filings.client;

import com.calaccess.filings.domain.Form460Submission;
import java.nio.file.Path;
import java.util.List;

/**
 * A place where batches of normalized Form 460 submissions are dropped for ingestion.
 */
public interface SubmissionInbox {

    List<Path> pending();

    List<Form460Submission> read(Path batch);

    Path archive(Path batch, boolean failed);
}
