package com.calaccess.filings.client;

import com.calaccess.filings.domain.Form460Submission;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class LocalSubmissionInbox implements SubmissionInbox {

    private static final TypeReference<List<Form460Submission>> BATCH = new TypeReference<>() {
    };

    private final Path inboxPath;
    private final Path archivePath;
    private final String filePattern;
    private final ObjectMapper objectMapper;

    public LocalSubmissionInbox(Path inboxPath, Path archivePath, String filePattern, ObjectMapper objectMapper) {
        this.inboxPath = inboxPath;
        this.archivePath = archivePath;
        this.filePattern = filePattern;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Path> pending() {
        if (!Files.isDirectory(inboxPath)) {
            return List.of();
        }
        List<Path> batches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inboxPath, filePattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    batches.add(path);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list submission inbox " + inboxPath, e);
        }
        batches.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return batches;
    }

    @Override
    public List<Form460Submission> read(Path batch) {
        try (InputStream in = Files.newInputStream(batch)) {
            List<Form460Submission> submissions = objectMapper.readValue(in, BATCH);
            return submissions == null ? List.of() : submissions;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read submission batch " + batch.getFileName(), e);
        }
    }

    @Override
    public Path archive(Path batch, boolean failed) {
        try {
            Files.createDirectories(archivePath);
            String name = batch.getFileName().toString() + (failed ? ".failed" : "");
            Path target = archivePath.resolve(name);
            return Files.move(batch, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to archive submission batch " + batch.getFileName(), e);
        }
    }
}
