package com.dogfold.scaffold.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Result of a generation flow: a status, a human-readable message, the path it concerns and
 * optional informational notes.
 */
@Value
@Builder
public class ScaffoldResult {

    @NonNull
    ResultStatus status;

    @NonNull
    String message;

    Path path;

    @Singular
    List<String> notes;

    public static ScaffoldResult success(String message, Path path) {
        return ScaffoldResult.builder()
                .status(ResultStatus.SUCCESS)
                .message(message)
                .path(path)
                .build();
    }

    public static ScaffoldResult alreadyExists(String message, Path path) {
        return ScaffoldResult.builder()
                .status(ResultStatus.WARNING)
                .message(message)
                .path(path)
                .build();
    }

    public static ScaffoldResult failure(String message) {
        return ScaffoldResult.builder()
                .status(ResultStatus.ERROR)
                .message(message)
                .build();
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    /**
     * Message prefixed with the status marker, followed by one line per note.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(status.getMarker()).append(' ').append(message);
        for (String note : notes) {
            sb.append(System.lineSeparator()).append("   ").append(note);
        }
        return sb.toString();
    }

    public int exitCode() {
        return ResultStatus.exitCodeOf(render());
    }
}
