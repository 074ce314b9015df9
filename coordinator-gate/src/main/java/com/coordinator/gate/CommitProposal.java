package com.coordinator.gate;

import java.util.List;

/**
 * A commit about to be made, as seen by a commit hook.
 *
 * @param commitHash Hash the completion gate inspects; may be null when none is known yet
 */
public record CommitProposal(String message, List<String> files, String commitHash) {

    public CommitProposal {
        message = message == null ? "" : message;
        files = files == null ? List.of() : List.copyOf(files);
    }
}
