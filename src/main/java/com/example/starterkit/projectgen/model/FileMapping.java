package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Where a feature's file payload lives and where it lands in the output tree.
 */
@Value
@Builder
@Jacksonized
public class FileMapping {
    /**
     * File or directory, relative to the project root ("modules/...", "core/...")
     * or, for legacy entries, relative to the core base
     */
    String source;

    /**
     * Output-relative destination path
     */
    String destination;
}
