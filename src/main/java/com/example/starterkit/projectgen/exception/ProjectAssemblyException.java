package com.example.starterkit.projectgen.exception;

import java.util.List;

/**
 * File tree could not be read or a mapping points outside the allowed roots.
 * Generation never produces a partial project, so this aborts the run.
 */
public class ProjectAssemblyException extends GenerationException {
    public static final String CODE = "ASSEMBLY_IO";

    public ProjectAssemblyException(String description, String path) {
        super(CODE, description, List.of(path));
    }

    public ProjectAssemblyException(String description, String path, Throwable cause) {
        super(CODE, description, List.of(path), cause);
    }
}
