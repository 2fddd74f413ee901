package com.projecttree.order.path;

import lombok.Getter;
import lombok.NonNull;

import java.nio.file.Path;

/**
 * Roots includes against the directory that contains the project.
 * Malformed paths raise {@link java.nio.file.InvalidPathException}.
 */
@Getter
public class ProjectPathRooter implements PathRooter {

    private final Path projectDir;

    public ProjectPathRooter(@NonNull Path projectDir) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
    }

    @Override
    public String makeRooted(@NonNull String path) {
        String portable = path.replace('\\', '/');
        Path candidate = Path.of(portable);
        Path rooted = candidate.isAbsolute() ? candidate : projectDir.resolve(candidate);
        return rooted.normalize().toString();
    }
}
