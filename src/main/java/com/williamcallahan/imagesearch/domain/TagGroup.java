package com.williamcallahan.imagesearch.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Probe images sharing one tag, usually the folder that contains them.
 *
 * @param tag group name, also the output subdirectory
 * @param images probe image files in embedding order
 */
public record TagGroup(String tag, List<Path> images) {

    public TagGroup {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag is required");
        }
        images = images == null ? List.of() : List.copyOf(images);
    }
}
