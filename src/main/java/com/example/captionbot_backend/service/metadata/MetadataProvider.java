package com.example.captionbot_backend.service.metadata;

import java.util.Optional;

public interface MetadataProvider {

    /**
     * @return partial metadata, empty when the source knows nothing about the video
     * @throws MetadataAccessException when the source could not be reached
     */
    Optional<MetadataResult> resolve(String videoId);
}
