package com.example.captionbot_backend.engine.Interfaces;

import com.example.captionbot_backend.dto.caption.CaptionTrack;
import com.example.captionbot_backend.engine.CaptionApiException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;

/**
 * Low level access to the primary captions API. Implementations throw {@link CaptionApiException}
 * with a reason the adapter can classify; they never return partial data.
 */
public interface CaptionApiClient {

    /**
     * Enumerates all caption tracks of a video, manual and generated, in the order the API lists them.
     */
    List<CaptionTrack> listTracks(String videoId, Duration timeout);

    /**
     * Downloads one track and returns its payload as a tree; entry shape depends on the track format.
     */
    JsonNode fetchTrack(CaptionTrack track, Duration timeout);
}
