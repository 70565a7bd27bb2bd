package com.playbackadvisor.session;

import com.playbackadvisor.client.ClientRegistry.ClientRegistration;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlayMethod;

/**
 * A playback start reported by the host.
 *
 * @param transcodeReasons host-reported reasons, free text; empty when none
 */
public record PlaybackStart(
    ClientRegistration client,
    MediaCharacteristics media,
    String playSessionId,
    PlayMethod playMethod,
    String transcodeReasons
) {
}
