package com.ddpport.platform;

import com.ddpport.platform.tiktok.TikTokPlatform;
import com.ddpport.platform.youtube.YouTubePlatform;

import java.util.List;

/**
 * Platforms offered to participants, in the order they are asked for.
 */
public final class Platforms {
    private Platforms() {
    }

    public static List<Platform> defaults(int chunkSize) {
        return List.of(new YouTubePlatform(), new TikTokPlatform(chunkSize));
    }
}
